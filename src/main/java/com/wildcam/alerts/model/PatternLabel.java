package com.wildcam.alerts.model;

public enum PatternLabel {
    FALSE_POSITIVE,
    TRUE_POSITIVE;

    public static PatternLabel of(boolean isFalsePositive) {
        return isFalsePositive ? FALSE_POSITIVE : TRUE_POSITIVE;
    }
}
