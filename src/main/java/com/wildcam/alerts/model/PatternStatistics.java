package com.wildcam.alerts.model;

public record PatternStatistics(int falsePositivePatterns, int truePositivePatterns, int capacity) {

    public int totalPatterns() {
        return falsePositivePatterns + truePositivePatterns;
    }
}
