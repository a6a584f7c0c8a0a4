package com.wildcam.alerts.model;

/**
 * Output of pattern matching: a confidence and whether the detection looks like a known false positive.
 */
public record FalsePositivePrediction(double confidence, boolean falsePositive) {

    public static FalsePositivePrediction neutral() {
        return new FalsePositivePrediction(0.5, false);
    }
}
