package com.wildcam.alerts.model;

import java.util.Arrays;

/**
 * Fixed-length numeric representation of a detection.
 *
 * Layout:
 *   [0] detection confidence
 *   [1] hour of day / 24
 *   [2] day flag (1.0 between 06:00 and 18:59)
 *   [3] temperature / 50
 *   [4] humidity / 100
 *   [5] wind speed / 50
 *   [6] motion level
 *   [7] motion duration / 10
 *   [8] dangerous-species flag
 */
public final class FeatureVector {

    public static final int LENGTH = 9;

    private final double[] values;

    public FeatureVector(double[] values) {
        if (values == null || values.length != LENGTH) {
            throw new IllegalArgumentException("Feature vector must have exactly " + LENGTH + " values");
        }
        this.values = values.clone();
    }

    public static FeatureVector of(double... values) {
        return new FeatureVector(values);
    }

    public double get(int index) {
        return values[index];
    }

    public int length() {
        return LENGTH;
    }

    public double norm() {
        double sum = 0.0;
        for (double v : values) {
            sum += v * v;
        }
        return Math.sqrt(sum);
    }

    public double dot(FeatureVector other) {
        double sum = 0.0;
        for (int i = 0; i < LENGTH; i++) {
            sum += values[i] * other.values[i];
        }
        return sum;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FeatureVector)) return false;
        return Arrays.equals(values, ((FeatureVector) o).values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "FeatureVector" + Arrays.toString(values);
    }
}
