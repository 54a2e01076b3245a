package com.mogu.ranking.features;

import java.util.Arrays;

public final class FeatureVector {
    private final double[] values;

    FeatureVector(double[] values) {
        this.values = values;
    }

    public static FeatureVector of(double... values) {
        return new FeatureVector(values.clone());
    }

    public int dimension() {
        return values.length;
    }

    public double get(int index) {
        return values[index];
    }

    public double dot(FeatureVector other) {
        if (other.values.length != values.length) {
            throw new IllegalStateException(
                "feature vector dimension mismatch: " + values.length + " != " + other.values.length
            );
        }
        double sum = 0.0;
        for (int i = 0; i < values.length; i++) {
            sum += values[i] * other.values[i];
        }
        return sum;
    }

    public double norm() {
        return Math.sqrt(dot(this));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FeatureVector that)) {
            return false;
        }
        return Arrays.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return Arrays.toString(values);
    }
}
