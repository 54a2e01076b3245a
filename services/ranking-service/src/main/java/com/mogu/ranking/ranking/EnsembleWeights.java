package com.mogu.ranking.ranking;

public record EnsembleWeights(double w0, double w1, double baseW1, double coverageFactor) {
    public static EnsembleWeights resolve(
        double historyStrength,
        double coverage,
        double w1Min,
        double w1Max,
        double coverageThreshold
    ) {
        double s = clamp01(historyStrength);
        double baseW1 = w1Min + (w1Max - w1Min) * s;
        double factor = 1.0;
        if (coverageThreshold > 0.0 && coverage < coverageThreshold) {
            factor = Math.min(1.0, clamp01(coverage) / coverageThreshold);
        }
        double w1 = baseW1 * factor;
        return new EnsembleWeights(1.0 - w1, w1, baseW1, factor);
    }

    public double blend(double v0, double v1) {
        return w0 * v0 + w1 * v1;
    }

    private static double clamp01(double value) {
        if (Double.isNaN(value) || value <= 0.0) {
            return 0.0;
        }
        return Math.min(1.0, value);
    }
}
