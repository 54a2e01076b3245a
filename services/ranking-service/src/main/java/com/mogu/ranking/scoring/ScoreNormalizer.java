package com.mogu.ranking.scoring;

import com.mogu.ranking.features.FeatureVector;
import java.util.List;

public final class ScoreNormalizer {
    public static final double EPSILON = 1e-9;

    private ScoreNormalizer() {
    }

    public static double[] minMax(double[] scores) {
        double[] normalized = new double[scores.length];
        if (scores.length == 0) {
            return normalized;
        }
        double lo = Double.POSITIVE_INFINITY;
        double hi = Double.NEGATIVE_INFINITY;
        for (double score : scores) {
            lo = Math.min(lo, score);
            hi = Math.max(hi, score);
        }
        double range = hi - lo;
        if (range < EPSILON) {
            return normalized;
        }
        for (int i = 0; i < scores.length; i++) {
            normalized[i] = (scores[i] - lo) / range;
        }
        return normalized;
    }

    public static double[] cosine(FeatureVector user, List<FeatureVector> listings) {
        double userNorm = user.norm() + EPSILON;
        double[] similarities = new double[listings.size()];
        for (int i = 0; i < listings.size(); i++) {
            FeatureVector listing = listings.get(i);
            similarities[i] = user.dot(listing) / ((listing.norm() + EPSILON) * userNorm);
        }
        return similarities;
    }

    public static ScoreStats stats(double[] scores) {
        int nonZero = 0;
        double sum = 0.0;
        double max = 0.0;
        for (double score : scores) {
            if (score > 0.0) {
                nonZero++;
                sum += score;
            }
            max = Math.max(max, score);
        }
        return new ScoreStats(scores.length, nonZero, nonZero == 0 ? 0.0 : sum / nonZero, max);
    }

    public record ScoreStats(int count, int nonZero, double averageNonZero, double max) {}
}
