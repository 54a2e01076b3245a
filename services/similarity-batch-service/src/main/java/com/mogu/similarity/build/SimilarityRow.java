package com.mogu.similarity.build;

public record SimilarityRow(String sourceId, String neighborId, double similarity, int commonUsers) {
}
