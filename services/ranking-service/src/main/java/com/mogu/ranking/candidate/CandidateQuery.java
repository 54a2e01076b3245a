package com.mogu.ranking.candidate;

public record CandidateQuery(
    double latitude,
    double longitude,
    double radiusKm,
    String category,
    String market
) {}
