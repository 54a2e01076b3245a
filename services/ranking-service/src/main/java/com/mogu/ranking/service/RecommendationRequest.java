package com.mogu.ranking.service;

import com.mogu.ranking.ranking.SortMode;
import java.util.UUID;

public record RecommendationRequest(
    double latitude,
    double longitude,
    Double radiusKm,
    String category,
    String market,
    SortMode sort,
    int page,
    Integer size,
    UUID userId
) {}
