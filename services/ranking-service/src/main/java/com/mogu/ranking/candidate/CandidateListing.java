package com.mogu.ranking.candidate;

import java.time.Instant;

public record CandidateListing(
    String id,
    String hostId,
    String category,
    String market,
    Instant scheduledAt,
    Integer hour,
    double distanceKm,
    Instant createdAt,
    double reputation
) {}
