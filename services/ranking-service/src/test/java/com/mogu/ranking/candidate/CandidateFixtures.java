package com.mogu.ranking.candidate;

import java.time.Instant;

public final class CandidateFixtures {
    public static final Instant BASE_TIME = Instant.parse("2025-10-01T00:00:00Z");

    private CandidateFixtures() {
    }

    public static CandidateListing listing(String id, String category, String market, Integer hour) {
        return listing(id, category, market, hour, BASE_TIME, 1.0, 0.5);
    }

    public static CandidateListing listing(
        String id,
        String category,
        String market,
        Integer hour,
        Instant createdAt,
        double distanceKm,
        double reputation
    ) {
        return new CandidateListing(
            id,
            "host-" + id,
            category,
            market,
            BASE_TIME.plusSeconds(86_400),
            hour,
            distanceKm,
            createdAt,
            reputation
        );
    }
}
