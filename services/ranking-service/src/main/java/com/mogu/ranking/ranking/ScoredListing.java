package com.mogu.ranking.ranking;

import com.mogu.ranking.candidate.CandidateListing;

public record ScoredListing(
    CandidateListing listing,
    double v0,
    double v1,
    double finalScore
) {
    public String id() {
        return listing.id();
    }
}
