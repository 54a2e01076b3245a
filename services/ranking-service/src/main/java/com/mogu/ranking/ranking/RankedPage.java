package com.mogu.ranking.ranking;

import java.util.List;

public record RankedPage(List<ScoredListing> items, int total, int page, int size) {
    public static RankedPage empty(int page, int size) {
        return new RankedPage(List.of(), 0, page, size);
    }
}
