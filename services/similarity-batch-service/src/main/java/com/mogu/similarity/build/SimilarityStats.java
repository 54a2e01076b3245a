package com.mogu.similarity.build;

import com.mogu.similarity.interaction.UserItemInteraction;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

public record SimilarityStats(
    int interactions,
    int users,
    int items,
    int itemsWithNeighbors,
    int rows,
    double meanSimilarity,
    double maxSimilarity,
    double meanCommonUsers
) {
    public static SimilarityStats of(
        List<UserItemInteraction> interactions,
        SimilarityGraph graph,
        List<SimilarityRow> rows
    ) {
        Set<String> users = new HashSet<>();
        Set<String> items = new HashSet<>();
        for (UserItemInteraction interaction : interactions) {
            users.add(interaction.userId());
            items.add(interaction.itemId());
        }
        double simSum = 0.0;
        double simMax = 0.0;
        long commonSum = 0L;
        for (SimilarityRow row : rows) {
            simSum += row.similarity();
            simMax = Math.max(simMax, row.similarity());
            commonSum += row.commonUsers();
        }
        int count = rows.size();
        return new SimilarityStats(
            interactions.size(),
            users.size(),
            items.size(),
            graph.itemCount(),
            count,
            count == 0 ? 0.0 : simSum / count,
            simMax,
            count == 0 ? 0.0 : (double) commonSum / count
        );
    }

    public double neighborCoverage() {
        return items == 0 ? 0.0 : (double) itemsWithNeighbors / items;
    }
}
