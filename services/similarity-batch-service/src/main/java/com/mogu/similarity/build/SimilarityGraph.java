package com.mogu.similarity.build;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

public final class SimilarityGraph {
    private final SortedMap<String, List<NeighborEntry>> neighbors;

    SimilarityGraph(Map<String, List<NeighborEntry>> neighbors) {
        TreeMap<String, List<NeighborEntry>> copy = new TreeMap<>();
        for (Map.Entry<String, List<NeighborEntry>> entry : neighbors.entrySet()) {
            copy.put(entry.getKey(), List.copyOf(entry.getValue()));
        }
        this.neighbors = Collections.unmodifiableSortedMap(copy);
    }

    public static SimilarityGraph empty() {
        return new SimilarityGraph(Map.of());
    }

    public List<NeighborEntry> neighborsOf(String itemId) {
        return neighbors.getOrDefault(itemId, List.of());
    }

    public int itemCount() {
        return neighbors.size();
    }

    public boolean isEmpty() {
        return neighbors.isEmpty();
    }

    public List<SimilarityRow> toRows() {
        List<SimilarityRow> rows = new ArrayList<>();
        for (Map.Entry<String, List<NeighborEntry>> entry : neighbors.entrySet()) {
            for (NeighborEntry neighbor : entry.getValue()) {
                if (entry.getKey().equals(neighbor.neighborId())) {
                    continue;
                }
                rows.add(new SimilarityRow(
                    entry.getKey(),
                    neighbor.neighborId(),
                    neighbor.similarity(),
                    neighbor.commonUsers()
                ));
            }
        }
        return rows;
    }
}
