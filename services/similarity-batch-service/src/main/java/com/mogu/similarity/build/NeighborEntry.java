package com.mogu.similarity.build;

public record NeighborEntry(String neighborId, double similarity, int commonUsers) {
}
