package com.mogu.similarity.build;

import com.mogu.similarity.config.SimilarityBatchProperties;
import com.mogu.similarity.interaction.UserItemInteraction;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Item-item cosine similarity over weighted user interactions with Bayesian confidence smoothing.
 *
 * <pre>
 * cos(i, j)   = sum_u(w_ui * w_uj) / (|w_i| * |w_j|)
 * smoothed    = common / (common + lambda) * cos(i, j)
 * </pre>
 *
 * Pairs with fewer than {@code minCommon} common users, or whose smoothed similarity is below
 * {@code minSim}, are dropped. Each listing keeps its {@code topK} best neighbors.
 */
@Component
public class ItemSimilarityCalculator {
    static final Comparator<NeighborEntry> NEIGHBOR_ORDER =
        Comparator.comparingDouble(NeighborEntry::similarity).reversed()
            .thenComparing(NeighborEntry::neighborId);

    private final SimilarityBatchProperties properties;

    public ItemSimilarityCalculator(SimilarityBatchProperties properties) {
        this.properties = properties;
    }

    public SimilarityGraph build(List<UserItemInteraction> interactions) {
        if (interactions == null || interactions.isEmpty()) {
            return SimilarityGraph.empty();
        }

        Map<String, List<UserItemInteraction>> byUser = new LinkedHashMap<>();
        Map<String, Double> squaredNorms = new HashMap<>();
        for (UserItemInteraction interaction : interactions) {
            byUser.computeIfAbsent(interaction.userId(), key -> new ArrayList<>()).add(interaction);
            squaredNorms.merge(interaction.itemId(), interaction.weight() * interaction.weight(), Double::sum);
        }

        Map<ItemPair, PairAccumulator> pairs = new HashMap<>();
        for (List<UserItemInteraction> items : byUser.values()) {
            int size = items.size();
            for (int a = 0; a < size; a++) {
                UserItemInteraction left = items.get(a);
                for (int b = a + 1; b < size; b++) {
                    UserItemInteraction right = items.get(b);
                    if (left.itemId().equals(right.itemId())) {
                        continue;
                    }
                    pairs.computeIfAbsent(ItemPair.of(left.itemId(), right.itemId()), key -> new PairAccumulator())
                        .add(left.weight() * right.weight());
                }
            }
        }

        int minCommon = properties.getMinCommon();
        double minSim = properties.getMinSim();
        double lambda = properties.getLambda();
        Map<String, List<NeighborEntry>> neighbors = new HashMap<>();
        for (Map.Entry<ItemPair, PairAccumulator> entry : pairs.entrySet()) {
            ItemPair pair = entry.getKey();
            PairAccumulator acc = entry.getValue();
            if (acc.common < minCommon) {
                continue;
            }
            double normFirst = Math.sqrt(squaredNorms.getOrDefault(pair.first(), 0.0));
            double normSecond = Math.sqrt(squaredNorms.getOrDefault(pair.second(), 0.0));
            if (normFirst == 0.0 || normSecond == 0.0) {
                continue;
            }
            double smoothed = smooth(acc.dot / (normFirst * normSecond), acc.common, lambda);
            if (smoothed < minSim) {
                continue;
            }
            neighbors.computeIfAbsent(pair.first(), key -> new ArrayList<>())
                .add(new NeighborEntry(pair.second(), smoothed, acc.common));
            neighbors.computeIfAbsent(pair.second(), key -> new ArrayList<>())
                .add(new NeighborEntry(pair.first(), smoothed, acc.common));
        }

        int topK = Math.max(1, properties.getTopK());
        for (Map.Entry<String, List<NeighborEntry>> entry : neighbors.entrySet()) {
            List<NeighborEntry> list = entry.getValue();
            list.sort(NEIGHBOR_ORDER);
            if (list.size() > topK) {
                entry.setValue(new ArrayList<>(list.subList(0, topK)));
            }
        }
        return new SimilarityGraph(neighbors);
    }

    public static double smooth(double cosine, int commonUsers, double lambda) {
        if (commonUsers <= 0) {
            return 0.0;
        }
        return (commonUsers / (commonUsers + lambda)) * cosine;
    }

    record ItemPair(String first, String second) {
        static ItemPair of(String a, String b) {
            return a.compareTo(b) < 0 ? new ItemPair(a, b) : new ItemPair(b, a);
        }
    }

    private static final class PairAccumulator {
        private double dot;
        private int common;

        void add(double product) {
            dot += product;
            common++;
        }
    }
}
