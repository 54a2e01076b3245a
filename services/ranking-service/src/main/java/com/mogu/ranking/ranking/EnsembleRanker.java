package com.mogu.ranking.ranking;

import com.mogu.ranking.candidate.CandidateListing;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.springframework.stereotype.Component;

@Component
public class EnsembleRanker {

    // final desc, created_at desc, distance asc, reputation desc
    static final Comparator<ScoredListing> HYBRID_ORDER =
        Comparator.comparingDouble(ScoredListing::finalScore).reversed()
            .thenComparing((ScoredListing entry) -> entry.listing().createdAt(), Comparator.reverseOrder())
            .thenComparingDouble(entry -> entry.listing().distanceKm())
            .thenComparing(
                Comparator.comparingDouble((ScoredListing entry) -> entry.listing().reputation()).reversed()
            );

    static final Comparator<ScoredListing> RECENT_ORDER =
        Comparator.comparing((ScoredListing entry) -> entry.listing().createdAt(), Comparator.reverseOrder())
            .thenComparingDouble(entry -> entry.listing().distanceKm());

    static final Comparator<ScoredListing> DISTANCE_ORDER =
        Comparator.comparingDouble((ScoredListing entry) -> entry.listing().distanceKm())
            .thenComparing((ScoredListing entry) -> entry.listing().createdAt(), Comparator.reverseOrder());

    public List<ScoredListing> combine(
        List<CandidateListing> candidates,
        double[] v0,
        double[] v1,
        EnsembleWeights weights
    ) {
        if (v0.length != candidates.size() || v1.length != candidates.size()) {
            throw new IllegalStateException(
                "score arrays do not match candidates: v0=" + v0.length + " v1=" + v1.length
                    + " candidates=" + candidates.size()
            );
        }
        List<ScoredListing> scored = new ArrayList<>(candidates.size());
        for (int i = 0; i < candidates.size(); i++) {
            scored.add(new ScoredListing(candidates.get(i), v0[i], v1[i], weights.blend(v0[i], v1[i])));
        }
        return scored;
    }

    public List<ScoredListing> order(List<ScoredListing> scored, SortMode mode) {
        List<ScoredListing> ordered = new ArrayList<>(scored);
        ordered.sort(comparatorFor(mode));
        return ordered;
    }

    public RankedPage paginate(List<ScoredListing> ordered, int page, int size) {
        int total = ordered.size();
        long offset = (long) (page - 1) * size;
        if (page < 1 || size < 1 || offset >= total) {
            return new RankedPage(List.of(), total, page, size);
        }
        int from = (int) offset;
        int to = (int) Math.min(total, offset + size);
        return new RankedPage(List.copyOf(ordered.subList(from, to)), total, page, size);
    }

    private Comparator<ScoredListing> comparatorFor(SortMode mode) {
        if (mode == SortMode.RECENT) {
            return RECENT_ORDER;
        }
        if (mode == SortMode.DISTANCE) {
            return DISTANCE_ORDER;
        }
        return HYBRID_ORDER;
    }
}
