package com.mogu.ranking.scoring;

import com.mogu.ranking.candidate.CandidateListing;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class CollaborativeScorer {
    private static final Logger log = LoggerFactory.getLogger(CollaborativeScorer.class);

    private final ItemSimilarityRepository similarityRepository;
    private final MeterRegistry meterRegistry;

    public CollaborativeScorer(ItemSimilarityRepository similarityRepository, MeterRegistry meterRegistry) {
        this.similarityRepository = similarityRepository;
        this.meterRegistry = meterRegistry;
    }

    public CfScores score(List<String> historyIds, List<CandidateListing> candidates) {
        int n = candidates.size();
        if (n == 0 || historyIds == null || historyIds.isEmpty()) {
            return CfScores.zeros(n, true);
        }

        List<String> candidateIds = new ArrayList<>(n);
        for (CandidateListing candidate : candidates) {
            candidateIds.add(candidate.id());
        }

        Map<String, Double> similarities;
        try {
            similarities = similarityRepository.fetchSimilarity(candidateIds, historyIds);
        } catch (RuntimeException ex) {
            meterRegistry.counter("rs_cf_fallback_total").increment();
            log.warn("V1 disabled: item_item_sim not available - {}", ex.getMessage());
            return CfScores.zeros(n, false);
        }

        double[] raw = new double[n];
        int covered = 0;
        for (int i = 0; i < n; i++) {
            Double score = similarities.get(candidateIds.get(i));
            raw[i] = score == null ? 0.0 : score;
            if (raw[i] > 0.0) {
                covered++;
            }
        }

        if (covered == 0) {
            log.info("V1 enabled but no similarity scores found");
        } else {
            ScoreNormalizer.ScoreStats stats = ScoreNormalizer.stats(raw);
            log.info(
                "V1 raw scores nonzero={}/{} avg={} max={}",
                stats.nonZero(),
                stats.count(),
                String.format("%.3f", stats.averageNonZero()),
                String.format("%.3f", stats.max())
            );
        }
        return new CfScores(raw, ScoreNormalizer.minMax(raw), (double) covered / n, true);
    }

    public record CfScores(double[] raw, double[] normalized, double coverage, boolean available) {
        static CfScores zeros(int n, boolean available) {
            return new CfScores(new double[n], new double[n], 0.0, available);
        }
    }
}
