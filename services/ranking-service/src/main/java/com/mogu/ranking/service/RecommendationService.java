package com.mogu.ranking.service;

import com.mogu.ranking.candidate.CandidateListing;
import com.mogu.ranking.candidate.CandidateQuery;
import com.mogu.ranking.candidate.CandidateRepository;
import com.mogu.ranking.history.HistoryStrengthEstimator;
import com.mogu.ranking.history.InteractionRecord;
import com.mogu.ranking.history.InteractionRepository;
import com.mogu.ranking.profile.UserProfileFeatures;
import com.mogu.ranking.profile.UserProfileRepository;
import com.mogu.ranking.ranking.EnsembleRanker;
import com.mogu.ranking.ranking.EnsembleWeights;
import com.mogu.ranking.ranking.RankedPage;
import com.mogu.ranking.ranking.ScoredListing;
import com.mogu.ranking.ranking.SortMode;
import com.mogu.ranking.scoring.CollaborativeScorer;
import com.mogu.ranking.scoring.ContentScorer;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class RecommendationService {
    private static final Logger log = LoggerFactory.getLogger(RecommendationService.class);

    private final CandidateRepository candidateRepository;
    private final UserProfileRepository profileRepository;
    private final InteractionRepository interactionRepository;
    private final HistoryStrengthEstimator historyStrengthEstimator;
    private final ContentScorer contentScorer;
    private final CollaborativeScorer collaborativeScorer;
    private final EnsembleRanker ranker;
    private final RecommendationProperties properties;
    private final MeterRegistry meterRegistry;

    public RecommendationService(
        CandidateRepository candidateRepository,
        UserProfileRepository profileRepository,
        InteractionRepository interactionRepository,
        HistoryStrengthEstimator historyStrengthEstimator,
        ContentScorer contentScorer,
        CollaborativeScorer collaborativeScorer,
        EnsembleRanker ranker,
        RecommendationProperties properties,
        MeterRegistry meterRegistry
    ) {
        this.candidateRepository = candidateRepository;
        this.profileRepository = profileRepository;
        this.interactionRepository = interactionRepository;
        this.historyStrengthEstimator = historyStrengthEstimator;
        this.contentScorer = contentScorer;
        this.collaborativeScorer = collaborativeScorer;
        this.ranker = ranker;
        this.properties = properties;
        this.meterRegistry = meterRegistry;
    }

    public RecommendationResult recommend(RecommendationRequest request) {
        long started = System.nanoTime();
        meterRegistry.counter("rs_recommend_requests_total").increment();
        List<String> reasonCodes = new ArrayList<>();

        SortMode sort = request.sort() == null ? SortMode.AI_RECOMMENDED : request.sort();
        int page = Math.max(1, request.page());
        int size = resolveSize(request.size(), reasonCodes);
        double radiusKm = resolveRadius(request.radiusKm(), reasonCodes);
        UUID userId = request.userId();

        log.info(
            "recommendation_started user_id={} category={} market={} radius_km={} sort={}",
            userId == null ? "anonymous" : userId,
            request.category(),
            request.market(),
            radiusKm,
            sort.param()
        );

        CandidateQuery query = new CandidateQuery(
            request.latitude(),
            request.longitude(),
            radiusKm,
            trimToNull(request.category()),
            trimToNull(request.market())
        );
        List<CandidateListing> candidates = fetchCandidates(query, reasonCodes);
        if (candidates.isEmpty()) {
            meterRegistry.counter("rs_recommend_empty_total").increment();
            log.info("recommendation_completed total=0 page={} reason=no_candidates", page);
            recordLatency(started);
            return new RecommendationResult(RankedPage.empty(page, size), sort, null, 0.0, 0.0, 0, reasonCodes);
        }
        log.info("candidates_loaded count={}", candidates.size());

        RecommendationResult result;
        if (sort == SortMode.AI_RECOMMENDED) {
            result = rankHybrid(candidates, userId, page, size, reasonCodes);
        } else {
            reasonCodes.add("sort_" + sort.param());
            List<ScoredListing> unscored = ranker.combine(
                candidates,
                new double[candidates.size()],
                new double[candidates.size()],
                EnsembleWeights.resolve(0.0, 0.0, 0.0, 0.0, 0.0)
            );
            RankedPage ranked = ranker.paginate(ranker.order(unscored, sort), page, size);
            result = new RecommendationResult(ranked, sort, null, 0.0, 0.0, candidates.size(), reasonCodes);
        }

        log.info(
            "recommendation_completed total={} page={} returned={}",
            result.page().total(),
            page,
            result.page().items().size()
        );
        recordLatency(started);
        return result;
    }

    private RecommendationResult rankHybrid(
        List<CandidateListing> candidates,
        UUID userId,
        int page,
        int size,
        List<String> reasonCodes
    ) {
        UserProfileFeatures profile = null;
        List<String> historyIds = List.of();
        List<InteractionRecord> interactions = List.of();
        if (userId == null) {
            reasonCodes.add("anonymous");
        } else {
            profile = fetchProfile(userId, reasonCodes);
            historyIds = fetchHistoryIds(userId, reasonCodes);
            interactions = fetchInteractions(userId, reasonCodes);
        }

        double[] v0 = scoreContent(profile, candidates, reasonCodes);

        if (userId != null && historyIds.isEmpty()) {
            reasonCodes.add("history_empty");
            log.info("V1 disabled: user has no history");
        } else if (!historyIds.isEmpty()) {
            log.info("user_history items={}", historyIds.size());
        }
        CollaborativeScorer.CfScores cf = collaborativeScorer.score(historyIds, candidates);
        if (!cf.available()) {
            reasonCodes.add("cf_unavailable");
        }

        double strength = historyStrengthEstimator.estimate(interactions);
        EnsembleWeights weights = EnsembleWeights.resolve(
            strength,
            cf.coverage(),
            properties.getW1Min(),
            properties.getW1Max(),
            properties.getCoverageThreshold()
        );
        if (weights.coverageFactor() < 1.0) {
            reasonCodes.add("cf_coverage_scaled");
        }
        log.info(
            "hybrid_ensemble history_strength={} cf_coverage={} w0={} w1={}",
            String.format("%.3f", strength),
            String.format("%.3f", cf.coverage()),
            String.format("%.3f", weights.w0()),
            String.format("%.3f", weights.w1())
        );

        List<ScoredListing> scored = ranker.combine(candidates, v0, cf.normalized(), weights);
        List<ScoredListing> ordered = ranker.order(scored, SortMode.AI_RECOMMENDED);
        RankedPage ranked = ranker.paginate(ordered, page, size);
        logPageScores(ranked);

        return new RecommendationResult(
            ranked,
            SortMode.AI_RECOMMENDED,
            weights,
            strength,
            cf.coverage(),
            candidates.size(),
            reasonCodes
        );
    }

    private double[] scoreContent(
        UserProfileFeatures profile,
        List<CandidateListing> candidates,
        List<String> reasonCodes
    ) {
        try {
            return contentScorer.score(profile, candidates);
        } catch (RuntimeException ex) {
            reasonCodes.add("v0_failed");
            log.warn("V0 scoring failed; continuing with zero content scores", ex);
            return new double[candidates.size()];
        }
    }

    private List<CandidateListing> fetchCandidates(CandidateQuery query, List<String> reasonCodes) {
        try {
            return candidateRepository.fetchCandidates(query, Math.max(1, properties.getCandidateLimit()));
        } catch (RuntimeException ex) {
            reasonCodes.add("candidates_unavailable");
            log.error("candidate lookup failed; returning empty feed", ex);
            return List.of();
        }
    }

    private UserProfileFeatures fetchProfile(UUID userId, List<String> reasonCodes) {
        try {
            Optional<UserProfileFeatures> profile = profileRepository.findProfile(userId);
            if (profile.isEmpty()) {
                reasonCodes.add("profile_missing");
            }
            return profile.orElse(null);
        } catch (RuntimeException ex) {
            reasonCodes.add("profile_unavailable");
            log.warn("profile lookup failed user_id={} error={}", userId, ex.getMessage());
            return null;
        }
    }

    private List<String> fetchHistoryIds(UUID userId, List<String> reasonCodes) {
        try {
            return interactionRepository.fetchHistoryIds(userId, Math.max(1, properties.getHistoryLimit()));
        } catch (RuntimeException ex) {
            reasonCodes.add("history_unavailable");
            log.warn("history lookup failed user_id={} error={}", userId, ex.getMessage());
            return List.of();
        }
    }

    private List<InteractionRecord> fetchInteractions(UUID userId, List<String> reasonCodes) {
        try {
            return interactionRepository.fetchWeightedInteractions(
                userId,
                Math.max(1, properties.getInteractionLimit())
            );
        } catch (RuntimeException ex) {
            reasonCodes.add("interactions_unavailable");
            log.warn("interaction lookup failed user_id={} error={}", userId, ex.getMessage());
            return List.of();
        }
    }

    private int resolveSize(Integer requested, List<String> reasonCodes) {
        int size = requested == null ? properties.getDefaultPageSize() : Math.max(1, requested);
        if (size > properties.getMaxPageSize()) {
            size = properties.getMaxPageSize();
            reasonCodes.add("size_capped");
        }
        return size;
    }

    private double resolveRadius(Double requested, List<String> reasonCodes) {
        double radius = requested == null || !(requested > 0.0) ? properties.getDefaultRadiusKm() : requested;
        if (radius > properties.getMaxRadiusKm()) {
            radius = properties.getMaxRadiusKm();
            reasonCodes.add("radius_capped");
        }
        return radius;
    }

    private void logPageScores(RankedPage ranked) {
        if (!log.isDebugEnabled() || ranked.items().isEmpty()) {
            return;
        }
        StringBuilder table = new StringBuilder();
        table.append("page ").append(ranked.page()).append(" scores\n");
        int rank = (ranked.page() - 1) * ranked.size();
        for (ScoredListing entry : ranked.items()) {
            rank++;
            table.append(String.format(
                "[%3d] %s | final=%.4f (v0=%.4f, v1=%.4f) | %s @ %s | %.2fkm%n",
                rank,
                entry.id(),
                entry.finalScore(),
                entry.v0(),
                entry.v1(),
                entry.listing().category(),
                entry.listing().market(),
                entry.listing().distanceKm()
            ));
        }
        log.debug(table.toString());
    }

    private void recordLatency(long started) {
        meterRegistry.timer("rs_recommend_latency").record(System.nanoTime() - started, TimeUnit.NANOSECONDS);
    }

    private String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
