package com.mogu.ranking.scoring;

import com.mogu.ranking.candidate.CandidateListing;
import com.mogu.ranking.features.FeatureVector;
import com.mogu.ranking.features.FeatureVectorBuilder;
import com.mogu.ranking.profile.UserProfileFeatures;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class ContentScorer {
    private static final Logger log = LoggerFactory.getLogger(ContentScorer.class);

    private final FeatureVectorBuilder vectorBuilder;

    public ContentScorer(FeatureVectorBuilder vectorBuilder) {
        this.vectorBuilder = vectorBuilder;
    }

    public double[] score(UserProfileFeatures profile, List<CandidateListing> candidates) {
        if (candidates.isEmpty()) {
            return new double[0];
        }
        if (profile == null) {
            log.info("V0 disabled: user vector not available");
            return new double[candidates.size()];
        }
        FeatureVector user = vectorBuilder.buildUserVector(profile);
        List<FeatureVector> listings = vectorBuilder.buildListingVectors(candidates);
        double[] v0 = ScoreNormalizer.minMax(ScoreNormalizer.cosine(user, listings));

        ScoreNormalizer.ScoreStats stats = ScoreNormalizer.stats(v0);
        if (stats.nonZero() > 0) {
            log.info(
                "V0 scores nonzero={}/{} avg={} max={}",
                stats.nonZero(),
                stats.count(),
                String.format("%.3f", stats.averageNonZero()),
                String.format("%.3f", stats.max())
            );
        } else {
            log.info("V0 scores all zero (no matching features)");
        }
        return v0;
    }
}
