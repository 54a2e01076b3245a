package com.mogu.ranking.features;

import com.mogu.ranking.candidate.CandidateListing;
import com.mogu.ranking.profile.UserProfileFeatures;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

@Component
public class FeatureVectorBuilder {
    private final FeatureVocabulary vocabulary;

    public FeatureVectorBuilder(FeatureVocabulary vocabulary) {
        this.vocabulary = vocabulary;
    }

    public int dimension() {
        return vocabulary.dimension();
    }

    public FeatureVector buildUserVector(UserProfileFeatures profile) {
        double[] values = new double[vocabulary.dimension()];
        for (String category : profile.interestedCategories()) {
            setIfKnown(values, vocabulary.categorySlot(category));
        }
        for (String market : profile.preferredMarkets()) {
            setIfKnown(values, vocabulary.marketSlot(market));
        }
        List<Double> hours = profile.hourlyPreferences();
        int hourCount = Math.min(hours.size(), FeatureVocabulary.HOUR_SLOTS);
        for (int hour = 0; hour < hourCount; hour++) {
            values[vocabulary.hourSlot(hour)] = clamp01(hours.get(hour));
        }
        return new FeatureVector(values);
    }

    public FeatureVector buildListingVector(CandidateListing listing) {
        double[] values = new double[vocabulary.dimension()];
        setIfKnown(values, vocabulary.categorySlot(listing.category()));
        setIfKnown(values, vocabulary.marketSlot(listing.market()));
        if (listing.hour() != null) {
            values[vocabulary.hourSlot(listing.hour())] = 1.0;
        }
        return new FeatureVector(values);
    }

    public List<FeatureVector> buildListingVectors(List<CandidateListing> listings) {
        List<FeatureVector> vectors = new ArrayList<>(listings.size());
        for (CandidateListing listing : listings) {
            vectors.add(buildListingVector(listing));
        }
        return vectors;
    }

    private static void setIfKnown(double[] values, int slot) {
        if (slot >= 0) {
            values[slot] = 1.0;
        }
    }

    private static double clamp01(double value) {
        if (Double.isNaN(value) || value <= 0.0) {
            return 0.0;
        }
        return Math.min(1.0, value);
    }
}
