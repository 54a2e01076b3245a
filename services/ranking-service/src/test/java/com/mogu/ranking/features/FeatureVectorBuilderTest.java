package com.mogu.ranking.features;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.mogu.ranking.candidate.CandidateFixtures;
import com.mogu.ranking.profile.UserProfileFeatures;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class FeatureVectorBuilderTest {

    private final FeatureVocabulary vocabulary = new FeatureVocabulary(
        List.of("food", "household"),
        List.of("costco", "emart", "etc")
    );
    private final FeatureVectorBuilder builder = new FeatureVectorBuilder(vocabulary);

    @Test
    void dimensionIsCategoriesPlusMarketsPlusHours() {
        assertThat(builder.dimension()).isEqualTo(2 + 3 + 24);
        assertThat(new FeatureVocabulary(new FeatureProperties()).dimension()).isEqualTo(38);
    }

    @Test
    void userVectorIsMultiHotWithClampedHours() {
        List<Double> hours = new ArrayList<>(Collections.nCopies(24, 0.0));
        hours.set(9, 1.0);
        hours.set(18, 3.0);
        hours.set(20, -1.0);
        UserProfileFeatures profile = new UserProfileFeatures(
            Set.of("food", "household", "unknown"),
            Set.of("emart"),
            hours
        );

        FeatureVector vector = builder.buildUserVector(profile);

        assertThat(vector.dimension()).isEqualTo(29);
        assertThat(vector.get(0)).isEqualTo(1.0);
        assertThat(vector.get(1)).isEqualTo(1.0);
        assertThat(vector.get(2)).isEqualTo(0.0);
        assertThat(vector.get(3)).isEqualTo(1.0);
        assertThat(vector.get(4)).isEqualTo(0.0);
        assertThat(vector.get(5 + 9)).isEqualTo(1.0);
        assertThat(vector.get(5 + 18)).isEqualTo(1.0);
        assertThat(vector.get(5 + 20)).isEqualTo(0.0);
    }

    @Test
    void emptyProfileYieldsZeroVector() {
        FeatureVector vector = builder.buildUserVector(new UserProfileFeatures(null, null, null));

        assertThat(vector.norm()).isZero();
        assertThat(vector.dimension()).isEqualTo(29);
    }

    @Test
    void listingVectorIsOneHotPerSegment() {
        FeatureVector vector = builder.buildListingVector(CandidateFixtures.listing("p1", "household", "etc", 13));

        assertThat(vector.get(1)).isEqualTo(1.0);
        assertThat(vector.get(2 + 2)).isEqualTo(1.0);
        assertThat(vector.get(5 + 13)).isEqualTo(1.0);
        double sum = 0.0;
        for (int i = 0; i < vector.dimension(); i++) {
            sum += vector.get(i);
        }
        assertThat(sum).isEqualTo(3.0);
    }

    @Test
    void listingWithUnknownValuesLeavesSegmentsEmpty() {
        FeatureVector vector = builder.buildListingVector(CandidateFixtures.listing("p1", "toys", null, null));

        assertThat(vector.norm()).isZero();
    }

    @Test
    void dotRejectsDimensionMismatch() {
        FeatureVector a = FeatureVector.of(1.0, 0.0);
        FeatureVector b = FeatureVector.of(1.0, 0.0, 1.0);

        assertThatThrownBy(() -> a.dot(b)).isInstanceOf(IllegalStateException.class);
    }
}
