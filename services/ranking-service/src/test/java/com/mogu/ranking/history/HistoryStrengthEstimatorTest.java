package com.mogu.ranking.history;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.mogu.ranking.service.RecommendationProperties;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class HistoryStrengthEstimatorTest {

    private static final Instant NOW = Instant.parse("2025-10-01T12:00:00Z");

    private final HistoryStrengthEstimator estimator = new HistoryStrengthEstimator(
        new RecommendationProperties(),
        Clock.fixed(NOW, ZoneOffset.UTC)
    );

    @Test
    void noHistoryMeansZeroStrength() {
        assertThat(estimator.estimate(List.of())).isZero();
        assertThat(estimator.estimate(null)).isZero();
    }

    @Test
    void freshEventsSumWeightsOverReference() {
        List<InteractionRecord> events = List.of(
            InteractionRecord.of("u1", "p1", SignalType.STRONG, NOW),
            InteractionRecord.of("u1", "p2", SignalType.WEAK, NOW),
            InteractionRecord.of("u1", "p3", SignalType.MEDIUM, NOW)
        );

        assertThat(estimator.estimate(events)).isCloseTo(3.5 / 10.0, within(1e-9));
    }

    @Test
    void strengthDecaysWithAge() {
        double fresh = estimator.estimate(List.of(InteractionRecord.of("u1", "p1", SignalType.STRONG, NOW)));
        double month = estimator.estimate(List.of(
            InteractionRecord.of("u1", "p1", SignalType.STRONG, NOW.minus(Duration.ofDays(30)))
        ));

        assertThat(month).isLessThan(fresh);
        assertThat(month).isCloseTo(0.2 * Math.exp(-1.0), within(1e-9));
    }

    @Test
    void addingInteractionsNeverDecreasesStrength() {
        List<InteractionRecord> events = new ArrayList<>();
        double previous = 0.0;
        for (int i = 0; i < 20; i++) {
            events.add(InteractionRecord.of("u1", "p" + i, SignalType.WEAK, NOW.minus(Duration.ofDays(i))));
            double current = estimator.estimate(events);
            assertThat(current).isGreaterThanOrEqualTo(previous);
            previous = current;
        }
    }

    @Test
    void strengthIsClippedToOne() {
        List<InteractionRecord> events = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            events.add(InteractionRecord.of("u1", "p" + i, SignalType.STRONG, NOW));
        }

        assertThat(estimator.estimate(events)).isEqualTo(1.0);
    }

    @Test
    void futureTimestampsCountAsFresh() {
        double strength = HistoryStrengthEstimator.strength(
            List.of(InteractionRecord.of("u1", "p1", SignalType.WEAK, NOW.plus(Duration.ofDays(2)))),
            NOW,
            30.0,
            10.0
        );

        assertThat(strength).isCloseTo(0.1, within(1e-9));
    }

    @Test
    void eventsWithoutTimestampAreIgnored() {
        assertThat(estimator.estimate(List.of(InteractionRecord.of("u1", "p1", SignalType.STRONG, null)))).isZero();
    }
}
