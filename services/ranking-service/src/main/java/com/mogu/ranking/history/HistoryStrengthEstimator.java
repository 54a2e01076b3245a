package com.mogu.ranking.history;

import com.mogu.ranking.service.RecommendationProperties;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Turns a user's recent weighted interactions into a history strength s in [0, 1].
 *
 * <pre>
 * raw = sum(weight * exp(-age_days / tau))
 * s   = clip(raw / reference, 0, 1)
 * </pre>
 */
@Component
public class HistoryStrengthEstimator {
    private static final double SECONDS_PER_DAY = 86_400.0;

    private final RecommendationProperties properties;
    private final Clock clock;

    public HistoryStrengthEstimator(RecommendationProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    public double estimate(List<InteractionRecord> events) {
        return strength(events, clock.instant(), properties.getDecayTauDays(), properties.getHistoryReference());
    }

    public static double strength(List<InteractionRecord> events, Instant now, double tauDays, double reference) {
        if (events == null || events.isEmpty() || reference <= 0.0) {
            return 0.0;
        }
        double raw = 0.0;
        for (InteractionRecord event : events) {
            if (event == null || event.occurredAt() == null || event.weight() <= 0.0) {
                continue;
            }
            raw += event.weight() * decay(ageDays(event.occurredAt(), now), tauDays);
        }
        return clip(raw / reference);
    }

    static double ageDays(Instant occurredAt, Instant now) {
        double seconds = Duration.between(occurredAt, now).toMillis() / 1000.0;
        return Math.max(0.0, seconds / SECONDS_PER_DAY);
    }

    static double decay(double ageDays, double tauDays) {
        if (tauDays <= 0.0) {
            return ageDays == 0.0 ? 1.0 : 0.0;
        }
        return Math.exp(-ageDays / tauDays);
    }

    private static double clip(double value) {
        if (Double.isNaN(value) || value <= 0.0) {
            return 0.0;
        }
        return Math.min(1.0, value);
    }
}
