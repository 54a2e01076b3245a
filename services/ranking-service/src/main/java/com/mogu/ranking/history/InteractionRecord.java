package com.mogu.ranking.history;

import java.time.Instant;

public record InteractionRecord(
    String userId,
    String listingId,
    SignalType signalType,
    double weight,
    Instant occurredAt
) {
    public static InteractionRecord of(String userId, String listingId, SignalType signalType, Instant occurredAt) {
        return new InteractionRecord(userId, listingId, signalType, signalType.weight(), occurredAt);
    }
}
