package com.mogu.similarity.job;

import com.mogu.similarity.build.SimilarityStats;
import java.time.Instant;

public record SimilarityBuildReport(
    String trigger,
    Instant startedAt,
    Instant finishedAt,
    BuildOutcome outcome,
    SimilarityStats stats,
    int rowsWritten,
    long elapsedMs,
    String error
) {
}
