package com.mogu.similarity.job;

import com.mogu.similarity.build.ItemSimilarityCalculator;
import com.mogu.similarity.build.SimilarityGraph;
import com.mogu.similarity.build.SimilarityRow;
import com.mogu.similarity.build.SimilarityStats;
import com.mogu.similarity.config.SimilarityBatchProperties;
import com.mogu.similarity.interaction.InteractionLoader;
import com.mogu.similarity.interaction.UserItemInteraction;
import com.mogu.similarity.store.ItemSimilarityWriter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

@Service
public class SimilarityBuildJob {
    private static final Logger logger = LoggerFactory.getLogger(SimilarityBuildJob.class);

    private final InteractionLoader interactionLoader;
    private final ItemSimilarityCalculator calculator;
    private final ItemSimilarityWriter writer;
    private final SimilarityBatchProperties properties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicReference<SimilarityBuildReport> lastReport = new AtomicReference<>(null);
    private final AtomicReference<String> lastError = new AtomicReference<>(null);

    public SimilarityBuildJob(
        InteractionLoader interactionLoader,
        ItemSimilarityCalculator calculator,
        ItemSimilarityWriter writer,
        SimilarityBatchProperties properties,
        MeterRegistry meterRegistry,
        Clock clock
    ) {
        this.interactionLoader = interactionLoader;
        this.calculator = calculator;
        this.writer = writer;
        this.properties = properties;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    @Scheduled(cron = "${similarity.batch.cron:0 0 3 * * *}")
    public void scheduledRun() {
        if (!properties.isEnabled()) {
            return;
        }
        runQuietly("scheduled");
    }

    public void runQuietly(String trigger) {
        try {
            run(trigger);
        } catch (BuildInProgressException ex) {
            logger.warn("similarity build skipped trigger={} reason=already_running", trigger);
        } catch (SimilarityBuildException ex) {
            logger.error("similarity build failed trigger={} error={}", trigger, ex.getMessage(), ex);
        }
    }

    public SimilarityBuildReport run(String trigger) {
        if (!running.compareAndSet(false, true)) {
            throw new BuildInProgressException();
        }
        try {
            return execute(trigger);
        } finally {
            running.set(false);
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public SimilarityBuildReport getLastReport() {
        return lastReport.get();
    }

    public String getLastError() {
        return lastError.get();
    }

    private SimilarityBuildReport execute(String trigger) {
        Instant startedAt = clock.instant();
        long started = System.nanoTime();
        logger.info(
            "similarity build started trigger={} top_k={} min_common={} min_sim={} lambda={} sample_limit={}",
            trigger,
            properties.getTopK(),
            properties.getMinCommon(),
            properties.getMinSim(),
            properties.getLambda(),
            properties.getSampleLimit()
        );

        SimilarityStats stats = null;
        try {
            List<UserItemInteraction> interactions = interactionLoader.loadInteractions(properties.getSampleLimit());
            logger.info("interactions loaded count={}", interactions.size());
            if (interactions.isEmpty()) {
                logger.warn("no interactions found; keeping the existing item_item_sim rows");
                return finish(trigger, startedAt, started, BuildOutcome.SKIPPED_NO_INTERACTIONS,
                    SimilarityStats.of(interactions, SimilarityGraph.empty(), List.of()), 0, null);
            }

            SimilarityGraph graph = calculator.build(interactions);
            List<SimilarityRow> rows = graph.toRows();
            stats = SimilarityStats.of(interactions, graph, rows);
            logger.info(
                "similarity computed users={} items={} items_with_neighbors={} rows={} lambda={}",
                stats.users(),
                stats.items(),
                stats.itemsWithNeighbors(),
                stats.rows(),
                properties.getLambda()
            );
            if (graph.isEmpty()) {
                logger.warn(
                    "no item pair passed min_common={} min_sim={}; item_item_sim will be empty",
                    properties.getMinCommon(),
                    properties.getMinSim()
                );
            }

            int written = writer.replaceAll(rows);
            meterRegistry.counter("similarity.batch.rows.written").increment(written);
            BuildOutcome outcome = graph.isEmpty() ? BuildOutcome.EMPTY_SIMILARITY : BuildOutcome.SUCCEEDED;
            return finish(trigger, startedAt, started, outcome, stats, written, null);
        } catch (RuntimeException ex) {
            String message = ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
            SimilarityBuildReport report = finish(trigger, startedAt, started, BuildOutcome.FAILED, stats, 0, message);
            throw new SimilarityBuildException("similarity build failed: " + message, report, ex);
        }
    }

    private SimilarityBuildReport finish(
        String trigger,
        Instant startedAt,
        long started,
        BuildOutcome outcome,
        SimilarityStats stats,
        int written,
        String error
    ) {
        long elapsedMs = (System.nanoTime() - started) / 1_000_000L;
        SimilarityBuildReport report = new SimilarityBuildReport(
            trigger,
            startedAt,
            clock.instant(),
            outcome,
            stats,
            written,
            elapsedMs,
            error
        );
        lastReport.set(report);
        lastError.set(error);
        meterRegistry.counter("similarity.batch.runs.total", "outcome", outcome.tag()).increment();
        if (outcome == BuildOutcome.FAILED) {
            return report;
        }
        logger.info(
            "similarity build finished trigger={} outcome={} rows={} mean_sim={} max_sim={} mean_common={} elapsed_ms={}",
            trigger,
            outcome.tag(),
            written,
            stats == null ? "n/a" : String.format("%.4f", stats.meanSimilarity()),
            stats == null ? "n/a" : String.format("%.4f", stats.maxSimilarity()),
            stats == null ? "n/a" : String.format("%.2f", stats.meanCommonUsers()),
            elapsedMs
        );
        return report;
    }
}
