package com.mogu.similarity.api;

import com.mogu.similarity.build.SimilarityStats;
import com.mogu.similarity.job.BuildInProgressException;
import com.mogu.similarity.job.SimilarityBuildException;
import com.mogu.similarity.job.SimilarityBuildJob;
import com.mogu.similarity.job.SimilarityBuildReport;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/internal/similarity")
public class SimilarityStatusController {
    private final SimilarityBuildJob buildJob;

    public SimilarityStatusController(SimilarityBuildJob buildJob) {
        this.buildJob = buildJob;
    }

    @GetMapping("/status")
    public Map<String, Object> status() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("running", buildJob.isRunning());
        SimilarityBuildReport report = buildJob.getLastReport();
        if (report == null) {
            response.put("outcome", "never_run");
            return response;
        }
        response.putAll(toMap(report));
        return response;
    }

    @PostMapping("/rebuild")
    public ResponseEntity<Map<String, Object>> rebuild() {
        try {
            return ResponseEntity.ok(toMap(buildJob.run("manual")));
        } catch (BuildInProgressException ex) {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("outcome", "already_running");
            body.put("message", ex.getMessage());
            return ResponseEntity.status(HttpStatus.CONFLICT).body(body);
        } catch (SimilarityBuildException ex) {
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(toMap(ex.getReport()));
        }
    }

    static Map<String, Object> toMap(SimilarityBuildReport report) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("trigger", report.trigger());
        map.put("outcome", report.outcome().tag());
        map.put("started_at", report.startedAt().toString());
        map.put("finished_at", report.finishedAt().toString());
        map.put("elapsed_ms", report.elapsedMs());
        map.put("rows_written", report.rowsWritten());
        SimilarityStats stats = report.stats();
        if (stats != null) {
            map.put("interactions", stats.interactions());
            map.put("users", stats.users());
            map.put("items", stats.items());
            map.put("items_with_neighbors", stats.itemsWithNeighbors());
            map.put("neighbor_coverage", stats.neighborCoverage());
            map.put("rows", stats.rows());
            map.put("mean_sim", stats.meanSimilarity());
            map.put("max_sim", stats.maxSimilarity());
            map.put("mean_common_users", stats.meanCommonUsers());
        }
        if (report.error() != null) {
            map.put("last_error", report.error());
        }
        return map;
    }
}
