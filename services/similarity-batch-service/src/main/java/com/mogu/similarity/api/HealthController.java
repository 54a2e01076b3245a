package com.mogu.similarity.api;

import com.mogu.similarity.job.SimilarityBuildJob;
import java.util.HashMap;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class HealthController {
    private final SimilarityBuildJob buildJob;

    public HealthController(SimilarityBuildJob buildJob) {
        this.buildJob = buildJob;
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        Map<String, Object> response = new HashMap<>();
        response.put("status", "ok");
        response.put("running", buildJob.isRunning());
        if (buildJob.getLastError() != null) {
            response.put("last_error", buildJob.getLastError());
        }
        return response;
    }
}
