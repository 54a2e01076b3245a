package com.mogu.similarity.job;

import com.mogu.similarity.config.SimilarityBatchProperties;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

@Component
public class StartupBuildRunner implements ApplicationRunner {
    private final SimilarityBuildJob job;
    private final SimilarityBatchProperties properties;

    public StartupBuildRunner(SimilarityBuildJob job, SimilarityBatchProperties properties) {
        this.job = job;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (properties.isEnabled() && properties.isRunOnStartup()) {
            job.runQuietly("startup");
        }
    }
}
