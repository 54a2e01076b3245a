package com.mogu.similarity.config;

import java.time.Clock;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(SimilarityBatchProperties.class)
public class SimilarityBatchConfig {

    @Bean
    public Clock batchClock() {
        return Clock.systemUTC();
    }
}
