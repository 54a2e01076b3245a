package com.mogu.ranking.service;

import com.mogu.ranking.features.FeatureProperties;
import java.time.Clock;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({RecommendationProperties.class, FeatureProperties.class})
public class RankingConfig {

    @Bean
    public Clock rankingClock() {
        return Clock.systemUTC();
    }
}
