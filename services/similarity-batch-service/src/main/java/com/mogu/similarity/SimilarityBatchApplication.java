package com.mogu.similarity;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class SimilarityBatchApplication {
    public static void main(String[] args) {
        SpringApplication.run(SimilarityBatchApplication.class, args);
    }
}
