package com.mogu.similarity.job;

public class SimilarityBuildException extends RuntimeException {
    private final SimilarityBuildReport report;

    public SimilarityBuildException(String message, SimilarityBuildReport report, Throwable cause) {
        super(message, cause);
        this.report = report;
    }

    public SimilarityBuildReport getReport() {
        return report;
    }
}
