package com.mogu.similarity.job;

public enum BuildOutcome {
    SUCCEEDED("succeeded"),
    SKIPPED_NO_INTERACTIONS("skipped_no_interactions"),
    EMPTY_SIMILARITY("empty_similarity"),
    FAILED("failed");

    private final String tag;

    BuildOutcome(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }
}
