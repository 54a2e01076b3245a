package com.mogu.ranking.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class RecommendationResponse {
    @JsonProperty("trace_id")
    private String traceId;

    @JsonProperty("request_id")
    private String requestId;

    @JsonProperty("took_ms")
    private long tookMs;

    private int page;
    private int size;
    private int total;
    private String sort;

    @JsonProperty("post_ids")
    private List<String> postIds;

    private List<Hit> hits;
    private DebugInfo debug;

    public String getTraceId() {
        return traceId;
    }

    public void setTraceId(String traceId) {
        this.traceId = traceId;
    }

    public String getRequestId() {
        return requestId;
    }

    public void setRequestId(String requestId) {
        this.requestId = requestId;
    }

    public long getTookMs() {
        return tookMs;
    }

    public void setTookMs(long tookMs) {
        this.tookMs = tookMs;
    }

    public int getPage() {
        return page;
    }

    public void setPage(int page) {
        this.page = page;
    }

    public int getSize() {
        return size;
    }

    public void setSize(int size) {
        this.size = size;
    }

    public int getTotal() {
        return total;
    }

    public void setTotal(int total) {
        this.total = total;
    }

    public String getSort() {
        return sort;
    }

    public void setSort(String sort) {
        this.sort = sort;
    }

    public List<String> getPostIds() {
        return postIds;
    }

    public void setPostIds(List<String> postIds) {
        this.postIds = postIds;
    }

    public List<Hit> getHits() {
        return hits;
    }

    public void setHits(List<Hit> hits) {
        this.hits = hits;
    }

    public DebugInfo getDebug() {
        return debug;
    }

    public void setDebug(DebugInfo debug) {
        this.debug = debug;
    }

    public static class Hit {
        @JsonProperty("post_id")
        private String postId;

        private int rank;

        @JsonProperty("final")
        private double finalScore;

        private double v0;
        private double v1;

        @JsonProperty("distance_km")
        private double distanceKm;

        private double reputation;

        public String getPostId() {
            return postId;
        }

        public void setPostId(String postId) {
            this.postId = postId;
        }

        public int getRank() {
            return rank;
        }

        public void setRank(int rank) {
            this.rank = rank;
        }

        public double getFinalScore() {
            return finalScore;
        }

        public void setFinalScore(double finalScore) {
            this.finalScore = finalScore;
        }

        public double getV0() {
            return v0;
        }

        public void setV0(double v0) {
            this.v0 = v0;
        }

        public double getV1() {
            return v1;
        }

        public void setV1(double v1) {
            this.v1 = v1;
        }

        public double getDistanceKm() {
            return distanceKm;
        }

        public void setDistanceKm(double distanceKm) {
            this.distanceKm = distanceKm;
        }

        public double getReputation() {
            return reputation;
        }

        public void setReputation(double reputation) {
            this.reputation = reputation;
        }
    }

    public static class DebugInfo {
        @JsonProperty("history_strength")
        private double historyStrength;

        private Double w0;
        private Double w1;

        @JsonProperty("cf_coverage")
        private double cfCoverage;

        private int candidates;

        @JsonProperty("reason_codes")
        private List<String> reasonCodes;

        public double getHistoryStrength() {
            return historyStrength;
        }

        public void setHistoryStrength(double historyStrength) {
            this.historyStrength = historyStrength;
        }

        public Double getW0() {
            return w0;
        }

        public void setW0(Double w0) {
            this.w0 = w0;
        }

        public Double getW1() {
            return w1;
        }

        public void setW1(Double w1) {
            this.w1 = w1;
        }

        public double getCfCoverage() {
            return cfCoverage;
        }

        public void setCfCoverage(double cfCoverage) {
            this.cfCoverage = cfCoverage;
        }

        public int getCandidates() {
            return candidates;
        }

        public void setCandidates(int candidates) {
            this.candidates = candidates;
        }

        public List<String> getReasonCodes() {
            return reasonCodes;
        }

        public void setReasonCodes(List<String> reasonCodes) {
            this.reasonCodes = reasonCodes;
        }
    }
}
