package com.mogu.ranking.service;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "ranking.recommendation")
public class RecommendationProperties {
    private int candidateLimit = 300;
    private int historyLimit = 50;
    private int interactionLimit = 200;
    private double decayTauDays = 30.0;
    private double historyReference = 10.0;
    private double w1Min = 0.15;
    private double w1Max = 0.50;
    private double coverageThreshold = 0.30;
    private double defaultRadiusKm = 3.0;
    private double maxRadiusKm = 50.0;
    private int defaultPageSize = 20;
    private int maxPageSize = 100;

    public int getCandidateLimit() {
        return candidateLimit;
    }

    public void setCandidateLimit(int candidateLimit) {
        this.candidateLimit = candidateLimit;
    }

    public int getHistoryLimit() {
        return historyLimit;
    }

    public void setHistoryLimit(int historyLimit) {
        this.historyLimit = historyLimit;
    }

    public int getInteractionLimit() {
        return interactionLimit;
    }

    public void setInteractionLimit(int interactionLimit) {
        this.interactionLimit = interactionLimit;
    }

    public double getDecayTauDays() {
        return decayTauDays;
    }

    public void setDecayTauDays(double decayTauDays) {
        this.decayTauDays = decayTauDays;
    }

    public double getHistoryReference() {
        return historyReference;
    }

    public void setHistoryReference(double historyReference) {
        this.historyReference = historyReference;
    }

    public double getW1Min() {
        return w1Min;
    }

    public void setW1Min(double w1Min) {
        this.w1Min = w1Min;
    }

    public double getW1Max() {
        return w1Max;
    }

    public void setW1Max(double w1Max) {
        this.w1Max = w1Max;
    }

    public double getCoverageThreshold() {
        return coverageThreshold;
    }

    public void setCoverageThreshold(double coverageThreshold) {
        this.coverageThreshold = coverageThreshold;
    }

    public double getDefaultRadiusKm() {
        return defaultRadiusKm;
    }

    public void setDefaultRadiusKm(double defaultRadiusKm) {
        this.defaultRadiusKm = defaultRadiusKm;
    }

    public double getMaxRadiusKm() {
        return maxRadiusKm;
    }

    public void setMaxRadiusKm(double maxRadiusKm) {
        this.maxRadiusKm = maxRadiusKm;
    }

    public int getDefaultPageSize() {
        return defaultPageSize;
    }

    public void setDefaultPageSize(int defaultPageSize) {
        this.defaultPageSize = defaultPageSize;
    }

    public int getMaxPageSize() {
        return maxPageSize;
    }

    public void setMaxPageSize(int maxPageSize) {
        this.maxPageSize = maxPageSize;
    }
}
