package com.mogu.similarity.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "similarity.batch")
public class SimilarityBatchProperties {
    private boolean enabled = true;
    private String cron = "0 0 3 * * *";
    private boolean runOnStartup = false;
    private int topK = 100;
    private int minCommon = 2;
    private double minSim = 0.05;
    private double lambda = 5.0;
    // 0 loads every aggregated row.
    private int sampleLimit = 0;
    private int insertChunkSize = 5000;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getCron() {
        return cron;
    }

    public void setCron(String cron) {
        this.cron = cron;
    }

    public boolean isRunOnStartup() {
        return runOnStartup;
    }

    public void setRunOnStartup(boolean runOnStartup) {
        this.runOnStartup = runOnStartup;
    }

    public int getTopK() {
        return topK;
    }

    public void setTopK(int topK) {
        this.topK = topK;
    }

    public int getMinCommon() {
        return minCommon;
    }

    public void setMinCommon(int minCommon) {
        this.minCommon = minCommon;
    }

    public double getMinSim() {
        return minSim;
    }

    public void setMinSim(double minSim) {
        this.minSim = minSim;
    }

    public double getLambda() {
        return lambda;
    }

    public void setLambda(double lambda) {
        this.lambda = lambda;
    }

    public int getSampleLimit() {
        return sampleLimit;
    }

    public void setSampleLimit(int sampleLimit) {
        this.sampleLimit = sampleLimit;
    }

    public int getInsertChunkSize() {
        return insertChunkSize;
    }

    public void setInsertChunkSize(int insertChunkSize) {
        this.insertChunkSize = insertChunkSize;
    }
}
