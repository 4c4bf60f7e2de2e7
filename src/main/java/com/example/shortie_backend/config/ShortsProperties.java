package com.example.shortie_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Tuning knobs of the shorts pipeline: selection size and spacing, refinement bounds, chunking and retries.
 */
@ConfigurationProperties(prefix = "shorts")
public class ShortsProperties {

    private int targetShorts = 5;
    private double minGapSeconds = 90.0;
    private double minLen = 15.0;
    private double maxLen = 60.0;
    private double pad = 1.5;
    private double mergeGap = 0.0;
    private double chunkMinutes = 20.0;
    private int minShorts = 5;
    private Integer maxShorts;
    private int maxRetries = 2;
    private boolean enrichmentEnabled = true;
    private int repairInputMaxChars = 12_000;

    public int getTargetShorts() {
        return targetShorts;
    }

    public void setTargetShorts(int targetShorts) {
        this.targetShorts = targetShorts;
    }

    public double getMinGapSeconds() {
        return minGapSeconds;
    }

    public void setMinGapSeconds(double minGapSeconds) {
        this.minGapSeconds = minGapSeconds;
    }

    public double getMinLen() {
        return minLen;
    }

    public void setMinLen(double minLen) {
        this.minLen = minLen;
    }

    public double getMaxLen() {
        return maxLen;
    }

    public void setMaxLen(double maxLen) {
        this.maxLen = maxLen;
    }

    public double getPad() {
        return pad;
    }

    public void setPad(double pad) {
        this.pad = pad;
    }

    public double getMergeGap() {
        return mergeGap;
    }

    public void setMergeGap(double mergeGap) {
        this.mergeGap = mergeGap;
    }

    public double getChunkMinutes() {
        return chunkMinutes;
    }

    public void setChunkMinutes(double chunkMinutes) {
        this.chunkMinutes = chunkMinutes;
    }

    public int getMinShorts() {
        return minShorts;
    }

    public void setMinShorts(int minShorts) {
        this.minShorts = minShorts;
    }

    public Integer getMaxShorts() {
        return maxShorts;
    }

    public void setMaxShorts(Integer maxShorts) {
        this.maxShorts = maxShorts;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public boolean isEnrichmentEnabled() {
        return enrichmentEnabled;
    }

    public void setEnrichmentEnabled(boolean enrichmentEnabled) {
        this.enrichmentEnabled = enrichmentEnabled;
    }

    public int getRepairInputMaxChars() {
        return repairInputMaxChars;
    }

    public void setRepairInputMaxChars(int repairInputMaxChars) {
        this.repairInputMaxChars = repairInputMaxChars;
    }

    /**
     * Cap applied after refinement. Unset means {@code max(targetShorts, 5)}.
     *
     * @param targetShorts effective target for the current run.
     * @return maximum number of clips to return.
     */
    public int effectiveMaxShorts(int targetShorts) {
        return maxShorts != null ? maxShorts : Math.max(targetShorts, 5);
    }
}
