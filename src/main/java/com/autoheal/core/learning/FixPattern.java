package com.autoheal.core.learning;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome counters for one (error type, fix action) pair.
 */
public class FixPattern {

    @JsonProperty("error_type")
    private String errorType;

    @JsonProperty("fix_action")
    private String fixAction;

    @JsonProperty("success_count")
    private int successCount;

    @JsonProperty("failure_count")
    private int failureCount;

    public FixPattern() {
    }

    FixPattern(String errorType, String fixAction) {
        this.errorType = errorType;
        this.fixAction = fixAction;
    }

    void record(boolean succeeded) {
        if (succeeded) successCount++;
        else failureCount++;
    }

    @JsonIgnore
    public int getAttempts() {
        return successCount + failureCount;
    }

    /** 0.0 when there are no attempts. */
    @JsonIgnore
    public double getSuccessRate() {
        int attempts = getAttempts();
        return attempts == 0 ? 0.0 : (double) successCount / attempts;
    }

    /** Trusted only with at least one attempt and a rate strictly above the threshold. */
    public boolean isTrusted(double threshold) {
        return getAttempts() > 0 && getSuccessRate() > threshold;
    }

    public String getErrorType()        { return errorType; }
    public void setErrorType(String v)  { this.errorType = v; }
    public String getFixAction()        { return fixAction; }
    public void setFixAction(String v)  { this.fixAction = v; }
    public int getSuccessCount()        { return successCount; }
    public void setSuccessCount(int v)  { this.successCount = v; }
    public int getFailureCount()        { return failureCount; }
    public void setFailureCount(int v)  { this.failureCount = v; }
}
