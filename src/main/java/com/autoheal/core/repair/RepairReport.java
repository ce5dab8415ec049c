package com.autoheal.core.repair;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;
import java.util.List;

/**
 * All outcomes of one autoRepair run. Every outcome lands in exactly one counter;
 * suggested outcomes count as skipped.
 */
public final class RepairReport {

    private final LocalDateTime       timestamp;
    private final List<RepairOutcome> repairs;

    @JsonProperty("success_count")
    private final int successCount;

    @JsonProperty("failed_count")
    private final int failedCount;

    @JsonProperty("skipped_count")
    private final int skippedCount;

    public RepairReport(LocalDateTime timestamp, List<RepairOutcome> repairs) {
        this.timestamp = timestamp;
        this.repairs   = List.copyOf(repairs);

        int success = 0, failed = 0, skipped = 0;
        for (RepairOutcome outcome : repairs) {
            switch (outcome.getStatus()) {
                case SUCCESS: success++; break;
                case FAILED:  failed++;  break;
                default:      skipped++; break;
            }
        }
        this.successCount = success;
        this.failedCount  = failed;
        this.skippedCount = skipped;
    }

    public LocalDateTime getTimestamp()       { return timestamp; }
    public List<RepairOutcome> getRepairs()   { return repairs; }
    public int getSuccessCount()              { return successCount; }
    public int getFailedCount()               { return failedCount; }
    public int getSkippedCount()              { return skippedCount; }
}
