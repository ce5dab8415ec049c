package com.autoheal.core.optimization;

import com.autoheal.core.code.CodeMetrics;
import com.autoheal.core.repair.RepairOutcome;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;
import java.util.List;

public final class OptimizationReport {

    private final LocalDateTime       timestamp;
    private final List<RepairOutcome> optimizations;
    private final List<Improvement>   improvements;

    @JsonProperty("metrics_before")
    private final CodeMetrics metricsBefore;

    @JsonProperty("metrics_after")
    private final CodeMetrics metricsAfter;

    public OptimizationReport(LocalDateTime timestamp,
                              List<RepairOutcome> optimizations,
                              List<Improvement> improvements,
                              CodeMetrics metricsBefore,
                              CodeMetrics metricsAfter) {
        this.timestamp     = timestamp;
        this.optimizations = List.copyOf(optimizations);
        this.improvements  = List.copyOf(improvements);
        this.metricsBefore = metricsBefore;
        this.metricsAfter  = metricsAfter;
    }

    public LocalDateTime getTimestamp()           { return timestamp; }
    public List<RepairOutcome> getOptimizations() { return optimizations; }
    public List<Improvement> getImprovements()    { return improvements; }
    public CodeMetrics getMetricsBefore()         { return metricsBefore; }
    public CodeMetrics getMetricsAfter()          { return metricsAfter; }
}
