package com.autoheal.core.logs;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

public final class LogAnalysis {

    private final LocalDateTime timestamp;

    @JsonProperty("period_hours")
    private final int periodHours;

    private final List<LogErrorRecord>   errors;
    private final List<LogWarningRecord> warnings;

    /** Error count per classified type, in first-seen order. */
    @JsonProperty("type_histogram")
    private final Map<String, Integer> typeHistogram;

    private final List<String>                 recommendations;
    private final Map<String, LogSourceReport> sources;

    public LogAnalysis(LocalDateTime timestamp,
                       int periodHours,
                       List<LogErrorRecord> errors,
                       List<LogWarningRecord> warnings,
                       Map<String, Integer> typeHistogram,
                       List<String> recommendations,
                       Map<String, LogSourceReport> sources) {
        this.timestamp       = timestamp;
        this.periodHours     = periodHours;
        this.errors          = List.copyOf(errors);
        this.warnings        = List.copyOf(warnings);
        this.typeHistogram   = typeHistogram;
        this.recommendations = List.copyOf(recommendations);
        this.sources         = sources;
    }

    public LocalDateTime getTimestamp()             { return timestamp; }
    public int getPeriodHours()                     { return periodHours; }
    public List<LogErrorRecord> getErrors()         { return errors; }
    public List<LogWarningRecord> getWarnings()     { return warnings; }
    public Map<String, Integer> getTypeHistogram()  { return typeHistogram; }
    public List<String> getRecommendations()        { return recommendations; }
    public Map<String, LogSourceReport> getSources(){ return sources; }
}
