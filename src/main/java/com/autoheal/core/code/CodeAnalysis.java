package com.autoheal.core.code;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class CodeAnalysis {

    private final LocalDateTime timestamp;

    @JsonProperty("files_analyzed")
    private final int filesAnalyzed;

    private final List<Issue>        issues;
    private final List<Optimization> optimizations;
    private final CodeMetrics        metrics;
    private final List<String>       recommendations;

    /** file -> read failure message; such files contribute no issues. */
    @JsonProperty("file_errors")
    private final Map<String, String> fileErrors;

    public CodeAnalysis(LocalDateTime timestamp,
                        int filesAnalyzed,
                        List<Issue> issues,
                        List<Optimization> optimizations,
                        CodeMetrics metrics,
                        List<String> recommendations,
                        Map<String, String> fileErrors) {
        this.timestamp       = timestamp;
        this.filesAnalyzed   = filesAnalyzed;
        this.issues          = List.copyOf(issues);
        this.optimizations   = List.copyOf(optimizations);
        this.metrics         = metrics;
        this.recommendations = List.copyOf(recommendations);
        this.fileErrors      = Collections.unmodifiableMap(new LinkedHashMap<>(fileErrors));
    }

    public LocalDateTime getTimestamp()          { return timestamp; }
    public int getFilesAnalyzed()                { return filesAnalyzed; }
    public List<Issue> getIssues()               { return issues; }
    public List<Optimization> getOptimizations() { return optimizations; }
    public CodeMetrics getMetrics()              { return metrics; }
    public List<String> getRecommendations()     { return recommendations; }
    public Map<String, String> getFileErrors()   { return fileErrors; }
}
