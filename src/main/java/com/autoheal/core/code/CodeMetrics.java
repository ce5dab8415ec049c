package com.autoheal.core.code;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public final class CodeMetrics {

    public static final String TOTAL_ISSUES               = "total_issues";
    public static final String HIGH_SEVERITY              = "high_severity";
    public static final String OPTIMIZATION_OPPORTUNITIES = "optimization_opportunities";

    @JsonProperty(TOTAL_ISSUES)
    private final int totalIssues;

    @JsonProperty(HIGH_SEVERITY)
    private final int highSeverity;

    @JsonProperty("medium_severity")
    private final int mediumSeverity;

    @JsonProperty("low_severity")
    private final int lowSeverity;

    @JsonProperty(OPTIMIZATION_OPPORTUNITIES)
    private final int optimizationOpportunities;

    public CodeMetrics(int totalIssues, int highSeverity, int mediumSeverity, int lowSeverity,
                       int optimizationOpportunities) {
        this.totalIssues               = totalIssues;
        this.highSeverity              = highSeverity;
        this.mediumSeverity            = mediumSeverity;
        this.lowSeverity               = lowSeverity;
        this.optimizationOpportunities = optimizationOpportunities;
    }

    public static CodeMetrics of(List<Issue> issues, List<Optimization> optimizations) {
        return new CodeMetrics(
                issues.size(),
                count(issues, Severity.HIGH),
                count(issues, Severity.MEDIUM),
                count(issues, Severity.LOW),
                optimizations.size());
    }

    private static int count(List<Issue> issues, Severity severity) {
        return (int) issues.stream().filter(i -> i.getSeverity() == severity).count();
    }

    public int getTotalIssues()               { return totalIssues; }
    public int getHighSeverity()              { return highSeverity; }
    public int getMediumSeverity()            { return mediumSeverity; }
    public int getLowSeverity()               { return lowSeverity; }
    public int getOptimizationOpportunities() { return optimizationOpportunities; }

    /** Value of a metric by its JSON name. */
    public int get(String metric) {
        switch (metric) {
            case TOTAL_ISSUES:               return totalIssues;
            case HIGH_SEVERITY:              return highSeverity;
            case "medium_severity":          return mediumSeverity;
            case "low_severity":             return lowSeverity;
            case OPTIMIZATION_OPPORTUNITIES: return optimizationOpportunities;
            default: throw new IllegalArgumentException("Unknown metric: " + metric);
        }
    }
}
