package com.autoheal.core.learning;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Summary of what the knowledge store has accumulated.
 */
public final class Insights {

    private final LocalDateTime timestamp;

    @JsonProperty("common_errors")
    private final List<CommonError> commonErrors;

    @JsonProperty("effective_fixes")
    private final List<EffectiveFix> effectiveFixes;

    @JsonProperty("optimization_patterns")
    private final List<OptimizationSummary> optimizationPatterns;

    private final List<String> recommendations;

    public Insights(LocalDateTime timestamp,
                    List<CommonError> commonErrors,
                    List<EffectiveFix> effectiveFixes,
                    List<OptimizationSummary> optimizationPatterns,
                    List<String> recommendations) {
        this.timestamp            = timestamp;
        this.commonErrors         = List.copyOf(commonErrors);
        this.effectiveFixes       = List.copyOf(effectiveFixes);
        this.optimizationPatterns = List.copyOf(optimizationPatterns);
        this.recommendations      = List.copyOf(recommendations);
    }

    public LocalDateTime getTimestamp()                          { return timestamp; }
    public List<CommonError> getCommonErrors()                   { return commonErrors; }
    public List<EffectiveFix> getEffectiveFixes()                { return effectiveFixes; }
    public List<OptimizationSummary> getOptimizationPatterns()   { return optimizationPatterns; }
    public List<String> getRecommendations()                     { return recommendations; }

    // -------------------------------------------------------------------------

    public static final class CommonError {
        private final String type;
        private final int    count;

        @JsonProperty("first_seen")
        private final LocalDateTime firstSeen;

        @JsonProperty("last_seen")
        private final LocalDateTime lastSeen;

        public CommonError(String type, int count, LocalDateTime firstSeen, LocalDateTime lastSeen) {
            this.type      = type;
            this.count     = count;
            this.firstSeen = firstSeen;
            this.lastSeen  = lastSeen;
        }

        public String getType()             { return type; }
        public int getCount()               { return count; }
        public LocalDateTime getFirstSeen() { return firstSeen; }
        public LocalDateTime getLastSeen()  { return lastSeen; }
    }

    public static final class EffectiveFix {
        @JsonProperty("error_type")
        private final String errorType;

        @JsonProperty("fix_action")
        private final String fixAction;

        @JsonProperty("success_rate")
        private final double successRate;

        @JsonProperty("total_attempts")
        private final int totalAttempts;

        public EffectiveFix(String errorType, String fixAction, double successRate, int totalAttempts) {
            this.errorType     = errorType;
            this.fixAction     = fixAction;
            this.successRate   = successRate;
            this.totalAttempts = totalAttempts;
        }

        public String getErrorType()  { return errorType; }
        public String getFixAction()  { return fixAction; }
        public double getSuccessRate(){ return successRate; }
        public int getTotalAttempts() { return totalAttempts; }
    }

    public static final class OptimizationSummary {
        private final String type;
        private final int    attempts;
        private final int    successes;

        @JsonProperty("recent_improvements")
        private final List<String> recentImprovements;

        public OptimizationSummary(String type, int attempts, int successes, List<String> recentImprovements) {
            this.type               = type;
            this.attempts           = attempts;
            this.successes          = successes;
            this.recentImprovements = List.copyOf(recentImprovements);
        }

        public String getType()                    { return type; }
        public int getAttempts()                   { return attempts; }
        public int getSuccesses()                  { return successes; }
        public List<String> getRecentImprovements(){ return recentImprovements; }
    }
}
