package com.autoheal.core.learning;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * On-disk shape of the knowledge file. Read whole at startup, written whole on every change.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
class KnowledgeDocument {

    @JsonProperty("error_patterns")
    private Map<String, ErrorPattern> errorPatterns = new LinkedHashMap<>();

    /** error type -> fix action -> counters. */
    @JsonProperty("fix_patterns")
    private Map<String, Map<String, FixPattern>> fixPatterns = new LinkedHashMap<>();

    @JsonProperty("optimization_patterns")
    private Map<String, OptimizationPattern> optimizationPatterns = new LinkedHashMap<>();

    @JsonProperty("learned_rules")
    private List<String> learnedRules = new ArrayList<>();

    Map<String, ErrorPattern> getErrorPatterns()               { return errorPatterns; }
    Map<String, Map<String, FixPattern>> getFixPatterns()      { return fixPatterns; }
    Map<String, OptimizationPattern> getOptimizationPatterns() { return optimizationPatterns; }
    List<String> getLearnedRules()                             { return learnedRules; }

    void setErrorPatterns(Map<String, ErrorPattern> v)               { this.errorPatterns = v != null ? v : new LinkedHashMap<>(); }
    void setFixPatterns(Map<String, Map<String, FixPattern>> v)      { this.fixPatterns = v != null ? v : new LinkedHashMap<>(); }
    void setOptimizationPatterns(Map<String, OptimizationPattern> v) { this.optimizationPatterns = v != null ? v : new LinkedHashMap<>(); }
    void setLearnedRules(List<String> v)                             { this.learnedRules = v != null ? v : new ArrayList<>(); }
}
