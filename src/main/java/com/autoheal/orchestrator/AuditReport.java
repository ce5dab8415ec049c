package com.autoheal.orchestrator;

import com.autoheal.core.code.CodeAnalysis;
import com.autoheal.core.logs.LogAnalysis;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public final class AuditReport {

    public static final String COMPLETED = "completed";
    public static final String FAILED    = "failed";

    private final LocalDateTime timestamp;
    private final String        status;

    @JsonProperty("log_analysis")
    private final LogAnalysis logAnalysis;

    @JsonProperty("code_analysis")
    private final CodeAnalysis codeAnalysis;

    private final List<String> recommendations;
    private final String       error;

    public AuditReport(LocalDateTime timestamp, String status, LogAnalysis logAnalysis,
                       CodeAnalysis codeAnalysis, List<String> recommendations, String error) {
        this.timestamp       = timestamp;
        this.status          = status;
        this.logAnalysis     = logAnalysis;
        this.codeAnalysis    = codeAnalysis;
        this.recommendations = List.copyOf(recommendations);
        this.error           = error;
    }

    public LocalDateTime getTimestamp()      { return timestamp; }
    public String getStatus()                { return status; }
    public LogAnalysis getLogAnalysis()      { return logAnalysis; }
    public CodeAnalysis getCodeAnalysis()    { return codeAnalysis; }
    public List<String> getRecommendations() { return recommendations; }
    public String getError()                 { return error; }
}
