package com.autoheal.orchestrator;

import com.autoheal.llm.BackendProfile;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Current model backend plus the last snapshot written by a run.
 * lastRun and results are null until the first run has been saved.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class AgentStatus {

    private final String status;

    @JsonProperty("model_available")
    private final boolean modelAvailable;

    private final BackendProfile backend;

    @JsonProperty("last_run")
    private final String lastRun;

    private final JsonNode results;

    private final String error;

    public AgentStatus(String status, boolean modelAvailable, BackendProfile backend,
                       String lastRun, JsonNode results, String error) {
        this.status         = status;
        this.modelAvailable = modelAvailable;
        this.backend        = backend;
        this.lastRun        = lastRun;
        this.results        = results;
        this.error          = error;
    }

    public String getStatus()          { return status; }
    public boolean isModelAvailable()  { return modelAvailable; }
    public BackendProfile getBackend() { return backend; }
    public String getLastRun()         { return lastRun; }
    public JsonNode getResults()       { return results; }
    public String getError()           { return error; }
}
