package com.autoheal.core.logs;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;

public final class LogWarningRecord {

    @JsonProperty("raw_line")
    private final String rawLine;

    private final LocalDateTime timestamp;
    private final String        source;

    public LogWarningRecord(String rawLine, LocalDateTime timestamp, String source) {
        this.rawLine   = rawLine;
        this.timestamp = timestamp;
        this.source    = source;
    }

    public String getRawLine()          { return rawLine; }
    public LocalDateTime getTimestamp() { return timestamp; }
    public String getSource()           { return source; }
}
