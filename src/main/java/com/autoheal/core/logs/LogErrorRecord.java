package com.autoheal.core.logs;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;

/** One error line inside the analysis window. timestamp is null when the line carries none. */
public final class LogErrorRecord {

    @JsonProperty("raw_line")
    private final String rawLine;

    private final LocalDateTime timestamp;

    @JsonProperty("classified_type")
    private final String classifiedType;

    private final String source;

    public LogErrorRecord(String rawLine, LocalDateTime timestamp, String classifiedType, String source) {
        this.rawLine        = rawLine;
        this.timestamp      = timestamp;
        this.classifiedType = classifiedType;
        this.source         = source;
    }

    public String getRawLine()          { return rawLine; }
    public LocalDateTime getTimestamp() { return timestamp; }
    public String getClassifiedType()   { return classifiedType; }
    public String getSource()           { return source; }

    @Override
    public String toString() {
        return "[" + classifiedType + "] " + rawLine;
    }
}
