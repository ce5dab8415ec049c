package com.autoheal.core.logs;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Per-file counters for one log source. error is set when the file was missing or
 * unreadable; such a source contributes nothing to the aggregate lists.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LogSourceReport {

    private final String file;

    @JsonProperty("total_lines")
    private int totalLines;

    @JsonProperty("error_count")
    private int errorCount;

    @JsonProperty("warning_count")
    private int warningCount;

    @JsonProperty("info_count")
    private int infoCount;

    private String error;

    public LogSourceReport(String file) {
        this.file = file;
    }

    void countLine()    { totalLines++; }
    void countError()   { errorCount++; }
    void countWarning() { warningCount++; }
    void countInfo()    { infoCount++; }
    void fail(String message) { this.error = message; }

    public String getFile()      { return file; }
    public int getTotalLines()   { return totalLines; }
    public int getErrorCount()   { return errorCount; }
    public int getWarningCount() { return warningCount; }
    public int getInfoCount()    { return infoCount; }
    public String getError()     { return error; }
}
