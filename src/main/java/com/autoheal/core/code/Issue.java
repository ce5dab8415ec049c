package com.autoheal.core.code;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A single finding in one source file. file is workspace-relative; line is 1-based.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Issue {

    public static final String SYNTAX_ERROR    = "syntax_error";
    public static final String LONG_FUNCTION   = "long_function";
    public static final String BARE_EXCEPT     = "bare_except";
    public static final String PRINT_DEBUG     = "print_debug";
    public static final String HARDCODED_PATHS = "hardcoded_paths";
    public static final String TODO_COMMENTS   = "todo_comments";

    private final String   kind;
    private final Severity severity;
    private final String   file;
    private final int      line;
    private final String   message;
    private final String   detail;

    public Issue(String kind, Severity severity, String file, int line, String message, String detail) {
        this.kind     = Objects.requireNonNull(kind, "kind");
        this.severity = Objects.requireNonNull(severity, "severity");
        this.file     = file;
        this.line     = line;
        this.message  = message;
        this.detail   = detail;
    }

    @JsonProperty("kind")     public String   getKind()     { return kind; }
    @JsonProperty("severity") public Severity getSeverity() { return severity; }
    @JsonProperty("file")     public String   getFile()     { return file; }
    @JsonProperty("line")     public int      getLine()     { return line; }
    @JsonProperty("message")  public String   getMessage()  { return message; }
    @JsonProperty("detail")   public String   getDetail()   { return detail; }

    /** Identity used to collapse the same finding reported by both analysis passes. */
    String dedupKey() {
        return kind + "|" + file + "|" + line;
    }

    @Override
    public String toString() {
        return String.format("%s[%s] %s:%d %s", kind, severity.label(), file, line, message);
    }
}
