package com.autoheal.core.code;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Optimization {

    public static final String INEFFICIENT_ITERATION = "inefficient_iteration";
    public static final String MULTIPLE_APPEND       = "multiple_append";

    private final String  kind;
    private final String  file;
    private final Integer line;
    private final String  suggestion;

    public Optimization(String kind, String file, Integer line, String suggestion) {
        this.kind       = kind;
        this.file       = file;
        this.line       = line;
        this.suggestion = suggestion;
    }

    public String  getKind()       { return kind; }
    public String  getFile()       { return file; }
    public Integer getLine()       { return line; }
    public String  getSuggestion() { return suggestion; }

    @Override
    public String toString() {
        return kind + " " + file + (line != null ? ":" + line : "");
    }
}
