package com.autoheal.core.logs;

import java.util.Locale;

/** Which log sources a LogAnalyzer run reads. */
public enum LogScope {
    DEBUG, ERROR, ALL;

    public boolean includesDebug() {
        return this == DEBUG || this == ALL;
    }

    public boolean includesError() {
        return this == ERROR || this == ALL;
    }

    public static LogScope fromString(String value) {
        if (value == null) return ALL;
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown log scope: " + value + " (expected debug, error or all)");
        }
    }
}
