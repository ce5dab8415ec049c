package com.autoheal.core.code;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Severity {
    HIGH, MEDIUM, LOW;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
