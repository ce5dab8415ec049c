package com.autoheal.core.repair;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum RepairStatus {
    SUCCESS,
    FAILED,
    SKIPPED,
    /** Proposed but not applied; a person has to apply it. Counted as skipped. */
    SUGGESTED;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
