package com.autoheal.core.repair;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Stable identifiers of repair techniques. The knowledge store learns under these,
 * so they must not change between releases.
 */
public enum FixStrategy {
    ADD_TO_MANIFEST("add_to_manifest"),
    REWRITE_BARE_EXCEPT("rewrite_bare_except"),
    MODEL_REWRITE("model_rewrite"),
    MODEL_SUGGESTION("model_suggestion"),
    LEARNED_FIX("learned_fix"),
    DEPENDENCY_SCAN("dependency_scan"),
    ENUMERATE_REWRITE("enumerate_rewrite"),
    OUTDATED_CHECK("outdated_check"),
    NONE("none");

    private final String id;

    FixStrategy(String id) {
        this.id = id;
    }

    @JsonValue
    public String id() {
        return id;
    }
}
