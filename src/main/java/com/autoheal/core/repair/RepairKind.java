package com.autoheal.core.repair;

import java.util.*;

public enum RepairKind {
    LOGS, CODE, DEPENDENCIES;

    public static RepairKind fromString(String value) {
        if (value == null) throw new IllegalArgumentException("Repair kind must not be null");
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    "Unknown repair kind: " + value + " (expected logs, code or dependencies)");
        }
    }

    /** null or empty means every kind. */
    public static Set<RepairKind> parseAll(Collection<String> values) {
        if (values == null || values.isEmpty()) return EnumSet.allOf(RepairKind.class);
        Set<RepairKind> kinds = EnumSet.noneOf(RepairKind.class);
        for (String value : values) kinds.add(fromString(value));
        return kinds;
    }
}
