package com.autoheal.core.optimization;

import java.util.*;

public enum OptimizationKind {
    CODE, PERFORMANCE, DEPENDENCIES;

    public static OptimizationKind fromString(String value) {
        if (value == null) throw new IllegalArgumentException("Optimization kind must not be null");
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    "Unknown optimization kind: " + value + " (expected code, performance or dependencies)");
        }
    }

    /** null or empty means every kind. */
    public static Set<OptimizationKind> parseAll(Collection<String> values) {
        if (values == null || values.isEmpty()) return EnumSet.allOf(OptimizationKind.class);
        Set<OptimizationKind> kinds = EnumSet.noneOf(OptimizationKind.class);
        for (String value : values) kinds.add(fromString(value));
        return kinds;
    }
}
