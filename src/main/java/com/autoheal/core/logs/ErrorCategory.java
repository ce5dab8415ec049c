package com.autoheal.core.logs;

import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Ordered error categories. A line belongs to the first category with a matching
 * pattern; declaration order is the match order.
 */
public enum ErrorCategory {

    IMPORT_ERRORS("import_errors",
            "ModuleNotFoundError", "ImportError", "No module named"),
    API_ERRORS("api_errors",
            "API.*error", "HTTP.*error", "Connection.*error", "Timeout", "401|403|404|500"),
    ATTRIBUTE_ERRORS("attribute_errors",
            "AttributeError", "has no attribute"),
    TYPE_ERRORS("type_errors",
            "TypeError", "unsupported operand"),
    VALUE_ERRORS("value_errors",
            "ValueError", "invalid.*value"),
    KEY_ERRORS("key_errors",
            "KeyError", "key.*not found"),
    SSL_ERRORS("ssl_errors",
            "SSL", "certificate", "CERTIFICATE_VERIFY_FAILED"),
    DATABASE_ERRORS("database_errors",
            "Database", "SQL", "db.*error");

    public static final String UNKNOWN = "unknown";

    private final String        typeName;
    private final List<Pattern> patterns;

    ErrorCategory(String typeName, String... regexes) {
        this.typeName = typeName;
        this.patterns = Arrays.stream(regexes)
                .map(r -> Pattern.compile(r, Pattern.CASE_INSENSITIVE))
                .collect(Collectors.toList());
    }

    public String getTypeName() {
        return typeName;
    }

    public boolean matches(String line) {
        return patterns.stream().anyMatch(p -> p.matcher(line).find());
    }

    /** Type name of the first matching category, or "unknown". */
    public static String classify(String line) {
        for (ErrorCategory category : values()) {
            if (category.matches(line)) {
                return category.typeName;
            }
        }
        return UNKNOWN;
    }
}
