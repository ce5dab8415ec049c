package com.autoheal.llm;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Best-effort lexical pass over free-text model output.
 *
 * Lines starting with "-", "*", "1." or "1)" become list items with the marker
 * stripped. If no line carries a marker, the whole response is the only item.
 * Not a parser; it is not meant to handle nested or wrapped list formatting.
 */
public final class RecommendationParser {

    private static final Pattern NUMBERED = Pattern.compile("^\\d+[.)]\\s*");
    private static final Pattern BULLET   = Pattern.compile("^[-*]+\\s*");

    private RecommendationParser() {}

    public static List<String> parse(String response) {
        if (response == null || response.isBlank()) {
            return List.of();
        }

        List<String> items = new ArrayList<>();
        for (String raw : response.split("\\R")) {
            String line = raw.strip();
            if (line.isEmpty()) continue;

            String item = null;
            if (line.startsWith("-") || line.startsWith("*")) {
                item = BULLET.matcher(line).replaceFirst("");
            } else if (NUMBERED.matcher(line).find()) {
                item = NUMBERED.matcher(line).replaceFirst("");
            }

            if (item != null && !item.isBlank()) {
                items.add(item.strip());
            }
        }

        return items.isEmpty() ? List.of(response.strip()) : items;
    }
}
