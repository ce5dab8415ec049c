package com.autoheal.core.repair;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls replacement source out of a model response: the first fenced block, or the
 * raw response when it already looks like Python.
 */
final class CodeBlockExtractor {

    private static final Pattern FENCED =
            Pattern.compile("```(?:python|py)?[ \\t]*\\R(.*?)\\R?```", Pattern.DOTALL);

    private static final List<String> CODE_SIGNALS = List.of("def ", "import ", "class ");

    private CodeBlockExtractor() {}

    static Optional<String> extract(String response) {
        if (response == null || response.isBlank()) {
            return Optional.empty();
        }

        Matcher m = FENCED.matcher(response);
        if (m.find()) {
            String code = m.group(1);
            return code.isBlank() ? Optional.empty() : Optional.of(withTrailingNewline(code));
        }

        for (String signal : CODE_SIGNALS) {
            if (response.contains(signal)) {
                return Optional.of(withTrailingNewline(response));
            }
        }
        return Optional.empty();
    }

    private static String withTrailingNewline(String code) {
        return code.endsWith("\n") ? code : code + "\n";
    }
}
