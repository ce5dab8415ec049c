package com.autoheal.core.code;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line-oriented pass: regex checks that need no syntax tree, plus the two
 * optimization heuristics.
 */
public class LinePatternScanner {

    private static final Map<String, LineCheck> CHECKS = new LinkedHashMap<>();
    static {
        CHECKS.put(Issue.BARE_EXCEPT,
                new LineCheck(Pattern.compile("except\\s*:"), "Use specific exception types"));
        CHECKS.put(Issue.PRINT_DEBUG,
                new LineCheck(Pattern.compile("print\\s*\\("), "Use logging instead of print"));
        CHECKS.put(Issue.HARDCODED_PATHS,
                new LineCheck(Pattern.compile("[\"'](?:[A-Za-z]:\\\\|/(?:home|Users|usr|etc|var|tmp|opt)/)"),
                        "Avoid hardcoded paths"));
        CHECKS.put(Issue.TODO_COMMENTS,
                new LineCheck(Pattern.compile("#\\s*(?:TODO|FIXME|XXX)"), "Address TODO comments"));
    }

    static final Pattern RANGE_LEN = Pattern.compile("for\\s+\\w+\\s+in\\s+range\\(\\s*len\\(");
    static final Pattern APPEND    = Pattern.compile("^\\s*([A-Za-z_][\\w.]*)\\.append\\(.*\\)\\s*$");

    public List<Issue> scanIssues(String content, String file) {
        List<Issue> issues = new ArrayList<>();
        String[] lines = content.split("\\R", -1);

        for (int i = 0; i < lines.length; i++) {
            for (Map.Entry<String, LineCheck> check : CHECKS.entrySet()) {
                if (check.getValue().pattern.matcher(lines[i]).find()) {
                    issues.add(new Issue(check.getKey(), Severity.MEDIUM, file, i + 1,
                            check.getValue().message, lines[i].strip()));
                }
            }
        }
        return issues;
    }

    public List<Optimization> scanOptimizations(String content, String file) {
        List<Optimization> optimizations = new ArrayList<>();
        String[] lines = content.split("\\R", -1);

        String previousReceiver = null;
        boolean runReported     = false;

        for (int i = 0; i < lines.length; i++) {
            if (RANGE_LEN.matcher(lines[i]).find()) {
                optimizations.add(new Optimization(Optimization.INEFFICIENT_ITERATION, file, i + 1,
                        "Use enumerate() instead of range(len())"));
            }

            Matcher append = APPEND.matcher(lines[i]);
            if (append.matches()) {
                String receiver = append.group(1);
                if (receiver.equals(previousReceiver) && !runReported) {
                    // reported at the first call of the run
                    optimizations.add(new Optimization(Optimization.MULTIPLE_APPEND, file, i,
                            "Use list comprehension or extend() for " + receiver));
                    runReported = true;
                } else if (!receiver.equals(previousReceiver)) {
                    runReported = false;
                }
                previousReceiver = receiver;
            } else {
                previousReceiver = null;
                runReported      = false;
            }
        }
        return optimizations;
    }

    private static final class LineCheck {
        final Pattern pattern;
        final String  message;

        LineCheck(Pattern pattern, String message) {
            this.pattern = pattern;
            this.message = message;
        }
    }
}
