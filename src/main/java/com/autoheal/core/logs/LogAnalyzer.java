package com.autoheal.core.logs;

import com.autoheal.config.AutoHealProperties;
import com.autoheal.core.filesystem.FileSystemManager;
import com.autoheal.llm.ModelClient;
import com.autoheal.llm.ModelResponse;
import com.autoheal.llm.RecommendationParser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeParseException;
import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * LogAnalyzer: reads the debug and error logs for a time window, tags each line as
 * error / warning / info and classifies errors by ErrorCategory.
 *
 * Lines whose timestamp cannot be parsed are always kept in the window.
 * A missing log file is reported on its LogSourceReport and never fails the run.
 */
@Component
public class LogAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(LogAnalyzer.class);

    public static final String NO_ERRORS_MESSAGE = "No errors found in the analyzed period.";

    static final String DEBUG_SOURCE = "debug";
    static final String ERROR_SOURCE = "error";

    private static final List<String> ERROR_MARKERS =
            List.of("ERROR", "Exception", "Traceback", "Failed", "Error");

    // yyyy-MM-dd[ T]HH:mm:ss with an optional [.,]fraction
    private static final Pattern TIMESTAMP = Pattern.compile(
            "(\\d{4}-\\d{2}-\\d{2})[\\sT](\\d{2}:\\d{2}:\\d{2})(?:[.,](\\d+))?");

    private static final int RECENT_SCAN_LINES = 100;

    private static final Map<String, String> FALLBACK_RECOMMENDATIONS = new LinkedHashMap<>();
    static {
        FALLBACK_RECOMMENDATIONS.put("import_errors",    "Check and update requirements.txt for missing dependencies");
        FALLBACK_RECOMMENDATIONS.put("api_errors",       "Verify API key validity and network connectivity");
        FALLBACK_RECOMMENDATIONS.put("attribute_errors", "Review code for missing method/attribute implementations");
        FALLBACK_RECOMMENDATIONS.put("type_errors",      "Check argument types passed between functions");
        FALLBACK_RECOMMENDATIONS.put("value_errors",     "Validate input values before use");
        FALLBACK_RECOMMENDATIONS.put("key_errors",       "Guard dictionary lookups against missing keys");
        FALLBACK_RECOMMENDATIONS.put("ssl_errors",       "Check SSL certificate configuration and proxy settings");
        FALLBACK_RECOMMENDATIONS.put("database_errors",  "Verify database connectivity and query syntax");
    }

    private final AutoHealProperties.Logs settings;
    private final FileSystemManager       fileSystem;
    private final ModelClient             modelClient;
    private final Clock                   clock;

    public LogAnalyzer(AutoHealProperties properties,
                       FileSystemManager fileSystem,
                       ModelClient modelClient,
                       Clock clock) {
        this.settings    = properties.getLogs();
        this.fileSystem  = fileSystem;
        this.modelClient = modelClient;
        this.clock       = clock;
    }

    public LogAnalysis analyze() {
        return analyze(settings.getWindowHours(), LogScope.ALL);
    }

    public LogAnalysis analyze(int windowHours, LogScope scope) {

        LocalDateTime now    = LocalDateTime.now(clock);
        LocalDateTime cutoff = now.minusHours(windowHours);

        log.info("[LogAnalyzer] Analyzing {} logs for the last {}h", scope.name().toLowerCase(Locale.ROOT), windowHours);

        List<LogErrorRecord>         errors   = new ArrayList<>();
        List<LogWarningRecord>       warnings = new ArrayList<>();
        Map<String, LogSourceReport> sources  = new LinkedHashMap<>();

        if (scope.includesDebug()) {
            sources.put(DEBUG_SOURCE, analyzeFile(DEBUG_SOURCE, settings.getDebugFile(), cutoff, errors, warnings));
        }
        if (scope.includesError()) {
            sources.put(ERROR_SOURCE, analyzeFile(ERROR_SOURCE, settings.getErrorFile(), cutoff, errors, warnings));
        }

        Map<String, Integer> histogram = new LinkedHashMap<>();
        for (LogErrorRecord error : errors) {
            histogram.merge(error.getClassifiedType(), 1, Integer::sum);
        }

        log.info("[LogAnalyzer] {} errors, {} warnings, histogram: {}", errors.size(), warnings.size(), histogram);

        List<String> recommendations = generateRecommendations(errors, histogram);

        return new LogAnalysis(now, windowHours, errors, warnings, histogram, recommendations, sources);
    }

    /**
     * Newest-first error lines from the tail of the error log (last 100 lines).
     * Ignores the analysis window.
     */
    public List<LogErrorRecord> recentErrors(int count) {

        Path path = fileSystem.resolveConfigured(settings.getErrorFile());
        if (!Files.isRegularFile(path)) {
            return List.of();
        }

        List<String> lines;
        try {
            lines = readLines(path);
        } catch (IOException e) {
            log.error("[LogAnalyzer] Failed reading recent errors from {}", path, e);
            return List.of();
        }

        List<LogErrorRecord> recent = new ArrayList<>();
        int start = Math.max(0, lines.size() - RECENT_SCAN_LINES);
        for (int i = lines.size() - 1; i >= start && recent.size() < count; i--) {
            String line = lines.get(i);
            if (isError(line)) {
                recent.add(new LogErrorRecord(
                        line.strip(), extractTimestamp(line), ErrorCategory.classify(line), ERROR_SOURCE));
            }
        }
        return recent;
    }

    // =========================================================================
    // Per-file pass
    // =========================================================================

    private LogSourceReport analyzeFile(String source,
                                        String configuredPath,
                                        LocalDateTime cutoff,
                                        List<LogErrorRecord> errors,
                                        List<LogWarningRecord> warnings) {

        Path            path   = fileSystem.resolveConfigured(configuredPath);
        LogSourceReport report = new LogSourceReport(configuredPath);

        if (!Files.isRegularFile(path)) {
            log.warn("[LogAnalyzer] Log file not found: {}", path);
            report.fail("Log file not found: " + configuredPath);
            return report;
        }

        List<String> lines;
        try {
            lines = readLines(path);
        } catch (IOException e) {
            log.error("[LogAnalyzer] Error analyzing log file {}", path, e);
            report.fail(e.getMessage());
            return report;
        }

        for (String line : lines) {
            report.countLine();

            LocalDateTime timestamp = extractTimestamp(line);
            if (timestamp != null && timestamp.isBefore(cutoff)) {
                continue;
            }

            if (isError(line)) {
                errors.add(new LogErrorRecord(line.strip(), timestamp, ErrorCategory.classify(line), source));
                report.countError();
            } else if (isWarning(line)) {
                warnings.add(new LogWarningRecord(line.strip(), timestamp, source));
                report.countWarning();
            } else {
                report.countInfo();
            }
        }

        log.debug("[LogAnalyzer] {}: {} lines, {} errors, {} warnings",
                source, report.getTotalLines(), report.getErrorCount(), report.getWarningCount());
        return report;
    }

    // =========================================================================
    // Recommendations
    // =========================================================================

    private List<String> generateRecommendations(List<LogErrorRecord> errors, Map<String, Integer> histogram) {

        if (errors.isEmpty()) {
            return List.of(NO_ERRORS_MESSAGE);
        }

        List<LogErrorRecord> sample = errors.subList(0, Math.min(settings.getSampleSize(), errors.size()));

        Map<String, Object> context = new LinkedHashMap<>();
        context.put("error_count", errors.size());
        context.put("error_patterns", histogram);
        context.put("sample_errors", sample);

        String prompt = "Analyze these application errors and provide specific recommendations.\n"
                + "Error patterns: " + histogram + "\n"
                + "Provide actionable recommendations to fix these issues.";

        ModelResponse response = modelClient.analyze(prompt, context);
        if (response.isSuccess() && response.hasText()) {
            List<String> parsed = RecommendationParser.parse(response.getResponse());
            if (!parsed.isEmpty()) {
                return parsed;
            }
        } else {
            log.warn("[LogAnalyzer] Model recommendations unavailable ({}), using fallback", response.getError());
        }

        return fallbackRecommendations(histogram);
    }

    static List<String> fallbackRecommendations(Map<String, Integer> histogram) {
        List<String> recommendations = new ArrayList<>();
        for (Map.Entry<String, String> entry : FALLBACK_RECOMMENDATIONS.entrySet()) {
            if (histogram.containsKey(entry.getKey())) {
                recommendations.add(entry.getValue());
            }
        }
        if (recommendations.isEmpty()) {
            recommendations.add("Review unclassified errors in the logs manually");
        }
        return recommendations;
    }

    // =========================================================================
    // Line helpers
    // =========================================================================

    static boolean isError(String line) {
        for (String marker : ERROR_MARKERS) {
            if (line.contains(marker)) return true;
        }
        return false;
    }

    static boolean isWarning(String line) {
        String upper = line.toUpperCase(Locale.ROOT);
        return upper.contains("WARNING") || upper.contains("WARN");
    }

    static LocalDateTime extractTimestamp(String line) {
        Matcher m = TIMESTAMP.matcher(line);
        if (!m.find()) {
            return null;
        }
        try {
            LocalDateTime ts = LocalDateTime.of(LocalDate.parse(m.group(1)), LocalTime.parse(m.group(2)));
            String fraction = m.group(3);
            if (fraction != null) {
                String nanos = (fraction + "000000000").substring(0, 9);
                ts = ts.withNano(Integer.parseInt(nanos));
            }
            return ts;
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static List<String> readLines(Path path) throws IOException {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.IGNORE)
                .onUnmappableCharacter(CodingErrorAction.IGNORE);

        List<String> lines = new ArrayList<>();
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(Files.newInputStream(path), decoder))) {
            String line;
            while ((line = reader.readLine()) != null) {
                lines.add(line);
            }
        }
        return lines;
    }
}
