package com.autoheal.core.code;

import com.autoheal.config.AutoHealProperties;
import com.autoheal.core.filesystem.FileSystemManager;
import com.autoheal.core.filesystem.FileSystemManager.FileSystemException;
import com.autoheal.llm.ModelClient;
import com.autoheal.llm.ModelResponse;
import com.autoheal.llm.RecommendationParser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.*;

/**
 * CodeAnalyzer: finds issues and optimization opportunities in the workspace's
 * Python sources.
 *
 * Per file: parse with tree-sitter. A file that does not parse gets exactly one
 * high syntax_error issue and no other checks. Otherwise the tree pass and the
 * line pass both run and their issues are merged, de-duplicated by (kind, file, line).
 *
 * One unreadable or broken file never stops the batch.
 */
@Component
public class CodeAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(CodeAnalyzer.class);

    private static final String PYTHON_SUFFIX = ".py";
    private static final int    PROMPT_ISSUES = 10;
    private static final int    PROMPT_OPTIMIZATIONS = 5;

    private final FileSystemManager       fileSystem;
    private final ModelClient             modelClient;
    private final AutoHealProperties.Analysis settings;
    private final PythonSyntaxParser      parser;
    private final SyntaxTreeInspector     treeInspector;
    private final LinePatternScanner      lineScanner;
    private final Clock                   clock;

    public CodeAnalyzer(AutoHealProperties properties,
                        FileSystemManager fileSystem,
                        ModelClient modelClient,
                        Clock clock) {
        this.fileSystem    = fileSystem;
        this.modelClient   = modelClient;
        this.settings      = properties.getAnalysis();
        this.parser        = new PythonSyntaxParser();
        this.treeInspector = new SyntaxTreeInspector(settings.getLongFunctionLines());
        this.lineScanner   = new LinePatternScanner();
        this.clock         = clock;
    }

    public CodeAnalysis analyze() {
        return analyze(null);
    }

    /**
     * @param paths explicit files (non-.py entries are ignored), or null / empty for
     *              a walk of the whole workspace
     */
    public CodeAnalysis analyze(List<String> paths) {
        Scan scan = scan(paths);
        CodeMetrics metrics = CodeMetrics.of(scan.issues, scan.optimizations);

        log.info("[CodeAnalyzer] {} files, {} issues ({} high), {} optimizations",
                scan.files.size(), metrics.getTotalIssues(), metrics.getHighSeverity(),
                metrics.getOptimizationOpportunities());

        List<String> recommendations = generateRecommendations(scan, metrics);

        return new CodeAnalysis(LocalDateTime.now(clock), scan.files.size(), scan.issues,
                scan.optimizations, metrics, recommendations, scan.fileErrors);
    }

    /** Same passes as analyze() over the whole workspace, without the model call. */
    public CodeAnalysis measure() {
        Scan scan = scan(null);
        return new CodeAnalysis(LocalDateTime.now(clock), scan.files.size(), scan.issues,
                scan.optimizations, CodeMetrics.of(scan.issues, scan.optimizations), List.of(), scan.fileErrors);
    }

    // =========================================================================
    // Scanning
    // =========================================================================

    private Scan scan(List<String> paths) {
        Scan scan = new Scan();

        try {
            scan.files.addAll(enumerate(paths));
        } catch (FileSystemException e) {
            log.error("[CodeAnalyzer] Could not enumerate sources", e);
            scan.fileErrors.put(fileSystem.getWorkspacePath(), e.getMessage());
            return scan;
        }

        for (String file : scan.files) {
            analyzeFile(file, scan);
        }
        return scan;
    }

    private List<String> enumerate(List<String> paths) throws FileSystemException {
        if (paths == null || paths.isEmpty()) {
            List<String> excluded = new ArrayList<>(settings.getExcludedDirectories());
            return fileSystem.listFiles(PYTHON_SUFFIX, excluded);
        }

        List<String> files = new ArrayList<>();
        for (String p : paths) {
            if (p == null || !p.endsWith(PYTHON_SUFFIX)) continue;
            Path path = Paths.get(p);
            files.add(path.isAbsolute() ? fileSystem.relativize(path) : p.replace('\\', '/'));
        }
        return files;
    }

    private void analyzeFile(String file, Scan scan) {
        String content;
        try {
            content = fileSystem.readFile(file);
        } catch (FileSystemException e) {
            log.error("[CodeAnalyzer] Error analyzing {}: {}", file, e.getMessage());
            scan.fileErrors.put(file, e.getMessage());
            return;
        }

        try {
            PythonSyntaxParser.ParsedSource parsed = parser.parse(content);
            Optional<PythonSyntaxParser.SyntaxProblem> problem = parsed.firstSyntaxProblem();

            if (problem.isPresent()) {
                int line = problem.get().getLine();
                log.warn("[CodeAnalyzer] {} does not parse: {}", file, problem.get().getMessage());
                scan.addIssue(new Issue(Issue.SYNTAX_ERROR, Severity.HIGH, file, line,
                        problem.get().getMessage(), parsed.line(line)));
                return;
            }

            treeInspector.inspect(parsed, file).forEach(scan::addIssue);
            lineScanner.scanIssues(content, file).forEach(scan::addIssue);
            scan.optimizations.addAll(lineScanner.scanOptimizations(content, file));

        } catch (RuntimeException e) {
            log.error("[CodeAnalyzer] Error analyzing {}", file, e);
            scan.fileErrors.put(file, String.valueOf(e.getMessage()));
        }
    }

    // =========================================================================
    // Recommendations
    // =========================================================================

    private List<String> generateRecommendations(Scan scan, CodeMetrics metrics) {

        Map<String, Object> context = new LinkedHashMap<>();
        context.put("issues", scan.issues.subList(0, Math.min(PROMPT_ISSUES, scan.issues.size())));
        context.put("optimizations",
                scan.optimizations.subList(0, Math.min(PROMPT_OPTIMIZATIONS, scan.optimizations.size())));
        context.put("metrics", metrics);

        ModelResponse response = modelClient.analyze(
                "Analyze these code issues and provide specific recommendations.\n"
                        + "Provide actionable recommendations to improve code quality.",
                context);

        if (response.isSuccess() && response.hasText()) {
            List<String> parsed = RecommendationParser.parse(response.getResponse());
            if (!parsed.isEmpty()) return parsed;
        } else {
            log.warn("[CodeAnalyzer] Model recommendations unavailable ({}), using fallback", response.getError());
        }

        return fallbackRecommendations(metrics);
    }

    static List<String> fallbackRecommendations(CodeMetrics metrics) {
        List<String> recommendations = new ArrayList<>();
        if (metrics.getHighSeverity() > 0) {
            recommendations.add("Address high-severity issues immediately");
        }
        if (metrics.getOptimizationOpportunities() > 0) {
            recommendations.add("Review and implement optimization opportunities");
        }
        return recommendations;
    }

    // =========================================================================

    private static final class Scan {
        final List<String>        files         = new ArrayList<>();
        final List<Issue>         issues        = new ArrayList<>();
        final List<Optimization>  optimizations = new ArrayList<>();
        final Map<String, String> fileErrors    = new LinkedHashMap<>();
        final Set<String>         seen          = new HashSet<>();

        void addIssue(Issue issue) {
            if (seen.add(issue.dedupKey())) {
                issues.add(issue);
            }
        }
    }
}
