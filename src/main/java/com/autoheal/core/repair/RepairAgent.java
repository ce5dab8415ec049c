package com.autoheal.core.repair;

import com.autoheal.config.AutoHealProperties;
import com.autoheal.core.code.CodeAnalysis;
import com.autoheal.core.code.CodeAnalyzer;
import com.autoheal.core.code.Issue;
import com.autoheal.core.code.PythonSyntaxParser;
import com.autoheal.core.code.Severity;
import com.autoheal.core.executor.CommandResult;
import com.autoheal.core.executor.CommandRunner;
import com.autoheal.core.filesystem.FileSystemManager;
import com.autoheal.core.filesystem.FileSystemManager.FileSystemException;
import com.autoheal.core.learning.KnowledgeBase;
import com.autoheal.core.learning.SuggestedFix;
import com.autoheal.core.logs.LogAnalysis;
import com.autoheal.core.logs.LogAnalyzer;
import com.autoheal.core.logs.LogErrorRecord;
import com.autoheal.core.logs.LogScope;
import com.autoheal.llm.ModelClient;
import com.autoheal.llm.ModelResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * RepairAgent: one fix attempt per eligible problem found by a fresh log and code analysis.
 *
 * Safety rules:
 *   - api_errors are never repaired; they are credential or network problems.
 *   - A source file is backed up immediately before it is written. If the write throws,
 *     the file is restored from that backup before the outcome is reported failed.
 *   - Every rewritten source must parse before it is written.
 *   - One item's failure never stops the batch.
 */
@Component
public class RepairAgent {

    private static final Logger log = LoggerFactory.getLogger(RepairAgent.class);

    static final String API_MANUAL_ACTION         = "API errors require manual verification";
    static final String API_MANUAL_RECOMMENDATION = "Check API key and network connectivity";
    static final String NO_CHANGES_NEEDED         = "No changes needed";

    private static final Pattern MISSING_MODULE = Pattern.compile("No module named ['\"]([^'\"]+)['\"]");
    private static final Pattern BARE_EXCEPT    = Pattern.compile("except\\s*:");

    /** Import name -> distribution name, where they differ. */
    private static final Map<String, String> PACKAGE_NAMES = Map.of(
            "PIL",     "Pillow",
            "yaml",    "PyYAML",
            "dotenv",  "python-dotenv",
            "cv2",     "opencv-python",
            "sklearn", "scikit-learn",
            "bs4",     "beautifulsoup4");

    private final AutoHealProperties properties;
    private final FileSystemManager  fileSystem;
    private final LogAnalyzer        logAnalyzer;
    private final CodeAnalyzer       codeAnalyzer;
    private final KnowledgeBase      knowledgeBase;
    private final ModelClient        modelClient;
    private final CommandRunner      commandRunner;
    private final PythonSyntaxParser parser = new PythonSyntaxParser();
    private final Clock              clock;

    public RepairAgent(AutoHealProperties properties,
                       FileSystemManager fileSystem,
                       LogAnalyzer logAnalyzer,
                       CodeAnalyzer codeAnalyzer,
                       KnowledgeBase knowledgeBase,
                       ModelClient modelClient,
                       CommandRunner commandRunner,
                       Clock clock) {
        this.properties    = properties;
        this.fileSystem    = fileSystem;
        this.logAnalyzer   = logAnalyzer;
        this.codeAnalyzer  = codeAnalyzer;
        this.knowledgeBase = knowledgeBase;
        this.modelClient   = modelClient;
        this.commandRunner = commandRunner;
        this.clock         = clock;
    }

    public RepairReport autoRepair(Set<RepairKind> kinds) {

        Set<RepairKind> requested = kinds == null || kinds.isEmpty() ? EnumSet.allOf(RepairKind.class) : kinds;
        log.info("[RepairAgent] Auto repair requested for {}", requested);

        LogAnalysis  logAnalysis  = logAnalyzer.analyze(properties.getLogs().getWindowHours(), LogScope.ALL);
        CodeAnalysis codeAnalysis = codeAnalyzer.analyze();

        List<RepairOutcome> repairs = new ArrayList<>();

        if (requested.contains(RepairKind.LOGS)) {
            repairs.addAll(repairLogIssues(logAnalysis));
        }
        if (requested.contains(RepairKind.CODE)) {
            repairs.addAll(repairCodeIssues(codeAnalysis));
        }
        if (requested.contains(RepairKind.DEPENDENCIES)) {
            repairs.add(repairDependencies());
        }

        RepairReport report = new RepairReport(LocalDateTime.now(clock), repairs);
        log.info("[RepairAgent] Done: {} success, {} failed, {} skipped",
                report.getSuccessCount(), report.getFailedCount(), report.getSkippedCount());
        return report;
    }

    // =========================================================================
    // Log-derived repairs
    // =========================================================================

    private List<RepairOutcome> repairLogIssues(LogAnalysis analysis) {
        List<RepairOutcome> outcomes = new ArrayList<>();
        List<LogErrorRecord> errors  = analysis.getErrors();
        int limit = Math.min(properties.getRepair().getMaxLogRepairs(), errors.size());

        for (LogErrorRecord error : errors.subList(0, limit)) {
            try {
                outcomes.add(repairLogError(error));
            } catch (RuntimeException e) {
                log.error("[RepairAgent] Log repair for {} failed", error.getClassifiedType(), e);
                outcomes.add(RepairOutcome.builder(error.getClassifiedType(), FixStrategy.NONE)
                        .status(RepairStatus.FAILED).error(e.getMessage()).at(now()).build());
            }
        }
        return outcomes;
    }

    RepairOutcome repairLogError(LogErrorRecord error) {
        switch (error.getClassifiedType()) {
            case "import_errors":
                return repairImportError(error);
            case "api_errors":
                return RepairOutcome.builder(error.getClassifiedType(), FixStrategy.NONE)
                        .status(RepairStatus.SKIPPED)
                        .action(API_MANUAL_ACTION)
                        .recommendation(API_MANUAL_RECOMMENDATION)
                        .at(now())
                        .build();
            case "attribute_errors":
                return suggestAttributeFix(error);
            default:
                return suggestLearnedFix(error);
        }
    }

    private RepairOutcome repairImportError(LogErrorRecord error) {
        String kind     = error.getClassifiedType();
        String manifest = properties.getRepair().getDependencyManifest();

        Matcher m = MISSING_MODULE.matcher(error.getRawLine());
        if (!m.find()) {
            return RepairOutcome.builder(kind, FixStrategy.ADD_TO_MANIFEST)
                    .status(RepairStatus.SKIPPED).action("Could not extract module name").at(now()).build();
        }

        String module  = m.group(1).split("\\.")[0];
        String pkg     = PACKAGE_NAMES.getOrDefault(module, module);

        if (!fileSystem.fileExists(manifest)) {
            return RepairOutcome.builder(kind, FixStrategy.ADD_TO_MANIFEST)
                    .status(RepairStatus.SKIPPED)
                    .file(manifest)
                    .action("Cannot add " + pkg + " without a dependency manifest")
                    .error("Dependency manifest not found: " + manifest)
                    .at(now())
                    .build();
        }

        try {
            String content = fileSystem.readFile(manifest);
            if (content.toLowerCase(Locale.ROOT).contains(pkg.toLowerCase(Locale.ROOT))) {
                return RepairOutcome.builder(kind, FixStrategy.ADD_TO_MANIFEST)
                        .status(RepairStatus.SKIPPED).file(manifest)
                        .action(pkg + " already listed in " + manifest).at(now()).build();
            }

            String separator = content.isEmpty() || content.endsWith("\n") ? "" : "\n";
            fileSystem.writeFile(manifest, content + separator + pkg + "\n");

            log.info("[RepairAgent] Added {} to {}", pkg, manifest);
            return RepairOutcome.builder(kind, FixStrategy.ADD_TO_MANIFEST)
                    .status(RepairStatus.SUCCESS).file(manifest)
                    .action("Added " + pkg + " to " + manifest).at(now()).build();

        } catch (FileSystemException e) {
            log.error("[RepairAgent] Could not update {}: {}", manifest, e.getMessage());
            return RepairOutcome.builder(kind, FixStrategy.ADD_TO_MANIFEST)
                    .status(RepairStatus.FAILED).file(manifest).error(e.getMessage()).at(now()).build();
        }
    }

    private RepairOutcome suggestAttributeFix(LogErrorRecord error) {
        ModelResponse response = modelClient.analyze(
                "Fix this Python AttributeError:\n\n" + error.getRawLine() + "\n\nProvide the corrected code.",
                Map.of("error", error));

        if (response.isSuccess() && response.hasText()) {
            return RepairOutcome.builder(error.getClassifiedType(), FixStrategy.MODEL_SUGGESTION)
                    .status(RepairStatus.SUGGESTED)
                    .action("Model suggested a fix; apply it manually")
                    .suggestion(response.getResponse())
                    .at(now())
                    .build();
        }
        return RepairOutcome.builder(error.getClassifiedType(), FixStrategy.MODEL_SUGGESTION)
                .status(RepairStatus.SKIPPED)
                .action("Could not generate fix")
                .error(response.getError())
                .at(now())
                .build();
    }

    private RepairOutcome suggestLearnedFix(LogErrorRecord error) {
        Optional<SuggestedFix> learned = knowledgeBase.getSuggestedFix(error.getClassifiedType());
        if (learned.isPresent()) {
            SuggestedFix fix = learned.get();
            return RepairOutcome.builder(error.getClassifiedType(), FixStrategy.LEARNED_FIX)
                    .status(RepairStatus.SUGGESTED)
                    .action("Learned fix: " + fix.getAction())
                    .suggestion(fix.getAction())
                    .confidence(fix.getConfidence())
                    .at(now())
                    .build();
        }
        return RepairOutcome.builder(error.getClassifiedType(), FixStrategy.NONE)
                .status(RepairStatus.SKIPPED)
                .action("No automated repair for " + error.getClassifiedType())
                .at(now())
                .build();
    }

    // =========================================================================
    // Code repairs
    // =========================================================================

    private List<RepairOutcome> repairCodeIssues(CodeAnalysis analysis) {
        List<RepairOutcome> outcomes = new ArrayList<>();
        for (Issue issue : analysis.getIssues()) {
            if (issue.getSeverity() != Severity.HIGH && !Issue.BARE_EXCEPT.equals(issue.getKind())) {
                continue;
            }
            try {
                outcomes.add(repairCodeIssue(issue));
            } catch (RuntimeException e) {
                log.error("[RepairAgent] Repair of {} in {} failed", issue.getKind(), issue.getFile(), e);
                outcomes.add(RepairOutcome.builder(issue.getKind(), FixStrategy.NONE)
                        .status(RepairStatus.FAILED).file(issue.getFile()).error(e.getMessage()).at(now()).build());
            }
        }
        return outcomes;
    }

    RepairOutcome repairCodeIssue(Issue issue) {
        String kind = issue.getKind();
        String file = issue.getFile();

        if (file == null || !fileSystem.fileExists(file)) {
            return RepairOutcome.builder(kind, FixStrategy.NONE)
                    .status(RepairStatus.SKIPPED).file(file).action("File not found").at(now()).build();
        }

        FixStrategy strategy;
        if (Issue.BARE_EXCEPT.equals(kind)) {
            strategy = FixStrategy.REWRITE_BARE_EXCEPT;
        } else if (Issue.SYNTAX_ERROR.equals(kind)) {
            strategy = FixStrategy.MODEL_REWRITE;
        } else {
            return RepairOutcome.builder(kind, FixStrategy.NONE)
                    .status(RepairStatus.SKIPPED).file(file)
                    .action("No auto-fix available for " + kind).at(now()).build();
        }

        String original;
        try {
            original = fileSystem.readFile(file);
        } catch (FileSystemException e) {
            return RepairOutcome.builder(kind, strategy)
                    .status(RepairStatus.FAILED).file(file).error(e.getMessage()).at(now()).build();
        }

        Rewrite rewrite = strategy == FixStrategy.REWRITE_BARE_EXCEPT
                ? rewriteBareExcept(original)
                : rewriteSyntaxError(original, issue);

        if (rewrite.skipReason != null) {
            return RepairOutcome.builder(kind, strategy)
                    .status(RepairStatus.SKIPPED).file(file).action(rewrite.skipReason).at(now()).build();
        }
        if (rewrite.failure != null) {
            return RepairOutcome.builder(kind, strategy)
                    .status(RepairStatus.FAILED).file(file).error(rewrite.failure).at(now()).build();
        }

        Optional<PythonSyntaxParser.SyntaxProblem> problem = parser.findSyntaxError(rewrite.content);
        if (problem.isPresent()) {
            log.warn("[RepairAgent] Rejected {} rewrite of {}: {}", strategy.id(), file, problem.get());
            return RepairOutcome.builder(kind, strategy)
                    .status(RepairStatus.FAILED).file(file)
                    .error("Rewrite does not parse: " + problem.get().getMessage()).at(now()).build();
        }

        return applyWithBackup(kind, strategy, file, rewrite.content, rewrite.description);
    }

    private RepairOutcome applyWithBackup(String kind, FixStrategy strategy, String file,
                                          String content, String description) {
        try {
            Path backup = fileSystem.replaceWithBackup(file, content);
            log.info("[RepairAgent] {} applied to {} (backup {})", strategy.id(), file, backup.getFileName());
            return RepairOutcome.builder(kind, strategy)
                    .status(RepairStatus.SUCCESS).file(file).backup(backup.toString())
                    .action(description).at(now()).build();
        } catch (FileSystemException e) {
            log.error("[RepairAgent] {} on {} failed: {}", strategy.id(), file, e.getMessage());
            return RepairOutcome.builder(kind, strategy)
                    .status(RepairStatus.FAILED).file(file).error(e.getMessage()).at(now()).build();
        }
    }

    static String narrowBareExcepts(String content) {
        return BARE_EXCEPT.matcher(content).replaceAll("except Exception:");
    }

    private Rewrite rewriteBareExcept(String original) {
        String fixed = narrowBareExcepts(original);
        if (fixed.equals(original)) {
            return Rewrite.skip(NO_CHANGES_NEEDED);
        }
        return Rewrite.of(fixed, "Replaced bare except with except Exception");
    }

    private Rewrite rewriteSyntaxError(String original, Issue issue) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("issue", issue);

        ModelResponse response = modelClient.analyze(
                "Fix the syntax error in this Python code:\n\n" + original
                        + "\n\nError: " + issue.getMessage()
                        + "\nLine: " + issue.getLine()
                        + "\n\nProvide the corrected code.",
                context);

        if (!response.isSuccess() || !response.hasText()) {
            return Rewrite.fail("Could not generate fix: " + response.getError());
        }

        Optional<String> code = CodeBlockExtractor.extract(response.getResponse());
        if (code.isEmpty()) {
            return Rewrite.fail("Model response contained no code");
        }
        return Rewrite.of(code.get(), "Fixed syntax error at line " + issue.getLine());
    }

    // =========================================================================
    // Dependency repair
    // =========================================================================

    private RepairOutcome repairDependencies() {
        String manifest = properties.getRepair().getDependencyManifest();

        if (!fileSystem.fileExists(manifest)) {
            return RepairOutcome.builder("dependencies", FixStrategy.DEPENDENCY_SCAN)
                    .status(RepairStatus.SKIPPED).file(manifest)
                    .action("Dependency scan needs an existing manifest")
                    .error("Dependency manifest not found: " + manifest)
                    .at(now()).build();
        }

        CommandResult result = commandRunner.run(properties.getRepair().getDependencyScanCommand());
        if (result.isSuccess()) {
            return RepairOutcome.builder("dependencies", FixStrategy.DEPENDENCY_SCAN)
                    .status(RepairStatus.SUCCESS).file(manifest)
                    .action("Updated " + manifest).at(now()).build();
        }
        return RepairOutcome.builder("dependencies", FixStrategy.DEPENDENCY_SCAN)
                .status(RepairStatus.FAILED).file(manifest)
                .error(result.getOutput().strip()).at(now()).build();
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }

    // =========================================================================

    private static final class Rewrite {
        final String content;
        final String description;
        final String skipReason;
        final String failure;

        private Rewrite(String content, String description, String skipReason, String failure) {
            this.content     = content;
            this.description = description;
            this.skipReason  = skipReason;
            this.failure     = failure;
        }

        static Rewrite of(String content, String description) { return new Rewrite(content, description, null, null); }
        static Rewrite skip(String reason)                      { return new Rewrite(null, null, reason, null); }
        static Rewrite fail(String failure)                     { return new Rewrite(null, null, null, failure); }
    }
}
