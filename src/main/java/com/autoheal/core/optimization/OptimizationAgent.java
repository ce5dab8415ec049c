package com.autoheal.core.optimization;

import com.autoheal.config.AutoHealProperties;
import com.autoheal.core.code.CodeAnalysis;
import com.autoheal.core.code.CodeAnalyzer;
import com.autoheal.core.code.CodeMetrics;
import com.autoheal.core.code.Optimization;
import com.autoheal.core.code.PythonSyntaxParser;
import com.autoheal.core.executor.CommandResult;
import com.autoheal.core.executor.CommandRunner;
import com.autoheal.core.filesystem.FileSystemManager;
import com.autoheal.core.filesystem.FileSystemManager.FileSystemException;
import com.autoheal.core.repair.FixStrategy;
import com.autoheal.core.repair.RepairOutcome;
import com.autoheal.core.repair.RepairStatus;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.*;
import java.util.regex.Pattern;

/**
 * OptimizationAgent: applies safe textual rewrites and measures code metrics before
 * and after.
 *
 * The enumerate rewrite is not semantically verified; it only has to leave the file
 * parseable. Files are backed up before they are written.
 */
@Component
public class OptimizationAgent {

    private static final Logger log = LoggerFactory.getLogger(OptimizationAgent.class);

    static final List<String> TRACKED_METRICS = List.of(
            CodeMetrics.TOTAL_ISSUES, CodeMetrics.HIGH_SEVERITY, CodeMetrics.OPTIMIZATION_OPPORTUNITIES);

    private static final Pattern RANGE_LEN_LOOP = Pattern.compile(
            "for\\s+(\\w+)\\s+in\\s+range\\(\\s*len\\(\\s*([^()]+?)\\s*\\)\\s*\\)\\s*:");

    private final AutoHealProperties properties;
    private final FileSystemManager  fileSystem;
    private final CodeAnalyzer       codeAnalyzer;
    private final CommandRunner      commandRunner;
    private final PythonSyntaxParser parser = new PythonSyntaxParser();
    private final Clock              clock;

    public OptimizationAgent(AutoHealProperties properties,
                             FileSystemManager fileSystem,
                             CodeAnalyzer codeAnalyzer,
                             CommandRunner commandRunner,
                             Clock clock) {
        this.properties    = properties;
        this.fileSystem    = fileSystem;
        this.codeAnalyzer  = codeAnalyzer;
        this.commandRunner = commandRunner;
        this.clock         = clock;
    }

    public OptimizationReport optimize(Set<OptimizationKind> kinds) {

        Set<OptimizationKind> requested = kinds == null || kinds.isEmpty()
                ? EnumSet.allOf(OptimizationKind.class) : kinds;
        log.info("[OptimizationAgent] Optimization requested for {}", requested);

        CodeAnalysis before = codeAnalyzer.measure();
        List<RepairOutcome> outcomes = new ArrayList<>();

        if (requested.contains(OptimizationKind.CODE)) {
            outcomes.addAll(optimizeCode(before));
        }
        if (requested.contains(OptimizationKind.PERFORMANCE)) {
            log.info("[OptimizationAgent] No profiling data source; performance pass contributes nothing");
        }
        if (requested.contains(OptimizationKind.DEPENDENCIES)) {
            outcomes.add(checkOutdatedDependencies());
        }

        CodeMetrics after = codeAnalyzer.measure().getMetrics();
        List<Improvement> improvements = improvements(before.getMetrics(), after);

        log.info("[OptimizationAgent] {} outcomes, improvements: {}", outcomes.size(), improvements);
        return new OptimizationReport(now(), outcomes, improvements, before.getMetrics(), after);
    }

    /** Only metrics that strictly decreased; regressions are left out, never negative. */
    static List<Improvement> improvements(CodeMetrics before, CodeMetrics after) {
        List<Improvement> improvements = new ArrayList<>();
        for (String metric : TRACKED_METRICS) {
            int b = before.get(metric);
            int a = after.get(metric);
            if (a < b) {
                improvements.add(new Improvement(metric, b, a));
            }
        }
        return improvements;
    }

    // =========================================================================
    // Code
    // =========================================================================

    private List<RepairOutcome> optimizeCode(CodeAnalysis analysis) {
        List<RepairOutcome> outcomes = new ArrayList<>();
        for (Optimization opportunity : analysis.getOptimizations()) {
            try {
                if (Optimization.INEFFICIENT_ITERATION.equals(opportunity.getKind())) {
                    outcomes.add(rewriteIteration(opportunity));
                } else if (Optimization.MULTIPLE_APPEND.equals(opportunity.getKind())) {
                    outcomes.add(RepairOutcome.builder(opportunity.getKind(), FixStrategy.NONE)
                            .status(RepairStatus.SKIPPED).file(opportunity.getFile())
                            .action("Requires manual review").at(now()).build());
                }
            } catch (RuntimeException e) {
                log.error("[OptimizationAgent] {} in {} failed", opportunity.getKind(), opportunity.getFile(), e);
                outcomes.add(RepairOutcome.builder(opportunity.getKind(), FixStrategy.ENUMERATE_REWRITE)
                        .status(RepairStatus.FAILED).file(opportunity.getFile()).error(e.getMessage()).at(now()).build());
            }
        }
        return outcomes;
    }

    static String rewriteRangeLen(String content) {
        return RANGE_LEN_LOOP.matcher(content).replaceAll("for $1, item in enumerate($2):");
    }

    private RepairOutcome rewriteIteration(Optimization opportunity) {
        String kind = opportunity.getKind();
        String file = opportunity.getFile();

        if (file == null || !fileSystem.fileExists(file)) {
            return RepairOutcome.builder(kind, FixStrategy.ENUMERATE_REWRITE)
                    .status(RepairStatus.SKIPPED).file(file).action("File not found").at(now()).build();
        }

        try {
            String original  = fileSystem.readFile(file);
            String optimized = rewriteRangeLen(original);

            if (optimized.equals(original)) {
                return RepairOutcome.builder(kind, FixStrategy.ENUMERATE_REWRITE)
                        .status(RepairStatus.SKIPPED).file(file).action("No changes needed").at(now()).build();
            }

            Optional<PythonSyntaxParser.SyntaxProblem> problem = parser.findSyntaxError(optimized);
            if (problem.isPresent()) {
                log.warn("[OptimizationAgent] Rolled back enumerate rewrite of {}: {}", file, problem.get());
                return RepairOutcome.builder(kind, FixStrategy.ENUMERATE_REWRITE)
                        .status(RepairStatus.FAILED).file(file)
                        .error("Rewrite does not parse: " + problem.get().getMessage()).at(now()).build();
            }

            Path backup = fileSystem.replaceWithBackup(file, optimized);
            return RepairOutcome.builder(kind, FixStrategy.ENUMERATE_REWRITE)
                    .status(RepairStatus.SUCCESS).file(file).backup(backup.toString())
                    .action("Optimized iteration in " + file).at(now()).build();

        } catch (FileSystemException e) {
            log.error("[OptimizationAgent] Enumerate rewrite of {} failed: {}", file, e.getMessage());
            return RepairOutcome.builder(kind, FixStrategy.ENUMERATE_REWRITE)
                    .status(RepairStatus.FAILED).file(file).error(e.getMessage()).at(now()).build();
        }
    }

    // =========================================================================
    // Dependencies
    // =========================================================================

    private RepairOutcome checkOutdatedDependencies() {
        String manifest = properties.getRepair().getDependencyManifest();

        if (!fileSystem.fileExists(manifest)) {
            return RepairOutcome.builder("dependencies", FixStrategy.OUTDATED_CHECK)
                    .status(RepairStatus.SKIPPED)
                    .action("Outdated check needs an existing manifest")
                    .error("Dependency manifest not found: " + manifest)
                    .at(now()).build();
        }

        CommandResult result = commandRunner.run(properties.getOptimization().getOutdatedDependencyCommand());
        if (!result.isSuccess()) {
            return RepairOutcome.builder("dependencies", FixStrategy.OUTDATED_CHECK)
                    .status(RepairStatus.FAILED).error(result.getOutput().strip()).at(now()).build();
        }
        if (result.getOutput().isBlank()) {
            return RepairOutcome.builder("dependencies", FixStrategy.OUTDATED_CHECK)
                    .status(RepairStatus.SKIPPED).action("All dependencies up to date").at(now()).build();
        }
        return RepairOutcome.builder("dependencies", FixStrategy.OUTDATED_CHECK)
                .status(RepairStatus.SUGGESTED)
                .action("Update outdated dependencies")
                .suggestion(result.getOutput().strip())
                .at(now()).build();
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }
}
