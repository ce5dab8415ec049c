package com.autoheal.core.optimization;

import com.autoheal.config.AutoHealProperties;
import com.autoheal.core.code.CodeAnalyzer;
import com.autoheal.core.code.CodeMetrics;
import com.autoheal.core.code.Optimization;
import com.autoheal.core.executor.CommandResult;
import com.autoheal.core.executor.CommandRunner;
import com.autoheal.core.filesystem.FileSystemManager;
import com.autoheal.core.repair.FixStrategy;
import com.autoheal.core.repair.RepairOutcome;
import com.autoheal.core.repair.RepairStatus;
import com.autoheal.llm.ModelClient;
import com.autoheal.llm.StubLLMClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.EnumSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OptimizationAgentTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC);

    private static final String LOOP_SOURCE = String.join("\n",
            "def total(items):",
            "    result = 0",
            "    for i in range(len(items)):",
            "        result += items[i]",
            "    return result",
            "");

    @TempDir
    Path tempDir;

    private AutoHealProperties properties;
    private FileSystemManager  fileSystem;
    private CommandResult      commandResult;

    @BeforeEach
    void setUp() {
        properties    = new AutoHealProperties();
        properties.setWorkspacePath(tempDir.toString());
        fileSystem    = new FileSystemManager(properties);
        commandResult = new CommandResult(0, "", false, 5);
    }

    private OptimizationAgent agent() {
        ModelClient modelClient = StubLLMClient.failing("offline").asModelClient();
        CommandRunner runner = new CommandRunner(properties) {
            @Override
            public CommandResult run(List<String> command) {
                return commandResult;
            }
        };
        return new OptimizationAgent(properties, fileSystem,
                new CodeAnalyzer(properties, fileSystem, modelClient, CLOCK), runner, CLOCK);
    }

    @Test
    void testRangeLenRewrite() {
        assertEquals("for i, item in enumerate(values):",
                OptimizationAgent.rewriteRangeLen("for i in range(len(values)):"));
        assertEquals("for idx, item in enumerate(self.rows):",
                OptimizationAgent.rewriteRangeLen("for idx in range( len( self.rows ) ):"));
        assertEquals("while True:", OptimizationAgent.rewriteRangeLen("while True:"));
    }

    @Test
    void testIterationRewriteImprovesMetrics() throws Exception {
        Files.writeString(tempDir.resolve("loops.py"), LOOP_SOURCE);

        OptimizationReport report = agent().optimize(EnumSet.of(OptimizationKind.CODE));

        assertEquals(1, report.getOptimizations().size());
        RepairOutcome outcome = report.getOptimizations().get(0);
        assertEquals(Optimization.INEFFICIENT_ITERATION, outcome.getIssueKind());
        assertEquals(FixStrategy.ENUMERATE_REWRITE, outcome.getFixStrategy());
        assertEquals(RepairStatus.SUCCESS, outcome.getStatus());
        assertTrue(Files.exists(Path.of(outcome.getBackupReference())));
        assertTrue(Files.readString(tempDir.resolve("loops.py")).contains("for i, item in enumerate(items):"));

        assertEquals(1, report.getMetricsBefore().getOptimizationOpportunities());
        assertEquals(0, report.getMetricsAfter().getOptimizationOpportunities());
        assertEquals(1, report.getImprovements().size());
        Improvement improvement = report.getImprovements().get(0);
        assertEquals(CodeMetrics.OPTIMIZATION_OPPORTUNITIES, improvement.getMetric());
        assertEquals("100.0%", improvement.getImprovement());
    }

    @Test
    void testMultipleAppendNeedsManualReview() throws Exception {
        Files.writeString(tempDir.resolve("build.py"), "out = []\nout.append(1)\nout.append(2)\n");

        OptimizationReport report = agent().optimize(EnumSet.of(OptimizationKind.CODE));

        RepairOutcome outcome = report.getOptimizations().get(0);
        assertEquals(Optimization.MULTIPLE_APPEND, outcome.getIssueKind());
        assertEquals(RepairStatus.SKIPPED, outcome.getStatus());
        assertEquals("Requires manual review", outcome.getActionDescription());
        assertTrue(report.getImprovements().isEmpty());
    }

    @Test
    void testPerformanceContributesNothing() throws Exception {
        Files.writeString(tempDir.resolve("loops.py"), LOOP_SOURCE);

        OptimizationReport report = agent().optimize(EnumSet.of(OptimizationKind.PERFORMANCE));

        assertTrue(report.getOptimizations().isEmpty());
        assertEquals(LOOP_SOURCE, Files.readString(tempDir.resolve("loops.py")));
    }

    @Test
    void testOutdatedDependencies() throws Exception {
        OptimizationAgent agent = agent();

        RepairOutcome noManifest = agent.optimize(EnumSet.of(OptimizationKind.DEPENDENCIES)).getOptimizations().get(0);
        assertEquals(RepairStatus.SKIPPED, noManifest.getStatus());

        Files.writeString(tempDir.resolve("requirements.txt"), "requests\n");
        RepairOutcome upToDate = agent.optimize(EnumSet.of(OptimizationKind.DEPENDENCIES)).getOptimizations().get(0);
        assertEquals("All dependencies up to date", upToDate.getActionDescription());

        commandResult = new CommandResult(0, "requests 2.25.0 2.31.0 wheel\n", false, 5);
        RepairOutcome outdated = agent.optimize(EnumSet.of(OptimizationKind.DEPENDENCIES)).getOptimizations().get(0);
        assertEquals(RepairStatus.SUGGESTED, outdated.getStatus());
        assertEquals(FixStrategy.OUTDATED_CHECK, outdated.getFixStrategy());
        assertEquals("requests 2.25.0 2.31.0 wheel", outdated.getSuggestion());

        commandResult = new CommandResult(1, "pip: not found", false, 5);
        RepairOutcome failed = agent.optimize(EnumSet.of(OptimizationKind.DEPENDENCIES)).getOptimizations().get(0);
        assertEquals(RepairStatus.FAILED, failed.getStatus());
    }

    @Test
    void testOnlyStrictDecreasesAreImprovements() {
        CodeMetrics before = new CodeMetrics(4, 2, 2, 0, 3);
        CodeMetrics after  = new CodeMetrics(5, 1, 4, 0, 3);

        List<Improvement> improvements = OptimizationAgent.improvements(before, after);

        assertEquals(1, improvements.size());
        assertEquals(CodeMetrics.HIGH_SEVERITY, improvements.get(0).getMetric());
        assertEquals("50.0%", improvements.get(0).getImprovement());
    }

    @Test
    void testKindParsing() {
        assertEquals(EnumSet.allOf(OptimizationKind.class), OptimizationKind.parseAll(List.of()));
        assertThrows(IllegalArgumentException.class, () -> OptimizationKind.fromString("memory"));
    }
}
