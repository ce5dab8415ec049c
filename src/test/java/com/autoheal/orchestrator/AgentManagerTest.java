package com.autoheal.orchestrator;

import com.autoheal.core.code.Issue;
import com.autoheal.core.learning.Insights;
import com.autoheal.core.learning.KnowledgeBase;
import com.autoheal.core.optimization.OptimizationReport;
import com.autoheal.core.repair.FixStrategy;
import com.autoheal.core.repair.RepairReport;
import com.autoheal.core.repair.RepairStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@ActiveProfiles("test")
class AgentManagerTest {

    @TempDir
    static Path workspace;

    @DynamicPropertySource
    static void workspaceProperties(DynamicPropertyRegistry registry) {
        registry.add("autoheal.workspace-path", () -> workspace.toString());
    }

    @Autowired
    private AgentManager agentManager;

    @Autowired
    private KnowledgeBase knowledgeBase;

    @BeforeEach
    void seedWorkspace() throws Exception {
        Files.createDirectories(workspace.resolve("log"));
        Files.writeString(workspace.resolve("log/error.log"),
                "ERROR ModuleNotFoundError: No module named 'foo'\n"
                        + "INFO request served\n");
        Files.writeString(workspace.resolve("requirements.txt"), "requests\n");
        Files.writeString(workspace.resolve("app.py"), String.join("\n",
                "def load(path):",
                "    try:",
                "        return open(path).read()",
                "    except:",
                "        return None",
                ""));
    }

    @Test
    void testFullAuditLearnsAndRecordsStatus() {
        AuditReport report = agentManager.runFullAudit();

        assertEquals(AuditReport.COMPLETED, report.getStatus());
        assertNull(report.getError());
        assertEquals(1, report.getLogAnalysis().getErrors().size());
        assertTrue(report.getCodeAnalysis().getIssues().stream()
                .anyMatch(i -> i.getKind().equals(Issue.BARE_EXCEPT)));
        assertTrue(report.getRecommendations()
                .contains("Check and update requirements.txt for missing dependencies"));

        assertTrue(knowledgeBase.getErrorPattern("import_errors").isPresent());

        AgentStatus status = agentManager.getStatus();
        assertEquals("not_available", status.getStatus());
        assertFalse(status.isModelAvailable());
        assertNotNull(status.getLastRun());
        assertEquals("completed", status.getResults().get("status").asText());
        assertTrue(Files.exists(workspace.resolve("agent_status.json")));
    }

    @Test
    void testRepairOutcomesFeedKnowledgeBase() throws Exception {
        RepairReport report = agentManager.runAutoRepair(List.of("code"));

        assertEquals(1, report.getSuccessCount());
        assertTrue(Files.readString(workspace.resolve("app.py")).contains("except Exception:"));
        assertTrue(knowledgeBase
                .getFixPattern(Issue.BARE_EXCEPT, FixStrategy.REWRITE_BARE_EXCEPT.id())
                .orElseThrow().getSuccessCount() >= 1);
    }

    @Test
    void testDependencyToolFailureIsReportedNotThrown() {
        RepairReport report = agentManager.runAutoRepair(List.of("dependencies"));

        assertEquals(RepairStatus.FAILED, report.getRepairs().get(0).getStatus());
        assertEquals(1, report.getFailedCount());
    }

    @Test
    void testOptimizationRecordsPatterns() {
        OptimizationReport report = agentManager.runOptimization(List.of("code", "performance"));

        assertTrue(report.getOptimizations().isEmpty());
        assertNotNull(report.getMetricsBefore());
        assertNotNull(report.getMetricsAfter());
    }

    @Test
    void testUnknownKindIsRejectedBeforeAnythingRuns() throws Exception {
        assertThrows(IllegalArgumentException.class, () -> agentManager.runAutoRepair(List.of("code", "bogus")));
        assertThrows(IllegalArgumentException.class, () -> agentManager.runOptimization(List.of("memory")));
        assertTrue(Files.readString(workspace.resolve("app.py")).contains("except:"));
    }

    @Test
    void testInsights() {
        agentManager.runFullAudit();

        Insights insights = agentManager.getInsights();

        assertFalse(insights.getCommonErrors().isEmpty());
        assertTrue(insights.getRecommendations().isEmpty(), "No model, no generated recommendations");
    }
}
