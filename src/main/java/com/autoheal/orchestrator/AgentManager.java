package com.autoheal.orchestrator;

import com.autoheal.config.AutoHealProperties;
import com.autoheal.core.code.CodeAnalysis;
import com.autoheal.core.code.CodeAnalyzer;
import com.autoheal.core.filesystem.FileSystemManager;
import com.autoheal.core.learning.ErrorObservation;
import com.autoheal.core.learning.Insights;
import com.autoheal.core.learning.KnowledgeBase;
import com.autoheal.core.logs.LogAnalysis;
import com.autoheal.core.logs.LogAnalyzer;
import com.autoheal.core.logs.LogErrorRecord;
import com.autoheal.core.logs.LogScope;
import com.autoheal.core.optimization.Improvement;
import com.autoheal.core.optimization.OptimizationAgent;
import com.autoheal.core.optimization.OptimizationKind;
import com.autoheal.core.optimization.OptimizationReport;
import com.autoheal.core.repair.RepairAgent;
import com.autoheal.core.repair.RepairKind;
import com.autoheal.core.repair.RepairOutcome;
import com.autoheal.core.repair.RepairReport;
import com.autoheal.core.repair.RepairStatus;
import com.autoheal.llm.ModelClient;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.*;
import java.util.stream.Collectors;

/**
 * AgentManager: top-level entry points of the audit loop.
 *
 *   audit    = analyze logs + code, feed every log error to the knowledge base
 *   repair   = RepairAgent run, then learn from each success/failed outcome
 *   optimize = OptimizationAgent run, then learn from every outcome
 *
 * Each run writes {last_run, results} to the status file. Failure to write it is
 * logged and never fails the run.
 */
@Component
public class AgentManager {

    private static final Logger log = LoggerFactory.getLogger(AgentManager.class);

    private final LogAnalyzer       logAnalyzer;
    private final CodeAnalyzer      codeAnalyzer;
    private final RepairAgent       repairAgent;
    private final OptimizationAgent optimizationAgent;
    private final KnowledgeBase     knowledgeBase;
    private final ModelClient       modelClient;
    private final ObjectMapper      mapper;
    private final Path              statusFile;
    private final int               windowHours;
    private final Clock             clock;

    public AgentManager(AutoHealProperties properties,
                        FileSystemManager fileSystem,
                        LogAnalyzer logAnalyzer,
                        CodeAnalyzer codeAnalyzer,
                        RepairAgent repairAgent,
                        OptimizationAgent optimizationAgent,
                        KnowledgeBase knowledgeBase,
                        ModelClient modelClient,
                        ObjectMapper objectMapper,
                        Clock clock) {
        this.logAnalyzer       = logAnalyzer;
        this.codeAnalyzer      = codeAnalyzer;
        this.repairAgent       = repairAgent;
        this.optimizationAgent = optimizationAgent;
        this.knowledgeBase     = knowledgeBase;
        this.modelClient       = modelClient;
        this.statusFile        = fileSystem.resolveConfigured(properties.getStatusFile());
        this.windowHours       = properties.getLogs().getWindowHours();
        this.clock             = clock;
        this.mapper            = objectMapper.copy()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);

        log.info("[AgentManager] Ready (model backend: {})", modelClient.getProfile());
    }

    // =========================================================================
    // Entry points
    // =========================================================================

    public AuditReport runFullAudit() {
        log.info("[AgentManager] Starting full audit");
        LogAnalysis  logAnalysis  = null;
        CodeAnalysis codeAnalysis = null;
        AuditReport  report;

        try {
            logAnalysis  = logAnalyzer.analyze(windowHours, LogScope.ALL);
            codeAnalysis = codeAnalyzer.analyze();

            List<ErrorObservation> observations = new ArrayList<>();
            for (LogErrorRecord error : logAnalysis.getErrors()) {
                observations.add(ErrorObservation.of(error.getClassifiedType(), error.getRawLine()));
            }
            knowledgeBase.learnFromErrors(observations);

            Set<String> recommendations = new LinkedHashSet<>();
            recommendations.addAll(logAnalysis.getRecommendations());
            recommendations.addAll(codeAnalysis.getRecommendations());
            recommendations.addAll(knowledgeBase.generateInsights().getRecommendations());

            report = new AuditReport(now(), AuditReport.COMPLETED, logAnalysis, codeAnalysis,
                    new ArrayList<>(recommendations), null);
            log.info("[AgentManager] Audit completed: {} log errors, {} code issues",
                    logAnalysis.getErrors().size(), codeAnalysis.getIssues().size());

        } catch (RuntimeException e) {
            log.error("[AgentManager] Audit failed", e);
            report = new AuditReport(now(), AuditReport.FAILED, logAnalysis, codeAnalysis, List.of(), e.getMessage());
        }

        saveStatus(report);
        return report;
    }

    /**
     * @throws IllegalArgumentException on an unknown kind, before anything runs
     */
    public RepairReport runAutoRepair(Collection<String> kinds) {
        Set<RepairKind> requested = RepairKind.parseAll(kinds);
        log.info("[AgentManager] Starting auto repair: {}", requested);

        RepairReport report = repairAgent.autoRepair(requested);

        List<ErrorObservation> observations = report.getRepairs().stream()
                .filter(RepairOutcome::isConclusive)
                .map(o -> ErrorObservation.withFix(
                        o.getIssueKind(),
                        o.getActionDescription() != null ? o.getActionDescription() : o.getErrorDetail(),
                        o.getFixStrategy().id(),
                        o.getStatus() == RepairStatus.SUCCESS))
                .collect(Collectors.toList());
        knowledgeBase.learnFromErrors(observations);

        saveStatus(report);
        return report;
    }

    /**
     * @throws IllegalArgumentException on an unknown kind, before anything runs
     */
    public OptimizationReport runOptimization(Collection<String> kinds) {
        Set<OptimizationKind> requested = OptimizationKind.parseAll(kinds);
        log.info("[AgentManager] Starting optimization: {}", requested);

        OptimizationReport report = optimizationAgent.optimize(requested);

        String improvementSummary = report.getImprovements().isEmpty() ? null
                : report.getImprovements().stream().map(Improvement::toString).collect(Collectors.joining(", "));

        for (RepairOutcome outcome : report.getOptimizations()) {
            boolean succeeded = outcome.getStatus() == RepairStatus.SUCCESS;
            knowledgeBase.learnFromOptimization(outcome.getIssueKind(), succeeded,
                    succeeded ? improvementSummary : null);
        }

        saveStatus(report);
        return report;
    }

    public Insights getInsights() {
        return knowledgeBase.generateInsights();
    }

    public AgentStatus getStatus() {
        boolean available = modelClient.isAvailable();
        String  state     = available ? "ready" : "not_available";

        if (!Files.isRegularFile(statusFile)) {
            return new AgentStatus(state, available, modelClient.getProfile(), null, null, null);
        }

        try {
            JsonNode saved = mapper.readTree(statusFile.toFile());
            String lastRun = saved.hasNonNull("last_run") ? saved.get("last_run").asText() : null;
            return new AgentStatus(state, available, modelClient.getProfile(), lastRun, saved.get("results"), null);
        } catch (IOException e) {
            log.error("[AgentManager] Error reading status file {}", statusFile, e);
            return new AgentStatus(state, available, modelClient.getProfile(), null, null,
                    "Status file unreadable: " + e.getMessage());
        }
    }

    // =========================================================================

    private void saveStatus(Object results) {
        try {
            ObjectNode status = mapper.createObjectNode();
            status.put("last_run", now().toString());
            status.set("results", mapper.valueToTree(results));

            Path parent = statusFile.getParent();
            if (parent != null) Files.createDirectories(parent);
            mapper.writeValue(statusFile.toFile(), status);
        } catch (IOException | IllegalArgumentException e) {
            log.error("[AgentManager] Error saving status to {}", statusFile, e);
        }
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }
}
