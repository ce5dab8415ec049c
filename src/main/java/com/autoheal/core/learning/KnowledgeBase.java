package com.autoheal.core.learning;

import com.autoheal.config.AutoHealProperties;
import com.autoheal.core.filesystem.FileSystemManager;
import com.autoheal.llm.ModelClient;
import com.autoheal.llm.ModelResponse;
import com.autoheal.llm.RecommendationParser;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
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
 * KnowledgeBase: persisted ledger of which fixes work for which error types.
 *
 * Loaded once at construction. Every mutating call updates memory and then
 * rewrites the whole knowledge file. A failed write is logged and the in-memory
 * state is kept; a corrupt or missing file starts an empty store.
 *
 * Not safe for two processes sharing one file.
 */
@Component
public class KnowledgeBase {

    private static final Logger log = LoggerFactory.getLogger(KnowledgeBase.class);

    private static final int RECENT_IMPROVEMENTS = 3;

    private final Path         knowledgeFile;
    private final double       trustThreshold;
    private final int          insightLimit;
    private final ModelClient  modelClient;
    private final ObjectMapper mapper;
    private final Clock        clock;

    private final KnowledgeDocument knowledge;

    public KnowledgeBase(AutoHealProperties properties,
                         FileSystemManager fileSystem,
                         ModelClient modelClient,
                         ObjectMapper objectMapper,
                         Clock clock) {
        AutoHealProperties.Learning settings = properties.getLearning();
        this.knowledgeFile  = fileSystem.resolveConfigured(settings.getKnowledgeFile());
        this.trustThreshold = settings.getTrustThreshold();
        this.insightLimit   = settings.getInsightLimit();
        this.modelClient    = modelClient;
        this.clock          = clock;
        this.mapper         = objectMapper.copy()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
        this.knowledge      = load();
    }

    // =========================================================================
    // Learning
    // =========================================================================

    public void learnFromError(String type, String message) {
        learnFromErrors(List.of(ErrorObservation.of(type, message)));
    }

    public void learnFromError(String type, String message, String fixAction, boolean succeeded) {
        learnFromErrors(List.of(ErrorObservation.withFix(type, message, fixAction, succeeded)));
    }

    /** Applies every observation, then flushes once. */
    public void learnFromErrors(Collection<ErrorObservation> observations) {
        if (observations.isEmpty()) return;

        LocalDateTime now = LocalDateTime.now(clock);
        for (ErrorObservation observation : observations) {
            knowledge.getErrorPatterns()
                    .computeIfAbsent(observation.getType(), t -> new ErrorPattern(now))
                    .record(observation.getMessage(), now);

            if (observation.hasFix()) {
                knowledge.getFixPatterns()
                        .computeIfAbsent(observation.getType(), t -> new LinkedHashMap<>())
                        .computeIfAbsent(observation.getFixAction(), a -> new FixPattern(observation.getType(), a))
                        .record(observation.isSucceeded());
            }
        }

        log.debug("[Knowledge] Learned from {} error(s)", observations.size());
        save();
    }

    public void learnFromOptimization(String type, boolean succeeded, String improvement) {
        String key = type == null || type.isEmpty() ? "unknown" : type;
        knowledge.getOptimizationPatterns()
                .computeIfAbsent(key, k -> new OptimizationPattern())
                .record(succeeded, improvement);
        save();
    }

    public void addLearnedRule(String rule) {
        if (rule == null || rule.isBlank() || knowledge.getLearnedRules().contains(rule)) return;
        knowledge.getLearnedRules().add(rule);
        save();
    }

    // =========================================================================
    // Queries
    // =========================================================================

    /**
     * The trusted fix with the highest success rate for this error type (ties go to
     * the higher success count), or empty when no fix clears the threshold.
     */
    public Optional<SuggestedFix> getSuggestedFix(String errorType) {
        return knowledge.getFixPatterns().getOrDefault(errorType, Map.of()).values().stream()
                .filter(p -> p.isTrusted(trustThreshold))
                .max(Comparator.comparingDouble(FixPattern::getSuccessRate)
                        .thenComparingInt(FixPattern::getSuccessCount))
                .map(p -> new SuggestedFix(p.getFixAction(), p.getSuccessRate()));
    }

    public Optional<ErrorPattern> getErrorPattern(String type) {
        return Optional.ofNullable(knowledge.getErrorPatterns().get(type));
    }

    public Optional<FixPattern> getFixPattern(String errorType, String fixAction) {
        return Optional.ofNullable(knowledge.getFixPatterns().getOrDefault(errorType, Map.of()).get(fixAction));
    }

    public Optional<OptimizationPattern> getOptimizationPattern(String type) {
        return Optional.ofNullable(knowledge.getOptimizationPatterns().get(type));
    }

    public List<String> getLearnedRules() {
        return Collections.unmodifiableList(knowledge.getLearnedRules());
    }

    public double getTrustThreshold() {
        return trustThreshold;
    }

    /**
     * Most frequent errors and the fixes with the most successes, top N each.
     * Fixes are ranked by raw success count rather than rate so one lucky attempt
     * does not top the list.
     */
    public Insights generateInsights() {

        List<Insights.CommonError> commonErrors = knowledge.getErrorPatterns().entrySet().stream()
                .sorted(Comparator.comparingInt((Map.Entry<String, ErrorPattern> e) -> e.getValue().getCount())
                        .reversed())
                .limit(insightLimit)
                .map(e -> new Insights.CommonError(e.getKey(), e.getValue().getCount(),
                        e.getValue().getFirstSeen(), e.getValue().getLastSeen()))
                .collect(Collectors.toList());

        List<Insights.EffectiveFix> effectiveFixes = allFixPatterns().stream()
                .filter(p -> p.getAttempts() > 0)
                .sorted(Comparator.comparingInt(FixPattern::getSuccessCount).reversed())
                .limit(insightLimit)
                .map(p -> new Insights.EffectiveFix(p.getErrorType(), p.getFixAction(),
                        p.getSuccessRate(), p.getAttempts()))
                .collect(Collectors.toList());

        List<Insights.OptimizationSummary> optimizations = knowledge.getOptimizationPatterns().entrySet().stream()
                .map(e -> {
                    List<String> improvements = e.getValue().getImprovements();
                    List<String> recent = improvements.subList(
                            Math.max(0, improvements.size() - RECENT_IMPROVEMENTS), improvements.size());
                    return new Insights.OptimizationSummary(e.getKey(), e.getValue().getAttempts(),
                            e.getValue().getSuccesses(), recent);
                })
                .collect(Collectors.toList());

        List<String> recommendations = generateRecommendations(commonErrors, effectiveFixes);

        return new Insights(LocalDateTime.now(clock), commonErrors, effectiveFixes, optimizations, recommendations);
    }

    // =========================================================================
    // Persistence
    // =========================================================================

    private KnowledgeDocument load() {
        if (!Files.isRegularFile(knowledgeFile)) {
            log.info("[Knowledge] No knowledge file at {}, starting empty", knowledgeFile);
            return new KnowledgeDocument();
        }
        try {
            KnowledgeDocument doc = mapper.readValue(knowledgeFile.toFile(), KnowledgeDocument.class);
            log.info("[Knowledge] Loaded {} error patterns, {} fix patterns from {}",
                    doc.getErrorPatterns().size(),
                    doc.getFixPatterns().values().stream().mapToInt(Map::size).sum(), knowledgeFile);
            return doc;
        } catch (IOException e) {
            log.error("[Knowledge] Error loading knowledge base {}, starting empty", knowledgeFile, e);
            return new KnowledgeDocument();
        }
    }

    /** Rewrites the whole knowledge file; failures are logged and the in-memory state stays. */
    void save() {
        try {
            Path parent = knowledgeFile.getParent();
            if (parent != null) Files.createDirectories(parent);
            mapper.writeValue(knowledgeFile.toFile(), knowledge);
        } catch (IOException e) {
            log.error("[Knowledge] Error saving knowledge base {}", knowledgeFile, e);
        }
    }

    private List<String> generateRecommendations(List<Insights.CommonError> commonErrors,
                                                 List<Insights.EffectiveFix> effectiveFixes) {
        if (commonErrors.isEmpty() && effectiveFixes.isEmpty()) {
            return List.of();
        }

        Map<String, Object> context = new LinkedHashMap<>();
        context.put("common_errors", commonErrors);
        context.put("effective_fixes", effectiveFixes);

        ModelResponse response = modelClient.analyze(
                "Based on these learned patterns, provide actionable recommendations "
                        + "to prevent recurring issues.",
                context);

        if (!response.isSuccess() || !response.hasText()) {
            log.warn("[Knowledge] Model recommendations unavailable: {}", response.getError());
            return List.of();
        }
        return RecommendationParser.parse(response.getResponse());
    }

    private List<FixPattern> allFixPatterns() {
        return knowledge.getFixPatterns().values().stream()
                .flatMap(byAction -> byAction.values().stream())
                .collect(Collectors.toList());
    }
}
