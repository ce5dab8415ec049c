package com.autoheal.llm;

import com.autoheal.config.AutoHealProperties;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;

/**
 * LLMClientFactory: builds the ModelClient backend chain once, at startup.
 *
 * Preference order:
 *   1. the requested backend (gemini | openai | ollama)
 *   2. the OpenAI-compatible fallback
 *   3. the disabled stand-in
 *
 * Credentials come from explicit configuration first, then the environment
 * (GEMINI_API_KEY, OPENAI_API_KEY). An endpoint that looks like a local inference
 * server needs no credential.
 *
 * If the requested backend cannot be initialized, the fallback is substituted and
 * the BackendProfile records why.
 */
public class LLMClientFactory {

    private static final Logger log = LoggerFactory.getLogger(LLMClientFactory.class);

    static final String GEMINI_KEY_ENV  = "GEMINI_API_KEY";
    static final String OPENAI_KEY_ENV  = "OPENAI_API_KEY";
    static final String OPENAI_URL_ENV  = "OPENAI_BASE_URL";
    static final String LOCAL_BASE_URL  = "http://localhost:11434/v1";
    static final String OPENAI_BASE_URL = "https://api.openai.com/v1";

    private static final List<String> LOCAL_SIGNATURES =
            List.of("ollama", "localhost:11434", "127.0.0.1:11434");

    private final AutoHealProperties.Model settings;
    private final WebClient.Builder        webClientBuilder;
    private final RestTemplate             restTemplate;
    private final ObjectMapper             objectMapper;
    private final Function<String, String> environment;

    public LLMClientFactory(AutoHealProperties.Model settings,
                            WebClient.Builder webClientBuilder,
                            RestTemplate restTemplate,
                            ObjectMapper objectMapper,
                            Function<String, String> environment) {
        this.settings         = settings;
        this.webClientBuilder = webClientBuilder;
        this.restTemplate     = restTemplate;
        this.objectMapper     = objectMapper;
        this.environment      = environment;
    }

    public ModelClient create() {

        String requested = settings.getBackend() == null
                ? "" : settings.getBackend().trim().toLowerCase(Locale.ROOT);

        log.info("[LLMFactory] Requested backend: {}", requested);

        if (requested.equals("disabled")) {
            log.info("[LLMFactory] Model client disabled by configuration");
            return disabled("Disabled by configuration", false);
        }

        List<LLMClient> chain = new ArrayList<>();
        BackendProfile  profile;

        if (requested.equals("gemini")) {
            try {
                chain.add(initGemini());
                profile = geminiProfile();
            } catch (LLMClientException e) {
                log.warn("[LLMFactory] Gemini initialization failed: {}; substituting OpenAI-compatible fallback",
                        e.getMessage());
                return fallbackOnly("gemini unavailable: " + e.getMessage(), requested);
            }

            // Fallback behind the primary; absence is not an error
            try {
                chain.add(initOpenAiCompatible(false));
            } catch (LLMClientException e) {
                log.debug("[LLMFactory] No OpenAI-compatible fallback behind Gemini: {}", e.getMessage());
            }
            return new ModelClient(chain, profile, objectMapper);
        }

        if (requested.equals("openai") || requested.equals("ollama")) {
            try {
                OpenAiCompatibleLLMClient client = initOpenAiCompatible(requested.equals("ollama"));
                chain.add(client);
                return new ModelClient(chain, openAiProfile(client), objectMapper);
            } catch (LLMClientException e) {
                log.error("[LLMFactory] {} initialization failed: {}", requested, e.getMessage());
                return disabled(requested + " unavailable: " + e.getMessage(), true);
            }
        }

        log.warn("[LLMFactory] Unknown backend '{}'; substituting OpenAI-compatible fallback", requested);
        return fallbackOnly("unknown backend '" + requested + "'", requested);
    }

    // =========================================================================
    // Backend initialization
    // =========================================================================

    private GeminiLLMClient initGemini() {
        String key = resolveCredential(settings.getGemini().getApiKey(), GEMINI_KEY_ENV);
        if (key == null) {
            throw new LLMClientException("No Gemini API key in configuration or " + GEMINI_KEY_ENV);
        }
        AutoHealProperties.Gemini gemini = settings.getGemini();
        log.info("[LLMFactory] Initialized Gemini client (model: {})", gemini.getModel());
        return new GeminiLLMClient(webClientBuilder, key, gemini.getModel(), gemini.getBaseUrl());
    }

    private OpenAiCompatibleLLMClient initOpenAiCompatible(boolean forceLocal) {
        AutoHealProperties.OpenAi openai = settings.getOpenai();

        String baseUrl = firstNonBlank(openai.getBaseUrl(), environment.apply(OPENAI_URL_ENV));
        boolean local  = forceLocal || isLocalEndpoint(baseUrl);
        if (baseUrl == null && !local) {
            baseUrl = OPENAI_BASE_URL;
        }

        if (local) {
            baseUrl = normalizeLocalUrl(baseUrl);
            String model = "gpt-4".equals(openai.getModel()) ? openai.getLocalModel() : openai.getModel();
            log.info("[LLMFactory] Initialized Ollama client (base_url: {}, model: {})", baseUrl, model);
            return new OpenAiCompatibleLLMClient(restTemplate, objectMapper, baseUrl, null, model, true);
        }

        String key = resolveCredential(openai.getApiKey(), OPENAI_KEY_ENV);
        if (key == null) {
            throw new LLMClientException("No OpenAI API key in configuration or " + OPENAI_KEY_ENV);
        }
        log.info("[LLMFactory] Initialized OpenAI client (model: {})", openai.getModel());
        return new OpenAiCompatibleLLMClient(restTemplate, objectMapper, baseUrl, key, openai.getModel(), false);
    }

    private ModelClient fallbackOnly(String reason, String requested) {
        try {
            OpenAiCompatibleLLMClient client = initOpenAiCompatible(false);
            return new ModelClient(List.of(client), openAiProfile(client).asSubstitute(reason), objectMapper);
        } catch (LLMClientException e) {
            log.error("[LLMFactory] Fallback for '{}' also failed: {}", requested, e.getMessage());
            return disabled(reason + "; fallback unavailable: " + e.getMessage(), true);
        }
    }

    private ModelClient disabled(String reason, boolean substituted) {
        return new ModelClient(
                List.of(new DisabledLLMClient(reason)),
                BackendProfile.disabled(reason, substituted),
                objectMapper);
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    private BackendProfile geminiProfile() {
        AutoHealProperties.Gemini gemini = settings.getGemini();
        return new BackendProfile(
                BackendProfile.Kind.PRIMARY, "gemini", gemini.getBaseUrl(), gemini.getModel(),
                resolveCredential(gemini.getApiKey(), GEMINI_KEY_ENV), false, null);
    }

    private BackendProfile openAiProfile(OpenAiCompatibleLLMClient client) {
        String credential = client.isLocal()
                ? null : resolveCredential(settings.getOpenai().getApiKey(), OPENAI_KEY_ENV);
        return new BackendProfile(
                BackendProfile.Kind.OPENAI_COMPATIBLE, client.getName(), client.getBaseUrl(),
                client.getModel(), credential, false, null);
    }

    private String resolveCredential(String configured, String envVar) {
        return firstNonBlank(configured, environment.apply(envVar));
    }

    static boolean isLocalEndpoint(String baseUrl) {
        if (baseUrl == null) return false;
        String lower = baseUrl.toLowerCase(Locale.ROOT);
        return LOCAL_SIGNATURES.stream().anyMatch(lower::contains);
    }

    static String normalizeLocalUrl(String baseUrl) {
        if (baseUrl == null || !baseUrl.startsWith("http")) {
            return LOCAL_BASE_URL;
        }
        String trimmed = baseUrl.replaceAll("/+$", "");
        return trimmed.contains("/v1") ? trimmed : trimmed + "/v1";
    }

    private static String firstNonBlank(String a, String b) {
        if (a != null && !a.isBlank()) return a;
        if (b != null && !b.isBlank()) return b;
        return null;
    }
}
