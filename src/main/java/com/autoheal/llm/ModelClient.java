package com.autoheal.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * ModelClient: the single entry point every component uses for natural-language analysis.
 *
 * Holds the backend chain assembled once by LLMClientFactory (requested backend,
 * then the OpenAI-compatible fallback). analyze() tries each backend once, in order,
 * and returns the first completion.
 *
 * CONTRACT: analyze() never throws. When every backend fails, the caller gets
 * ModelResponse.error(...) and applies its own deterministic fallback.
 */
public class ModelClient {

    private static final Logger log = LoggerFactory.getLogger(ModelClient.class);

    private final List<LLMClient> chain;
    private final BackendProfile  profile;
    private final ObjectMapper    contextMapper;

    public ModelClient(List<LLMClient> chain, BackendProfile profile, ObjectMapper objectMapper) {
        this.chain         = List.copyOf(chain);
        this.profile       = profile;
        this.contextMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public ModelResponse analyze(String prompt) {
        return analyze(prompt, null);
    }

    /**
     * @param prompt  analysis prompt
     * @param context optional structured context, rendered below the prompt as JSON
     */
    public ModelResponse analyze(String prompt, Map<String, ?> context) {

        String fullPrompt = renderPrompt(prompt, context);
        String lastError  = "No model backend configured";
        String lastName   = profile.getBackendName();

        for (LLMClient client : chain) {
            try {
                String text = client.generate(fullPrompt);
                log.info("[ModelClient] {} answered ({} chars)", client.getName(), text.length());
                return ModelResponse.success(text, client.getName());
            } catch (RuntimeException e) {
                lastError = e.getMessage();
                lastName  = client.getName();
                log.warn("[ModelClient] Backend {} failed: {}", client.getName(), e.getMessage());
            }
        }

        return ModelResponse.error(lastError, lastName);
    }

    public BackendProfile getProfile() {
        return profile;
    }

    /** False when the chain only holds the disabled stand-in. */
    public boolean isAvailable() {
        return profile.getKind() != BackendProfile.Kind.DISABLED;
    }

    private String renderPrompt(String prompt, Map<String, ?> context) {
        if (context == null || context.isEmpty()) {
            return prompt;
        }
        try {
            return prompt + "\n\nContext:\n" + contextMapper.writeValueAsString(context);
        } catch (JsonProcessingException e) {
            log.warn("[ModelClient] Context not serializable, sending prompt only: {}", e.getMessage());
            return prompt;
        }
    }
}
