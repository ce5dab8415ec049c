package com.autoheal.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestTemplate;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * OpenAiCompatibleLLMClient: /chat/completions backend.
 *
 * Serves both the hosted OpenAI API and local inference servers that speak the
 * same protocol (Ollama). In local mode no Authorization header is sent.
 *
 * Also the fallback backend: LLMClientFactory substitutes it when the requested
 * backend cannot be initialized.
 */
public class OpenAiCompatibleLLMClient implements LLMClient {

    private static final Logger log = LoggerFactory.getLogger(OpenAiCompatibleLLMClient.class);

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String       baseUrl;
    private final String       apiKey;
    private final String       model;
    private final boolean      local;

    public OpenAiCompatibleLLMClient(RestTemplate restTemplate,
                                     ObjectMapper objectMapper,
                                     String baseUrl,
                                     String apiKey,
                                     String model,
                                     boolean local) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.baseUrl      = baseUrl;
        this.apiKey       = apiKey;
        this.model        = model;
        this.local        = local;
    }

    @Override
    public String generate(String prompt) {
        String url = baseUrl.replaceAll("/+$", "") + "/chat/completions";

        Map<String, Object> body = new HashMap<>();
        body.put("model",    model);
        body.put("messages", List.of(Map.of("role", "user", "content", prompt)));

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (!local && apiKey != null && !apiKey.isBlank()) {
            headers.setBearerAuth(apiKey);
        }

        log.debug("[{}] model={} promptLen={}", getName(), model, prompt.length());

        try {
            ResponseEntity<String> response =
                    restTemplate.postForEntity(url, new HttpEntity<>(body, headers), String.class);

            JsonNode root    = objectMapper.readTree(response.getBody());
            JsonNode content = root.path("choices").path(0).path("message").path("content");

            if (content.isMissingNode()) {
                throw new LLMClientException("No choices in " + getName() + " response");
            }

            String result = content.isNull() ? "" : content.asText();
            log.debug("[{}] responseLen={}", getName(), result.length());
            return result;

        } catch (LLMClientException e) {
            throw e;
        } catch (Exception e) {
            log.warn("[{}] Call failed: {}", getName(), e.getMessage());
            throw new LLMClientException(getName() + " call failed: " + e.getMessage(), e);
        }
    }

    @Override
    public String getName() {
        return local ? "ollama" : "openai";
    }

    public String getBaseUrl() { return baseUrl; }
    public String getModel()   { return model; }
    public boolean isLocal()   { return local; }
}
