package com.autoheal.llm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.List;
import java.util.Map;

/**
 * Primary backend: Gemini generateContent REST API.
 *
 * Single attempt per call. A failed request surfaces as LLMClientException and
 * ModelClient moves on to the next backend in its chain.
 */
public class GeminiLLMClient implements LLMClient {

    private static final Logger log =
            LoggerFactory.getLogger(GeminiLLMClient.class);

    private final WebClient webClient;
    private final String    apiKey;
    private final String    model;
    private final String    baseUrl;

    public GeminiLLMClient(WebClient.Builder builder, String apiKey, String model, String baseUrl) {
        this.webClient = builder.build();
        this.apiKey    = apiKey;
        this.model     = model;
        this.baseUrl   = baseUrl;
    }

    @Override
    public String generate(String prompt) {

        log.info("[Gemini] Request | model={} | keyHash={} | promptLen={}",
                model, apiKey.hashCode(), prompt.length());

        Map<String, Object> body = Map.of(
            "contents", List.of(
                Map.of(
                    "parts", List.of(
                        Map.of("text", prompt)
                    )
                )
            )
        );

        Map<?, ?> response;
        try {
            response = webClient
                    .post()
                    .uri(baseUrl + "/models/" + model + ":generateContent?key=" + apiKey)
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.APPLICATION_JSON)
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(Map.class)
                    .block();
        } catch (Exception ex) {
            log.warn("[Gemini] Call failed: {}", rootMessage(ex));
            throw new LLMClientException("Gemini call failed: " + rootMessage(ex), ex);
        }

        return extractText(response);
    }

    @Override
    public String getName() {
        return "gemini";
    }

    @SuppressWarnings("unchecked")
    private String extractText(Map<?, ?> response) {
        try {
            var candidates = (List<Map<String, Object>>) response.get("candidates");
            var content = (Map<String, Object>) candidates.get(0).get("content");
            var parts = (List<Map<String, Object>>) content.get("parts");
            Object text = parts.get(0).get("text");
            return text != null ? text.toString() : "";
        } catch (Exception e) {
            log.error("[Gemini] Failed to parse response: {}", response, e);
            throw new LLMClientException("Malformed Gemini response", e);
        }
    }

    private String rootMessage(Throwable t) {
        Throwable cause = t;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause.getMessage();
    }
}
