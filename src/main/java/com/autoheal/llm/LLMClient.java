package com.autoheal.llm;

/**
 * LLMClient: one text-completion backend.
 *
 * Each backend (Gemini, OpenAI-compatible, disabled) is its own implementation.
 * The backend is chosen once by LLMClientFactory and the resulting chain is held
 * by ModelClient; nothing branches on the backend type per call.
 *
 * Implementations make exactly one request per generate() call. Retry and
 * fallback are not their concern.
 */
public interface LLMClient {

    /**
     * Send a prompt and return the raw completion text.
     *
     * @param prompt full prompt, context already rendered in
     * @return completion text. Never null; empty string on empty model output.
     * @throws LLMClientException on any transport, HTTP or response-shape failure
     */
    String generate(String prompt);

    /** Short backend name for logs and status output, e.g. "gemini" or "ollama". */
    String getName();
}
