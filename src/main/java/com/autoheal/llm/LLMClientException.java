package com.autoheal.llm;

/**
 * Raised by an LLMClient when its backend cannot produce a completion,
 * and by LLMClientFactory when a backend cannot be initialized.
 */
public class LLMClientException extends RuntimeException {

    public LLMClientException(String message)                  { super(message); }
    public LLMClientException(String message, Throwable cause) { super(message, cause); }
}
