package com.autoheal.llm;

/**
 * Stand-in when no backend could be initialized. Every call fails, so callers
 * always take their non-AI fallback path.
 */
public class DisabledLLMClient implements LLMClient {

    private final String reason;

    public DisabledLLMClient(String reason) {
        this.reason = reason;
    }

    @Override
    public String generate(String prompt) {
        throw new LLMClientException("Model client disabled: " + reason);
    }

    @Override
    public String getName() {
        return "disabled";
    }

    public String getReason() {
        return reason;
    }
}
