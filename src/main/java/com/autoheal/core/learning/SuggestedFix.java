package com.autoheal.core.learning;

public final class SuggestedFix {

    public static final String LEARNED_PATTERN = "learned_pattern";

    private final String action;
    private final double confidence;
    private final String source;

    public SuggestedFix(String action, double confidence) {
        this.action     = action;
        this.confidence = confidence;
        this.source     = LEARNED_PATTERN;
    }

    public String getAction()     { return action; }
    public double getConfidence() { return confidence; }
    public String getSource()     { return source; }

    @Override
    public String toString() {
        return String.format("%s (%.2f, %s)", action, confidence, source);
    }
}
