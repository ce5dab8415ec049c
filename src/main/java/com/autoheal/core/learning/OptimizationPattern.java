package com.autoheal.core.learning;

import java.util.ArrayList;
import java.util.List;

public class OptimizationPattern {

    private int          attempts;
    private int          successes;
    private List<String> improvements = new ArrayList<>();

    void record(boolean succeeded, String improvement) {
        attempts++;
        if (succeeded) {
            successes++;
            if (improvement != null && !improvement.isEmpty()) {
                improvements.add(improvement);
            }
        }
    }

    public int getAttempts()                  { return attempts; }
    public void setAttempts(int v)            { this.attempts = v; }
    public int getSuccesses()                 { return successes; }
    public void setSuccesses(int v)           { this.successes = v; }
    public List<String> getImprovements()     { return improvements; }
    public void setImprovements(List<String> v) { this.improvements = v != null ? v : new ArrayList<>(); }
}
