package com.autoheal.core.optimization;

import java.util.Locale;

/** A metric that went down between the before and after measurements. */
public final class Improvement {

    private final String metric;
    private final String improvement;
    private final int    before;
    private final int    after;

    public Improvement(String metric, int before, int after) {
        this.metric      = metric;
        this.before      = before;
        this.after       = after;
        this.improvement = String.format(Locale.ROOT, "%.1f%%", (before - after) * 100.0 / before);
    }

    public String getMetric()      { return metric; }
    public String getImprovement() { return improvement; }
    public int getBefore()         { return before; }
    public int getAfter()          { return after; }

    @Override
    public String toString() {
        return metric + ": " + before + " -> " + after + " (" + improvement + ")";
    }
}
