package com.kotsin.scanner.model;

import java.util.Locale;

/**
 * Strategy family of a detector. The adaptive threshold layer keys its
 * regime table on this.
 */
public enum StrategyCategory {
    BREAKOUT,
    MEAN_REVERSION,
    TREND_CONTINUATION,
    GAMMA,
    REVERSAL,
    /** Generic row for detectors that don't fit a family */
    ALL;

    /**
     * Derive a category from a detector type name.
     */
    public static StrategyCategory categorize(String detectorType) {
        if (detectorType == null) return ALL;
        String t = detectorType.toLowerCase(Locale.ROOT);
        if (t.contains("breakout")) return BREAKOUT;
        if (t.contains("reversion")) return MEAN_REVERSION;
        if (t.contains("continuation")) return TREND_CONTINUATION;
        if (t.contains("gamma")) return GAMMA;
        if (t.contains("reversal") || t.contains("power_hour")) return REVERSAL;
        return ALL;
    }
}
