package com.kotsin.scanner.model;

import java.util.Locale;

/**
 * Market regime as classified upstream and passed in the "market_regime" pattern key.
 */
public enum MarketRegime {
    TRENDING,
    RANGING,
    CHOPPY,
    VOLATILE,
    UNKNOWN;

    public static MarketRegime from(Object raw) {
        if (raw == null) return UNKNOWN;
        String s = raw.toString().trim().toUpperCase(Locale.ROOT);
        // upstream classifiers also emit trending_up / trending_down
        if (s.startsWith("TRENDING")) return TRENDING;
        for (MarketRegime r : values()) {
            if (r.name().equals(s)) return r;
        }
        return UNKNOWN;
    }
}
