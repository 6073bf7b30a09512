package com.kotsin.scanner.model;

import java.util.Locale;
import java.util.Set;

/**
 * Coarse symbol category governing which detectors apply and which
 * threshold overrides are used.
 */
public enum AssetClass {
    STOCK,
    EQUITY_ETF,
    INDEX;

    private static final Set<String> INDEX_SYMBOLS = Set.of("SPX", "NDX", "RUT", "VIX", "XSP", "DJX");

    private static final Set<String> EQUITY_ETF_SYMBOLS = Set.of(
            "SPY", "QQQ", "IWM", "DIA",
            "XLF", "XLE", "XLK", "XLV", "XLI", "XLP");

    /**
     * Classify a ticker. Index tickers may carry a "$" or "I:" prefix.
     */
    public static AssetClass of(String symbol) {
        if (symbol == null || symbol.isBlank()) return STOCK;
        String s = symbol.trim().toUpperCase(Locale.ROOT);
        if (s.startsWith("I:")) {
            s = s.substring(2);
        } else if (s.startsWith("$")) {
            s = s.substring(1);
        }
        if (INDEX_SYMBOLS.contains(s)) return INDEX;
        if (EQUITY_ETF_SYMBOLS.contains(s)) return EQUITY_ETF;
        return STOCK;
    }
}
