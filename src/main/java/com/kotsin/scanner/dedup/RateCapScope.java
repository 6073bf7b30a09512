package com.kotsin.scanner.dedup;

/**
 * What the per-hour emission cap counts against.
 */
public enum RateCapScope {
    /**
     * Each (symbol, detectorType) pair has its own hourly budget
     */
    SYMBOL_DETECTOR,

    /**
     * All detector types for a symbol share one hourly budget
     */
    SYMBOL
}
