package com.kotsin.scanner.config;

import java.time.Duration;
import java.time.ZoneId;

/**
 * Fixed cut-offs shared by the scanner, registry and deduplication store.
 */
public final class ScannerConstants {

    private ScannerConstants() {
        throw new UnsupportedOperationException("Constants class");
    }

    // ========== SESSION CONSTANTS ==========

    public static final ZoneId MARKET_ZONE = ZoneId.of("America/New_York");
    public static final int REGULAR_SESSION_MINUTES = 390;
    public static final int POWER_HOUR_START_MINUTE = 330;

    // ========== REGISTRY CONSTANTS ==========

    public static final double WEIGHT_SUM_TARGET = 1.0;
    public static final double WEIGHT_SUM_TOLERANCE = 0.02;

    // ========== DEDUP CONSTANTS ==========

    public static final Duration RATE_CAP_WINDOW = Duration.ofHours(1);
    public static final Duration MIN_RETENTION = Duration.ofHours(1);
    public static final long MAX_TRACKED_SYMBOLS = 20_000;
    public static final Duration SYMBOL_IDLE_EXPIRY = Duration.ofHours(24);

    // ========== RISK CONSTANTS ==========

    public static final double DEFAULT_ATR = 2.0;
}
