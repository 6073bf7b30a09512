package com.kotsin.scanner.dedup;

import java.time.Instant;
import java.util.Locale;

/**
 * Builds bar time keys: SYMBOL:detectorType:bucketStartEpochMillis, where the
 * bucket is the event time floored to the bar interval.
 */
public final class BarTimeKeys {

    private BarTimeKeys() {
        throw new UnsupportedOperationException("Utility class");
    }

    public static String of(String symbol, String detectorType, Instant barTime, int intervalMinutes) {
        long intervalMs = Math.max(1, intervalMinutes) * 60_000L;
        long bucket = Math.floorDiv(barTime.toEpochMilli(), intervalMs) * intervalMs;
        return symbol.toUpperCase(Locale.ROOT) + ":" + detectorType + ":" + bucket;
    }
}
