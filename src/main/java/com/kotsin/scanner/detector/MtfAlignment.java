package com.kotsin.scanner.detector;

import com.kotsin.scanner.model.Direction;
import com.kotsin.scanner.model.FeatureSnapshot;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Multi-timeframe trend alignment score, 0-100, 50 when no timeframe data is present.
 */
public final class MtfAlignment {

    private static final Map<String, Double> TIMEFRAME_WEIGHTS = new LinkedHashMap<>();

    static {
        TIMEFRAME_WEIGHTS.put("5m", 0.2);
        TIMEFRAME_WEIGHTS.put("15m", 0.3);
        TIMEFRAME_WEIGHTS.put("60m", 0.3);
        TIMEFRAME_WEIGHTS.put("240m", 0.2);
    }

    private MtfAlignment() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Direction-agnostic alignment: how cleanly each timeframe is stacked
     * (price, fast EMA, slow EMA all in the same order) plus RSI trend confirmation.
     */
    public static double score(FeatureSnapshot f) {
        return compute(f, null);
    }

    /**
     * Alignment counted only when timeframes stack in the given direction.
     */
    public static double score(FeatureSnapshot f, Direction direction) {
        return compute(f, direction);
    }

    private static double compute(FeatureSnapshot f, Direction direction) {
        if (f == null || f.getMtf() == null || f.getMtf().isEmpty()) return 50.0;

        double checkedWeight = 0.0;
        double weighted = 0.0;
        for (Map.Entry<String, Double> e : TIMEFRAME_WEIGHTS.entrySet()) {
            FeatureSnapshot tf = f.getMtf().get(e.getKey());
            if (tf == null) continue;
            double weight = e.getValue();
            checkedWeight += weight;

            Double close = FeatureReader.price(tf);
            Double fast = FeatureReader.ema(tf, 20) != null ? FeatureReader.ema(tf, 20) : FeatureReader.ema(tf, 21);
            Double slow = FeatureReader.ema(tf, 50);
            if (close != null && fast != null && slow != null) {
                boolean bull = close > fast && fast > slow;
                boolean bear = close < fast && fast < slow;
                boolean aligned = direction == null ? (bull || bear) : (direction.isLong() ? bull : bear);
                if (aligned) {
                    weighted += weight * 100;
                } else if (direction == null || (direction.isLong() ? close > fast : close < fast)) {
                    weighted += weight * 50;
                }
            }

            Double rsi = FeatureReader.rsi(tf);
            if (rsi != null) {
                boolean bullRsi = rsi >= 55 && rsi <= 70;
                boolean bearRsi = rsi >= 30 && rsi <= 45;
                boolean confirms = direction == null ? (bullRsi || bearRsi) : (direction.isLong() ? bullRsi : bearRsi);
                if (confirms) weighted += weight * 20;
            }
        }
        if (checkedWeight == 0) return 50.0;
        // scale to the timeframes actually supplied
        return Math.min(100.0, Math.round(weighted / checkedWeight));
    }
}
