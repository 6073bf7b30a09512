package com.kotsin.scanner.detector;

import com.kotsin.scanner.model.Direction;
import com.kotsin.scanner.model.FeatureSnapshot;
import com.kotsin.scanner.model.MarketRegime;
import com.kotsin.scanner.model.VixLevel;

import java.util.Locale;
import java.util.Map;

/**
 * Null-safe accessors over {@link FeatureSnapshot}.
 *
 * Every getter returns null when the value is absent or non-finite so gates can
 * fail closed with a single null check.
 */
public final class FeatureReader {

    private FeatureReader() {
        throw new UnsupportedOperationException("Utility class");
    }

    // ======================== PRICE ========================

    public static Double price(FeatureSnapshot f) {
        return f != null && f.getPrice() != null ? positive(f.getPrice().getCurrent()) : null;
    }

    public static Double open(FeatureSnapshot f) {
        return f != null && f.getPrice() != null ? positive(f.getPrice().getOpen()) : null;
    }

    public static Double high(FeatureSnapshot f) {
        return f != null && f.getPrice() != null ? positive(f.getPrice().getHigh()) : null;
    }

    public static Double low(FeatureSnapshot f) {
        return f != null && f.getPrice() != null ? positive(f.getPrice().getLow()) : null;
    }

    public static Double prevClose(FeatureSnapshot f) {
        return f != null && f.getPrice() != null ? positive(f.getPrice().getPrevClose()) : null;
    }

    /** Close of the previous bar */
    public static Double prevBar(FeatureSnapshot f) {
        return f != null && f.getPrice() != null ? positive(f.getPrice().getPrev()) : null;
    }

    /**
     * Percent change from a reference price, null when either side is unknown.
     */
    public static Double pctFrom(Double price, Double reference) {
        if (price == null || reference == null || reference == 0) return null;
        return (price - reference) / reference * 100.0;
    }

    /**
     * Absolute distance between two prices as a percent of the first.
     */
    public static Double distancePct(Double price, Double level) {
        if (price == null || level == null || price == 0) return null;
        return Math.abs(price - level) / price * 100.0;
    }

    // ======================== VOLUME ========================

    /**
     * Relative volume. Falls back to current/avg when the ratio is not supplied.
     */
    public static Double rvol(FeatureSnapshot f) {
        if (f == null || f.getVolume() == null) return null;
        FeatureSnapshot.Volume v = f.getVolume();
        Double ratio = finite(v.getRelativeToAvg());
        if (ratio != null) return ratio;
        if (v.getCurrent() != null && v.getAvg() != null && v.getAvg() > 0) {
            return finite(v.getCurrent() / v.getAvg());
        }
        return null;
    }

    public static Double avgVolume(FeatureSnapshot f) {
        return f != null && f.getVolume() != null ? finite(f.getVolume().getAvg()) : null;
    }

    // ======================== VWAP ========================

    public static Double vwap(FeatureSnapshot f) {
        return f != null && f.getVwap() != null ? positive(f.getVwap().getValue()) : null;
    }

    /**
     * Signed percent distance of price from VWAP. Derived from price and VWAP when not supplied.
     */
    public static Double vwapDistancePct(FeatureSnapshot f) {
        if (f == null || f.getVwap() == null) return null;
        Double supplied = finite(f.getVwap().getDistancePct());
        if (supplied != null) return supplied;
        return pctFrom(price(f), vwap(f));
    }

    // ======================== INDICATORS ========================

    public static Double rsi(FeatureSnapshot f, int period) {
        return f != null ? lookup(f.getRsi(), period) : null;
    }

    public static Double rsi(FeatureSnapshot f) {
        return rsi(f, 14);
    }

    public static Double ema(FeatureSnapshot f, int period) {
        return f != null ? positive(lookup(f.getEma(), period)) : null;
    }

    /**
     * ATR: period 14, else any supplied period, else the 5m timeframe, else the "atr" pattern value.
     */
    public static Double atr(FeatureSnapshot f) {
        if (f == null) return null;
        Double atr = positive(lookup(f.getAtr(), 14));
        if (atr != null) return atr;
        if (f.getAtr() != null) {
            for (Double v : f.getAtr().values()) {
                Double p = positive(v);
                if (p != null) return p;
            }
        }
        FeatureSnapshot m5 = timeframe(f, "5m");
        if (m5 != null && m5 != f) {
            Double mtfAtr = positive(lookup(m5.getAtr(), 14));
            if (mtfAtr != null) return mtfAtr;
        }
        return positive(number(f, "atr"));
    }

    public static FeatureSnapshot timeframe(FeatureSnapshot f, String timeframe) {
        if (f == null || f.getMtf() == null) return null;
        return f.getMtf().get(timeframe);
    }

    // ======================== SESSION ========================

    public static Integer minutesSinceOpen(FeatureSnapshot f) {
        return f != null && f.getSession() != null ? f.getSession().getMinutesSinceOpen() : null;
    }

    // ======================== PATTERNS ========================

    public static Object pattern(FeatureSnapshot f, String key) {
        if (f == null || f.getPatterns() == null) return null;
        return f.getPatterns().get(key);
    }

    /**
     * Boolean pattern flag. Accepts true, "true" or a non-zero number.
     */
    public static boolean flag(FeatureSnapshot f, String key) {
        Object v = pattern(f, key);
        if (v instanceof Boolean) return (Boolean) v;
        if (v instanceof Number) return ((Number) v).doubleValue() != 0;
        if (v instanceof String) return Boolean.parseBoolean(((String) v).trim());
        return false;
    }

    public static Double number(FeatureSnapshot f, String key) {
        Object v = pattern(f, key);
        if (v instanceof Number) return finite(((Number) v).doubleValue());
        if (v instanceof String) {
            try {
                return finite(Double.parseDouble(((String) v).trim()));
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    public static String text(FeatureSnapshot f, String key) {
        Object v = pattern(f, key);
        return v != null ? v.toString().trim().toLowerCase(Locale.ROOT) : null;
    }

    public static MarketRegime regime(FeatureSnapshot f) {
        return MarketRegime.from(pattern(f, "market_regime"));
    }

    public static VixLevel vix(FeatureSnapshot f) {
        return VixLevel.from(pattern(f, "vix_level"));
    }

    /**
     * True when the "divergence" pattern points in the given direction
     * ("bullish"/"bearish", or a boolean bullish_divergence/bearish_divergence flag).
     */
    public static boolean divergence(FeatureSnapshot f, Direction direction) {
        String d = text(f, "divergence");
        if (direction.isLong()) {
            return "bullish".equals(d) || flag(f, "bullish_divergence");
        }
        return "bearish".equals(d) || flag(f, "bearish_divergence");
    }

    // ======================== FLOW ========================

    public static FeatureSnapshot.Flow flow(FeatureSnapshot f) {
        return f != null ? f.getFlow() : null;
    }

    public static boolean flowBias(FeatureSnapshot f, Direction direction) {
        FeatureSnapshot.Flow flow = flow(f);
        if (flow == null || flow.getFlowBias() == null) return false;
        String bias = flow.getFlowBias().trim().toLowerCase(Locale.ROOT);
        return direction.isLong() ? "bullish".equals(bias) : "bearish".equals(bias);
    }

    public static boolean flowOpposes(FeatureSnapshot f, Direction direction) {
        return flowBias(f, direction == Direction.LONG ? Direction.SHORT : Direction.LONG);
    }

    public static String aggressiveness(FeatureSnapshot f) {
        FeatureSnapshot.Flow flow = flow(f);
        if (flow == null || flow.getAggressiveness() == null) return null;
        return flow.getAggressiveness().trim().toUpperCase(Locale.ROOT);
    }

    // ======================== NUMERIC ========================

    public static double or(Double value, double fallback) {
        return value != null ? value : fallback;
    }

    public static boolean between(Double value, double min, double max) {
        return value != null && value >= min && value <= max;
    }

    private static Double lookup(Map<Integer, Double> map, int period) {
        return map != null ? finite(map.get(period)) : null;
    }

    private static Double finite(Double v) {
        return v != null && !v.isNaN() && !v.isInfinite() ? v : null;
    }

    private static Double positive(Double v) {
        Double fv = finite(v);
        return fv != null && fv > 0 ? fv : null;
    }
}
