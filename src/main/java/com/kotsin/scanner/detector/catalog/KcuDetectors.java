package com.kotsin.scanner.detector.catalog;

import com.kotsin.scanner.detector.DetectionContext;
import com.kotsin.scanner.detector.OpportunityDetector;
import com.kotsin.scanner.detector.ScoreFactor;
import com.kotsin.scanner.model.AssetClass;
import com.kotsin.scanner.model.Direction;
import com.kotsin.scanner.model.FeatureSnapshot;
import com.kotsin.scanner.model.StrategyCategory;
import com.kotsin.scanner.model.TradingStyle;

import java.util.List;

import static com.kotsin.scanner.detector.FeatureReader.*;
import static com.kotsin.scanner.detector.Factors.*;
import static com.kotsin.scanner.detector.SessionGuards.atLeastMinutesIn;
import static com.kotsin.scanner.detector.SessionGuards.marketHoursOk;

/**
 * KCU "LTP" detectors: Levels, Trend, Patience.
 *
 * Every setup needs price at a level, a tradeable trend and a patience candle
 * (a tight consolidation bar at the level). They apply to all asset classes.
 *
 * Trend is read from the EMA stack: 8 over 21 (and 21 over 50 when supplied)
 * is an uptrend, the inverse a downtrend, anything else chop.
 */
public final class KcuDetectors {

    /** Level proximity for confluence counting, percent of price */
    private static final double LEVEL_PROXIMITY_PCT = 0.5;

    private KcuDetectors() {
        throw new UnsupportedOperationException("Catalog class");
    }

    public static List<OpportunityDetector> all() {
        return List.of(
                emaBounce(Direction.LONG),
                emaBounce(Direction.SHORT),
                vwapStandard(Direction.LONG),
                vwapStandard(Direction.SHORT),
                kingQueen(Direction.LONG),
                kingQueen(Direction.SHORT),
                orbBreakout(Direction.LONG),
                orbBreakout(Direction.SHORT),
                cloudBounce(Direction.LONG),
                cloudBounce(Direction.SHORT));
    }

    private static OpportunityDetector.OpportunityDetectorBuilder base(String type, Direction direction) {
        return OpportunityDetector.builder()
                .type(type + (direction.isLong() ? "_long" : "_short"))
                .direction(direction)
                .assetClass(AssetClass.STOCK)
                .assetClass(AssetClass.EQUITY_ETF)
                .assetClass(AssetClass.INDEX);
    }

    // ======================== 8 EMA BOUNCE ========================

    static OpportunityDetector emaBounce(Direction direction) {
        return base("kcu_ema_bounce", direction)
                .description("Pullback into the 8 EMA holds inside a tradeable trend")
                .category(StrategyCategory.TREND_CONTINUATION)
                .idealStyle(TradingStyle.SCALP)
                .gate(ctx -> {
                    FeatureSnapshot f = ctx.getFeatures();
                    if (!ready(ctx, 15)) return false;
                    Double price = price(f);
                    Double ema8 = ema(f, 8);
                    if (price == null || ema8 == null) return false;
                    if (trend(f) != direction.sign()) return false;
                    if (distancePct(price, ema8) > LEVEL_PROXIMITY_PCT) return false;
                    return touchedAndHeld(f, ema8, direction) || flag(f, "patientCandle");
                })
                .scoreFactor(levelConfluence(0.25, direction))
                .scoreFactor(trendStrength(0.25, direction))
                .scoreFactor(patienceCandle(0.25))
                .scoreFactor(ScoreFactor.of("volume_confirmation", 0.10, (f, o) -> {
                    Double rvol = rvol(f);
                    if (rvol == null) return NEUTRAL;
                    if (rvol >= 2.5) return 60;
                    if (rvol > 1.5) return 80;
                    if (rvol >= 0.8) return 90;
                    return 40;
                }))
                .scoreFactor(ScoreFactor.of("session_timing", 0.05, (f, o) -> sessionScore(f, 30, 90, 210, 330)))
                .scoreFactor(mtfAlignment(0.10, direction))
                .build();
    }

    // ======================== VWAP STANDARD ========================

    static OpportunityDetector vwapStandard(Direction direction) {
        return base("kcu_vwap_standard", direction)
                .description("Price retests and holds VWAP in the direction of the trend")
                .category(StrategyCategory.TREND_CONTINUATION)
                .idealStyle(TradingStyle.DAY_TRADE)
                .gate(ctx -> {
                    FeatureSnapshot f = ctx.getFeatures();
                    if (!ready(ctx, 30)) return false;
                    Double price = price(f);
                    Double vwap = vwap(f);
                    if (price == null || vwap == null) return false;
                    if (trend(f) != direction.sign()) return false;
                    if (distancePct(price, vwap) > 0.3) return false;
                    // holding the trade side of VWAP
                    return direction.isLong() ? price >= vwap * 0.999 : price <= vwap * 1.001;
                })
                .scoreFactor(levelConfluence(0.30, direction))
                .scoreFactor(trendStrength(0.25, direction))
                .scoreFactor(patienceCandle(0.20))
                .scoreFactor(ScoreFactor.of("volume_confirmation", 0.15, (f, o) -> {
                    Double rvol = rvol(f);
                    if (rvol == null) return NEUTRAL;
                    return ramp(rvol, 0.6, 40, 1.8, 95);
                }))
                .scoreFactor(ScoreFactor.of("session_timing", 0.10, (f, o) -> sessionScore(f, 30, 120, 240, 330)))
                .build();
    }

    // ======================== KING & QUEEN ========================

    static OpportunityDetector kingQueen(Direction direction) {
        return base("kcu_king_queen", direction)
                .description("VWAP (king) with at least one queen level (EMA or ORB) stacked at price")
                .category(StrategyCategory.ALL)
                .idealStyle(TradingStyle.DAY_TRADE)
                .gate(ctx -> {
                    FeatureSnapshot f = ctx.getFeatures();
                    if (!ready(ctx, 10)) return false;
                    Double price = price(f);
                    Double vwap = vwap(f);
                    if (price == null || vwap == null) return false;
                    if (distancePct(price, vwap) > LEVEL_PROXIMITY_PCT) return false;
                    if (queensNear(f, price) < 1) return false;
                    // never against an established trend
                    return trend(f) != -direction.sign();
                })
                .scoreFactor(ScoreFactor.of("level_confluence", 0.35, (f, o) -> {
                    Double price = price(f);
                    if (price == null || distancePct(price, vwap(f)) == null) return NEUTRAL;
                    int queens = queensNear(f, price);
                    return Math.min(100, 55 + queens * 15);
                }))
                .scoreFactor(trendStrength(0.25, direction))
                .scoreFactor(patienceCandle(0.20))
                .scoreFactor(ScoreFactor.of("volume_confirmation", 0.10, (f, o) -> {
                    Double rvol = rvol(f);
                    if (rvol == null) return NEUTRAL;
                    if (rvol > 2.5) return 70;
                    if (rvol >= 1.0) return 90;
                    return 45;
                }))
                .scoreFactor(ScoreFactor.of("session_timing", 0.10, (f, o) -> sessionScore(f, 10, 90, 270, 330)))
                .build();
    }

    private static int queensNear(FeatureSnapshot f, double price) {
        int queens = 0;
        for (Double level : new Double[]{ema(f, 8), ema(f, 21), number(f, "orbHigh"), number(f, "orbLow")}) {
            Double d = distancePct(price, level);
            if (d != null && d <= LEVEL_PROXIMITY_PCT) queens++;
        }
        return queens;
    }

    // ======================== ORB BREAKOUT ========================

    static OpportunityDetector orbBreakout(Direction direction) {
        return base("kcu_orb_breakout", direction)
                .description("Break of the opening range after 15 minutes with an ATR-sized range")
                .category(StrategyCategory.BREAKOUT)
                .idealStyle(TradingStyle.DAY_TRADE)
                .gate(ctx -> {
                    FeatureSnapshot f = ctx.getFeatures();
                    if (!ready(ctx, 15)) return false;
                    Double price = price(f);
                    Double orbHigh = number(f, "orbHigh");
                    Double orbLow = number(f, "orbLow");
                    Double atr = atr(f);
                    Double rvol = rvol(f);
                    if (price == null || orbHigh == null || orbLow == null || atr == null || rvol == null) return false;
                    boolean broke = direction.isLong() ? price > orbHigh * 1.001 : price < orbLow * 0.999;
                    if (!broke) return false;
                    double rangeToAtr = (orbHigh - orbLow) / atr;
                    if (rangeToAtr < 0.5 || rangeToAtr > 2.5) return false;
                    return rvol >= 0.8;
                })
                .scoreFactor(levelConfluence(0.25, direction))
                .scoreFactor(ScoreFactor.of("trend_strength", 0.25, (f, o) -> {
                    Double level = number(f, direction.isLong() ? "orbHigh" : "orbLow");
                    Double beyond = pctFrom(price(f), level);
                    if (beyond == null) return NEUTRAL;
                    double b = beyond * direction.sign();
                    double base = b >= 0.2 ? 85 : 60;
                    return trend(f) == direction.sign() ? Math.min(100, base + 15) : base;
                }))
                .scoreFactor(patienceCandle(0.20))
                .scoreFactor(ScoreFactor.of("volume_confirmation", 0.20, (f, o) -> {
                    Double rvol = rvol(f);
                    if (rvol == null) return NEUTRAL;
                    if (rvol >= 2.0) return 100;
                    if (rvol >= 1.5) return 85;
                    if (rvol >= 1.2) return 70;
                    if (rvol >= 1.0) return 55;
                    return 35;
                }))
                .scoreFactor(ScoreFactor.of("session_timing", 0.10, (f, o) -> {
                    Integer m = minutesSinceOpen(f);
                    if (m == null) return NEUTRAL;
                    if (m >= 15 && m <= 30) return 100;
                    if (m > 30 && m <= 60) return 85;
                    if (m > 60 && m <= 90) return 65;
                    return 40;
                }))
                .build();
    }

    // ======================== RIPSTER CLOUD BOUNCE ========================

    static OpportunityDetector cloudBounce(Direction direction) {
        return base("kcu_cloud_bounce", direction)
                .description("Pullback into the 34/50 EMA cloud holds after the first hour")
                .category(StrategyCategory.TREND_CONTINUATION)
                .idealStyle(TradingStyle.DAY_TRADE)
                .gate(ctx -> {
                    FeatureSnapshot f = ctx.getFeatures();
                    if (!ready(ctx, 60)) return false;
                    Double price = price(f);
                    Double ema34 = ema(f, 34);
                    Double ema50 = ema(f, 50);
                    if (price == null || ema34 == null || ema50 == null) return false;
                    int s = direction.sign();
                    if ((ema34 - ema50) * s <= 0) return false;
                    if ((price - ema34) * s <= 0) return false;
                    if (trend(f) == -s) return false;
                    return touchedAndHeld(f, ema34, direction);
                })
                .scoreFactor(ScoreFactor.of("cloud_quality", 0.30, (f, o) -> {
                    Double price = price(f);
                    Double ema34 = ema(f, 34);
                    Double ema50 = ema(f, 50);
                    if (price == null || ema34 == null || ema50 == null) return NEUTRAL;
                    double thickness = Math.abs(ema34 - ema50) / price * 100.0;
                    return ramp(thickness, 0.05, 50, 0.4, 100);
                }))
                .scoreFactor(trendStrength(0.25, direction))
                .scoreFactor(patienceCandle(0.20))
                .scoreFactor(relativeVolume("volume_confirmation", 0.15))
                .scoreFactor(ScoreFactor.of("session_timing", 0.10, (f, o) -> sessionScore(f, 60, 150, 270, 360)))
                .build();
    }

    // ======================== LTP HELPERS ========================

    private static boolean ready(DetectionContext ctx, int minMinutes) {
        return marketHoursOk(ctx) && atLeastMinutesIn(ctx, minMinutes);
    }

    /**
     * +1 uptrend, -1 downtrend, 0 chop or unknown.
     */
    static int trend(FeatureSnapshot f) {
        Double ema8 = ema(f, 8) != null ? ema(f, 8) : ema(f, 9);
        Double ema21 = ema(f, 21);
        Double ema50 = ema(f, 50);
        if (ema8 == null || ema21 == null) return 0;
        if (ema8 > ema21 && (ema50 == null || ema21 > ema50)) return 1;
        if (ema8 < ema21 && (ema50 == null || ema21 < ema50)) return -1;
        return 0;
    }

    /**
     * Bar traded through the level and closed back on the trade side of it.
     */
    private static boolean touchedAndHeld(FeatureSnapshot f, double level, Direction direction) {
        Double price = price(f);
        if (price == null) return false;
        if (direction.isLong()) {
            Double low = low(f);
            return low != null && low <= level * 1.002 && price >= level * 0.998;
        }
        Double high = high(f);
        return high != null && high >= level * 0.998 && price <= level * 1.002;
    }

    private static ScoreFactor levelConfluence(double weight, Direction direction) {
        return ScoreFactor.of("level_confluence", weight, (f, o) -> {
            Double price = price(f);
            if (price == null) return NEUTRAL;
            int levels = 0;
            for (Double level : new Double[]{ema(f, 8), ema(f, 21), vwap(f), number(f, "orbHigh"),
                    number(f, "orbLow"), prevClose(f)}) {
                Double d = distancePct(price, level);
                if (d != null && d <= LEVEL_PROXIMITY_PCT) levels++;
            }
            if (levels == 0) return 30;
            return Math.min(100, 40 + levels * 20);
        });
    }

    private static ScoreFactor trendStrength(double weight, Direction direction) {
        return ScoreFactor.of("trend_strength", weight, (f, o) -> {
            int t = trend(f);
            if (t == direction.sign()) {
                return ema(f, 50) != null ? 100 : 85;
            }
            return t == 0 ? 30 : 10;
        });
    }

    private static ScoreFactor patienceCandle(double weight) {
        return ScoreFactor.of("patience_candle", weight, (f, o) -> {
            if (flag(f, "patientCandle")) return 90;
            Double high = high(f);
            Double low = low(f);
            Double atr = atr(f);
            if (high == null || low == null || atr == null) return 40;
            // tight bar relative to ATR
            return (high - low) <= atr * 0.5 ? 70 : 40;
        });
    }

    /**
     * Session preference curve: prime window [primeFrom, primeTo], good until goodTo,
     * fading until fadeTo, poor outside.
     */
    private static double sessionScore(FeatureSnapshot f, int primeFrom, int primeTo, int goodTo, int fadeTo) {
        Integer m = minutesSinceOpen(f);
        if (m == null) return NEUTRAL;
        if (m < primeFrom) return 30;
        if (m <= primeTo) return 100;
        if (m <= goodTo) return 75;
        if (m <= fadeTo) return 55;
        return 35;
    }
}
