package com.kotsin.scanner.detector.catalog;

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
import static com.kotsin.scanner.detector.SessionGuards.marketHoursOk;

/**
 * Universal equity detectors: single stocks and equity ETFs.
 *
 * 1. BREAKOUT - range break on expanding volume with momentum RSI
 * 2. MEAN_REVERSION - RSI extreme stretched away from VWAP
 * 3. TREND_CONTINUATION - pullback to the 21 EMA inside a stacked EMA trend
 */
public final class EquityDetectors {

    private EquityDetectors() {
        throw new UnsupportedOperationException("Catalog class");
    }

    public static List<OpportunityDetector> all() {
        return List.of(
                breakout(Direction.LONG),
                breakout(Direction.SHORT),
                meanReversion(Direction.LONG),
                meanReversion(Direction.SHORT),
                trendContinuation(Direction.LONG),
                trendContinuation(Direction.SHORT));
    }

    // ======================== BREAKOUT ========================

    static OpportunityDetector breakout(Direction direction) {
        boolean isLong = direction.isLong();
        String flagKey = isLong ? "breakout_bullish" : "breakout_bearish";

        return OpportunityDetector.builder()
                .type(isLong ? "breakout_bullish" : "breakout_bearish")
                .description(isLong
                        ? "Break above resistance on 1.5x+ volume with RSI in momentum band"
                        : "Break below support on 1.5x+ volume with RSI in momentum band")
                .direction(direction)
                .assetClass(AssetClass.STOCK)
                .assetClass(AssetClass.EQUITY_ETF)
                .category(StrategyCategory.BREAKOUT)
                .idealStyle(TradingStyle.DAY_TRADE)
                .gate(ctx -> {
                    FeatureSnapshot f = ctx.getFeatures();
                    if (!marketHoursOk(ctx)) return false;
                    if (!flag(f, flagKey) && !(flag(f, "breakout") && sideOfVwap(f, direction))) return false;
                    Double rvol = rvol(f);
                    Double rsi = rsi(f);
                    Double dist = vwapDistancePct(f);
                    if (rvol == null || rsi == null || dist == null) return false;
                    if (rvol < 1.5) return false;
                    if (isLong) {
                        return rsi >= 50 && rsi <= 80 && dist > 0;
                    }
                    return rsi >= 20 && rsi <= 50 && dist < 0;
                })
                .scoreFactor(relativeVolume("volume_surge", 0.30))
                .scoreFactor(ScoreFactor.of("breakout_strength", 0.25, (f, o) -> breakoutStrength(f, direction)))
                .scoreFactor(rsiMomentum(0.15, direction))
                .scoreFactor(vwapPosition(0.15, direction))
                .scoreFactor(emaStack("trend_alignment", 0.15, direction))
                .build();
    }

    /**
     * Distance beyond the broken level. Uses "breakout_level" when supplied,
     * else half the VWAP distance as a proxy.
     */
    private static double breakoutStrength(FeatureSnapshot f, Direction direction) {
        Double price = price(f);
        Double level = number(f, "breakout_level");
        Double beyond = null;
        if (price != null && level != null && level > 0) {
            beyond = pctFrom(price, level) * direction.sign();
        } else if (vwapDistancePct(f) != null) {
            beyond = vwapDistancePct(f) * direction.sign() / 2.0;
        }
        if (beyond == null) return NEUTRAL;
        if (beyond < 0) return 20;
        // far extensions are chases
        if (beyond > 2.0) return 55;
        return ramp(beyond, 0.0, 50, 0.8, 100);
    }

    private static boolean sideOfVwap(FeatureSnapshot f, Direction direction) {
        Double dist = vwapDistancePct(f);
        return dist != null && dist * direction.sign() > 0;
    }

    // ======================== MEAN REVERSION ========================

    static OpportunityDetector meanReversion(Direction direction) {
        boolean isLong = direction.isLong();

        return OpportunityDetector.builder()
                .type(isLong ? "mean_reversion_long" : "mean_reversion_short")
                .description(isLong
                        ? "RSI oversold with price stretched 1%+ below VWAP"
                        : "RSI overbought with price stretched 1%+ above VWAP")
                .direction(direction)
                .assetClass(AssetClass.STOCK)
                .assetClass(AssetClass.EQUITY_ETF)
                .category(StrategyCategory.MEAN_REVERSION)
                .idealStyle(TradingStyle.DAY_TRADE)
                .gate(ctx -> {
                    FeatureSnapshot f = ctx.getFeatures();
                    if (!marketHoursOk(ctx)) return false;
                    Double rsi = rsi(f);
                    Double dist = vwapDistancePct(f);
                    Double rvol = rvol(f);
                    if (rsi == null || dist == null || rvol == null) return false;
                    if (rvol < 1.0) return false;
                    return isLong ? (rsi <= 30 && dist <= -1.0) : (rsi >= 70 && dist >= 1.0);
                })
                .scoreFactor(rsiExtreme(0.30, direction))
                .scoreFactor(vwapStretch(0.25, direction))
                .scoreFactor(relativeVolume("volume_climax", 0.15))
                .scoreFactor(divergence(0.15, direction))
                .scoreFactor(regimeFit(0.15, StrategyCategory.MEAN_REVERSION))
                .build();
    }

    // ======================== TREND CONTINUATION ========================

    static OpportunityDetector trendContinuation(Direction direction) {
        boolean isLong = direction.isLong();

        return OpportunityDetector.builder()
                .type(isLong ? "trend_continuation_long" : "trend_continuation_short")
                .description(isLong
                        ? "Pullback to the 21 EMA in a 9 > 21 > 50 uptrend with RSI reset"
                        : "Rally into the 21 EMA in a 9 < 21 < 50 downtrend with RSI reset")
                .direction(direction)
                .assetClass(AssetClass.STOCK)
                .assetClass(AssetClass.EQUITY_ETF)
                .category(StrategyCategory.TREND_CONTINUATION)
                .idealStyle(TradingStyle.SWING)
                .gate(ctx -> {
                    FeatureSnapshot f = ctx.getFeatures();
                    if (!marketHoursOk(ctx)) return false;
                    Double price = price(f);
                    Double ema9 = ema(f, 9);
                    Double ema21 = ema(f, 21);
                    Double ema50 = ema(f, 50);
                    Double rsi = rsi(f);
                    if (price == null || ema9 == null || ema21 == null || ema50 == null || rsi == null) return false;
                    int s = direction.sign();
                    boolean stacked = (ema9 - ema21) * s > 0 && (ema21 - ema50) * s > 0;
                    boolean holdingTrend = (price - ema21) * s >= 0;
                    boolean pulledBack = distancePct(price, ema21) <= 1.0;
                    boolean rsiReset = isLong ? between(rsi, 40, 65) : between(rsi, 35, 60);
                    return stacked && holdingTrend && pulledBack && rsiReset;
                })
                .scoreFactor(emaStack("ema_alignment", 0.30, direction))
                .scoreFactor(ScoreFactor.of("pullback_quality", 0.25, (f, o) -> {
                    Double d = distancePct(price(f), ema(f, 21));
                    if (d == null) return NEUTRAL;
                    return ramp(d, 0.1, 100, 1.0, 40);
                }))
                .scoreFactor(ScoreFactor.of("rsi_reset", 0.15, (f, o) -> {
                    Double rsi = rsi(f);
                    if (rsi == null) return NEUTRAL;
                    double r = isLong ? rsi : 100 - rsi;
                    return r >= 45 && r <= 55 ? 90 : 65;
                }))
                .scoreFactor(relativeVolume("volume", 0.10))
                .scoreFactor(mtfAlignment(0.20, direction))
                .build();
    }
}
