package com.kotsin.scanner.detector;

import com.kotsin.scanner.model.Direction;
import com.kotsin.scanner.model.FeatureSnapshot;
import com.kotsin.scanner.model.MarketRegime;
import com.kotsin.scanner.model.StrategyCategory;

import static com.kotsin.scanner.detector.FeatureReader.*;

/**
 * Score factors reused across detector catalogs, plus small scoring curves.
 *
 * Missing inputs score a neutral 50 unless noted otherwise.
 */
public final class Factors {

    public static final double NEUTRAL = 50.0;

    private Factors() {
        throw new UnsupportedOperationException("Utility class");
    }

    // ======================== CURVES ========================

    /**
     * Linear interpolation of x from [x0,x1] onto [y0,y1], flat outside the range.
     */
    public static double ramp(double x, double x0, double y0, double x1, double y1) {
        if (x1 == x0) return y1;
        if (x0 < x1) {
            if (x <= x0) return y0;
            if (x >= x1) return y1;
        } else {
            if (x >= x0) return y0;
            if (x <= x1) return y1;
        }
        return y0 + (x - x0) * (y1 - y0) / (x1 - x0);
    }

    public static double rvolScore(Double rvol) {
        if (rvol == null) return NEUTRAL;
        return ramp(rvol, 0.5, 20, 3.0, 100);
    }

    /**
     * Momentum RSI band for the given direction. SHORT mirrors around 50.
     */
    public static double rsiMomentumScore(Double rsi, Direction direction) {
        if (rsi == null) return NEUTRAL;
        double r = direction.isLong() ? rsi : 100 - rsi;
        if (r > 80) return 40;
        if (r > 70) return 65;
        if (r >= 55) return 90;
        if (r >= 50) return 70;
        return 30;
    }

    /**
     * Oversold (LONG) / overbought (SHORT) depth. Deeper extremes score higher.
     */
    public static double rsiExtremeScore(Double rsi, Direction direction) {
        if (rsi == null) return NEUTRAL;
        double r = direction.isLong() ? rsi : 100 - rsi;
        return ramp(r, 40, 20, 15, 100);
    }

    /**
     * Price on the trade side of VWAP without being overextended.
     */
    public static double vwapPositionScore(Double distancePct, Direction direction) {
        if (distancePct == null) return NEUTRAL;
        double d = distancePct * direction.sign();
        if (d < 0) return 20;
        if (d < 0.2) return 60;
        if (d <= 1.5) return 90;
        if (d <= 3.0) return 70;
        return 45;
    }

    /**
     * Stretch away from VWAP against the trade direction (mean reversion fuel).
     */
    public static double vwapStretchScore(Double distancePct, Direction direction) {
        if (distancePct == null) return NEUTRAL;
        double stretch = -distancePct * direction.sign();
        return ramp(stretch, 0.3, 20, 3.0, 100);
    }

    public static double emaStackScore(FeatureSnapshot f, Direction direction) {
        Double price = price(f);
        Double fast = ema(f, 9) != null ? ema(f, 9) : ema(f, 8);
        Double mid = ema(f, 21);
        Double slow = ema(f, 50);
        if (price == null || fast == null || mid == null) return NEUTRAL;
        int s = direction.sign();
        boolean priceOverFast = (price - fast) * s > 0;
        boolean fastOverMid = (fast - mid) * s > 0;
        boolean midOverSlow = slow != null && (mid - slow) * s > 0;
        if (priceOverFast && fastOverMid && midOverSlow) return 100;
        if (priceOverFast && fastOverMid) return 80;
        if ((price - mid) * s > 0) return 60;
        return 25;
    }

    public static double regimeScore(MarketRegime regime, StrategyCategory category) {
        if (regime == null || regime == MarketRegime.UNKNOWN) return NEUTRAL;
        switch (category) {
            case BREAKOUT:
                return pick(regime, 90, 35, 20, 70);
            case MEAN_REVERSION:
                return pick(regime, 30, 90, 65, 60);
            case TREND_CONTINUATION:
                return pick(regime, 95, 35, 20, 60);
            case GAMMA:
                return pick(regime, 75, 60, 50, 85);
            case REVERSAL:
                return pick(regime, 35, 80, 60, 75);
            default:
                return pick(regime, 60, 60, 40, 60);
        }
    }

    private static double pick(MarketRegime regime, double trending, double ranging, double choppy, double volatile_) {
        switch (regime) {
            case TRENDING:
                return trending;
            case RANGING:
                return ranging;
            case CHOPPY:
                return choppy;
            case VOLATILE:
                return volatile_;
            default:
                return NEUTRAL;
        }
    }

    public static double flowScore(FeatureSnapshot f, Direction direction) {
        FeatureSnapshot.Flow flow = flow(f);
        if (flow == null) return NEUTRAL;
        if (flowBias(f, direction)) {
            return Math.min(100.0, 60 + or(flow.getFlowScore(), 50.0) * 0.4);
        }
        if (flowOpposes(f, direction)) return 15;
        return 45;
    }

    // ======================== FACTORS ========================

    public static ScoreFactor relativeVolume(String name, double weight) {
        return ScoreFactor.of(name, weight, (f, o) -> rvolScore(rvol(f)));
    }

    public static ScoreFactor rsiMomentum(double weight, Direction direction) {
        return ScoreFactor.of("rsi_momentum", weight, (f, o) -> rsiMomentumScore(rsi(f), direction));
    }

    public static ScoreFactor rsiExtreme(double weight, Direction direction) {
        return ScoreFactor.of("rsi_extreme", weight, (f, o) -> rsiExtremeScore(rsi(f), direction));
    }

    public static ScoreFactor vwapPosition(double weight, Direction direction) {
        return ScoreFactor.of("vwap_position", weight, (f, o) -> vwapPositionScore(vwapDistancePct(f), direction));
    }

    public static ScoreFactor vwapStretch(double weight, Direction direction) {
        return ScoreFactor.of("vwap_stretch", weight, (f, o) -> vwapStretchScore(vwapDistancePct(f), direction));
    }

    public static ScoreFactor emaStack(String name, double weight, Direction direction) {
        return ScoreFactor.of(name, weight, (f, o) -> emaStackScore(f, direction));
    }

    public static ScoreFactor regimeFit(double weight, StrategyCategory category) {
        return ScoreFactor.of("regime_fit", weight, (f, o) -> regimeScore(regime(f), category));
    }

    public static ScoreFactor mtfAlignment(double weight, Direction direction) {
        return ScoreFactor.of("mtf_alignment", weight, (f, o) -> MtfAlignment.score(f, direction));
    }

    public static ScoreFactor flowConfirmation(double weight, Direction direction) {
        return ScoreFactor.of("flow_confirmation", weight, (f, o) -> flowScore(f, direction));
    }

    public static ScoreFactor divergence(double weight, Direction direction) {
        return ScoreFactor.of("divergence", weight, (f, o) -> FeatureReader.divergence(f, direction) ? 100 : 40);
    }
}
