package com.kotsin.scanner.detector.catalog;

import com.kotsin.scanner.detector.OpportunityDetector;
import com.kotsin.scanner.detector.ScoreFactor;
import com.kotsin.scanner.model.AssetClass;
import com.kotsin.scanner.model.Direction;
import com.kotsin.scanner.model.FeatureSnapshot;
import com.kotsin.scanner.model.MarketRegime;
import com.kotsin.scanner.model.OptionsChainContext;
import com.kotsin.scanner.model.StrategyCategory;
import com.kotsin.scanner.model.TradingStyle;
import com.kotsin.scanner.model.VixLevel;

import java.util.List;

import static com.kotsin.scanner.detector.FeatureReader.*;
import static com.kotsin.scanner.detector.Factors.*;
import static com.kotsin.scanner.detector.SessionGuards.inWindow;
import static com.kotsin.scanner.detector.SessionGuards.marketHoursOk;

/**
 * Index detectors (SPX, NDX ...).
 *
 * Gamma detectors read dealer positioning from the options chain and only run
 * when it is supplied. Cash indices carry no volume, so volume gates here
 * accept an unknown RVOL.
 */
public final class IndexDetectors {

    /** 15:00 ET */
    private static final int POWER_HOUR_START = 330;
    /** 16:00 ET */
    private static final int SESSION_END = 390;

    private IndexDetectors() {
        throw new UnsupportedOperationException("Catalog class");
    }

    public static List<OpportunityDetector> all() {
        return List.of(
                gammaSqueeze(Direction.LONG),
                gammaSqueeze(Direction.SHORT),
                gammaFlip(Direction.LONG),
                gammaFlip(Direction.SHORT),
                eodPinSetup(),
                powerHourReversal(Direction.LONG),
                powerHourReversal(Direction.SHORT),
                indexMeanReversion(Direction.LONG),
                indexMeanReversion(Direction.SHORT),
                openingDrive(Direction.LONG),
                openingDrive(Direction.SHORT));
    }

    // ======================== GAMMA SQUEEZE ========================

    static OpportunityDetector gammaSqueeze(Direction direction) {
        boolean isLong = direction.isLong();

        return OpportunityDetector.builder()
                .type(isLong ? "gamma_squeeze_bullish" : "gamma_squeeze_bearish")
                .description(isLong
                        ? "Dealers short gamma with price pressing into the call wall"
                        : "Dealers short gamma with price pressing into the put wall")
                .direction(direction)
                .assetClass(AssetClass.INDEX)
                .requiresOptionsData(true)
                .category(StrategyCategory.GAMMA)
                .idealStyle(TradingStyle.SCALP)
                .gate(ctx -> {
                    FeatureSnapshot f = ctx.getFeatures();
                    OptionsChainContext o = ctx.getOptions();
                    if (!marketHoursOk(ctx)) return false;
                    if (!o.isDealerShortGamma()) return false;
                    Double price = price(f);
                    Double target = squeezeTarget(price, o, direction);
                    Double dist = vwapDistancePct(f);
                    if (price == null || target == null || dist == null) return false;
                    double toTarget = pctFrom(target, price) * direction.sign();
                    if (toTarget <= 0 || toTarget > 1.0) return false;
                    Double rvol = rvol(f);
                    if (rvol != null && rvol < 1.2) return false;
                    return dist * direction.sign() > 0;
                })
                .scoreFactor(ScoreFactor.of("dealer_gamma", 0.30, IndexDetectors::shortGammaScore))
                .scoreFactor(ScoreFactor.of("strike_proximity", 0.25, (f, o) -> {
                    Double price = price(f);
                    Double target = squeezeTarget(price, o, direction);
                    Double d = distancePct(price, target);
                    if (d == null) return NEUTRAL;
                    return ramp(d, 0.1, 100, 1.0, 50);
                }))
                .scoreFactor(rsiMomentum(0.20, direction))
                .scoreFactor(relativeVolume("volume", 0.15))
                .scoreFactor(ScoreFactor.of("expiry_pressure", 0.10, IndexDetectors::expiryPressure))
                .build();
    }

    /**
     * Nearest gamma strike on the trade side of price: the call wall (LONG) or
     * put wall (SHORT), falling back to the max-gamma strike.
     */
    private static Double squeezeTarget(Double price, OptionsChainContext o, Direction direction) {
        if (price == null || o == null) return null;
        Double wall = direction.isLong() ? o.getCallWallStrike() : o.getPutWallStrike();
        if (wall != null && (wall - price) * direction.sign() > 0) return wall;
        Double maxGamma = o.getMaxGammaStrike();
        if (maxGamma != null && (maxGamma - price) * direction.sign() > 0) return maxGamma;
        return null;
    }

    private static double shortGammaScore(FeatureSnapshot f, OptionsChainContext o) {
        if (o == null || o.getDealerNetGamma() == null) return NEUTRAL;
        if (o.isDealerShortGamma()) return o.isZeroDte() ? 100 : 85;
        return 20;
    }

    private static double expiryPressure(FeatureSnapshot f, OptionsChainContext o) {
        if (o == null) return NEUTRAL;
        if (o.isZeroDte()) return 100;
        Integer m = o.getMinutesToExpiry();
        if (m == null) return NEUTRAL;
        return ramp(m, 120, 80, 60 * 24 * 5, 40);
    }

    // ======================== GAMMA FLIP ========================

    static OpportunityDetector gammaFlip(Direction direction) {
        boolean isLong = direction.isLong();

        return OpportunityDetector.builder()
                .type(isLong ? "gamma_flip_bullish" : "gamma_flip_bearish")
                .description(isLong
                        ? "Price reclaims the gamma flip level from below"
                        : "Price loses the gamma flip level from above")
                .direction(direction)
                .assetClass(AssetClass.INDEX)
                .requiresOptionsData(true)
                .category(StrategyCategory.GAMMA)
                .idealStyle(TradingStyle.DAY_TRADE)
                .gate(ctx -> {
                    FeatureSnapshot f = ctx.getFeatures();
                    if (!marketHoursOk(ctx)) return false;
                    Double flip = ctx.getOptions().getGammaFlipLevel();
                    Double price = price(f);
                    Double prev = prevBar(f);
                    if (flip == null || price == null || prev == null) return false;
                    int s = direction.sign();
                    boolean crossed = (prev - flip) * s <= 0 && (price - flip) * s > 0;
                    if (!crossed) return false;
                    if (distancePct(price, flip) > 0.5) return false;
                    Double rvol = rvol(f);
                    return rvol == null || rvol >= 1.0;
                })
                .scoreFactor(ScoreFactor.of("flip_cross_quality", 0.35, (f, o) -> {
                    Double d = distancePct(price(f), o != null ? o.getGammaFlipLevel() : null);
                    if (d == null) return NEUTRAL;
                    return ramp(d, 0.05, 95, 0.5, 55);
                }))
                .scoreFactor(relativeVolume("volume", 0.20))
                .scoreFactor(vwapPosition(0.20, direction))
                .scoreFactor(rsiMomentum(0.15, direction))
                .scoreFactor(ScoreFactor.of("session_timing", 0.10, (f, o) -> {
                    Integer m = minutesSinceOpen(f);
                    if (m == null) return NEUTRAL;
                    if (m < 90 || m >= POWER_HOUR_START) return 90;
                    if (m >= 120 && m < 240) return 45;
                    return 70;
                }))
                .build();
    }

    // ======================== EOD PIN ========================

    static OpportunityDetector eodPinSetup() {
        return OpportunityDetector.builder()
                .type("eod_pin_setup")
                .description("Long-gamma dealers pull price up into the max-pain strike into the close")
                .direction(Direction.LONG)
                .assetClass(AssetClass.INDEX)
                .requiresOptionsData(true)
                .category(StrategyCategory.GAMMA)
                .idealStyle(TradingStyle.SCALP)
                .gate(ctx -> {
                    FeatureSnapshot f = ctx.getFeatures();
                    OptionsChainContext o = ctx.getOptions();
                    if (!marketHoursOk(ctx)) return false;
                    if (!inWindow(f, POWER_HOUR_START, SESSION_END)) return false;
                    if (!o.isDealerLongGamma()) return false;
                    boolean expiring = o.isZeroDte() || (o.getMinutesToExpiry() != null && o.getMinutesToExpiry() <= 120);
                    if (!expiring) return false;
                    Double price = price(f);
                    Double pin = o.getMaxPainStrike();
                    if (price == null || pin == null) return false;
                    return pin > price && distancePct(price, pin) <= 0.5;
                })
                .scoreFactor(ScoreFactor.of("pin_proximity", 0.35, (f, o) -> {
                    Double d = distancePct(price(f), o != null ? o.getMaxPainStrike() : null);
                    if (d == null) return NEUTRAL;
                    return ramp(d, 0.1, 100, 0.5, 55);
                }))
                .scoreFactor(ScoreFactor.of("dealer_gamma", 0.25, (f, o) -> {
                    if (o == null || o.getDealerNetGamma() == null) return NEUTRAL;
                    return o.isDealerLongGamma() ? 90 : 20;
                }))
                .scoreFactor(ScoreFactor.of("oi_concentration", 0.20, (f, o) -> {
                    Double price = price(f);
                    if (o == null || price == null || o.getMaxPainStrike() == null) return NEUTRAL;
                    long total = o.openInterestNear(price, price * 0.05);
                    if (total == 0) return NEUTRAL;
                    long atPin = o.openInterestNear(o.getMaxPainStrike(), price * 0.0025);
                    return ramp((double) atPin / total, 0.05, 40, 0.35, 100);
                }))
                .scoreFactor(ScoreFactor.of("time_to_close", 0.20, (f, o) -> {
                    Integer m = minutesSinceOpen(f);
                    if (m == null) return NEUTRAL;
                    return ramp(m, POWER_HOUR_START, 50, 380, 100);
                }))
                .build();
    }

    // ======================== POWER HOUR REVERSAL ========================

    static OpportunityDetector powerHourReversal(Direction direction) {
        boolean isLong = direction.isLong();

        return OpportunityDetector.builder()
                .type(isLong ? "power_hour_reversal_bullish" : "power_hour_reversal_bearish")
                .description(isLong
                        ? "Oversold flush below VWAP turning up in the final hour"
                        : "Overbought push above VWAP rolling over in the final hour")
                .direction(direction)
                .assetClass(AssetClass.INDEX)
                .category(StrategyCategory.REVERSAL)
                .idealStyle(TradingStyle.SCALP)
                .gate(ctx -> {
                    FeatureSnapshot f = ctx.getFeatures();
                    if (!marketHoursOk(ctx)) return false;
                    if (!inWindow(f, POWER_HOUR_START, SESSION_END)) return false;
                    Double rsi = rsi(f);
                    Double dist = vwapDistancePct(f);
                    Double price = price(f);
                    Double extreme = isLong ? low(f) : high(f);
                    if (rsi == null || dist == null || price == null || extreme == null) return false;
                    Double rvol = rvol(f);
                    if (rvol != null && rvol < 1.2) return false;
                    if (isLong) {
                        return rsi <= 35 && dist <= -0.5 && price >= extreme * 1.001;
                    }
                    return rsi >= 65 && dist >= 0.5 && price <= extreme * 0.999;
                })
                .scoreFactor(rsiExtreme(0.30, direction))
                .scoreFactor(vwapStretch(0.25, direction))
                .scoreFactor(ScoreFactor.of("bounce_from_extreme", 0.20, (f, o) -> {
                    Double d = distancePct(price(f), direction.isLong() ? low(f) : high(f));
                    if (d == null) return NEUTRAL;
                    return ramp(d, 0.1, 50, 0.5, 100);
                }))
                .scoreFactor(relativeVolume("volume", 0.15))
                .scoreFactor(divergence(0.10, direction))
                .build();
    }

    // ======================== INDEX MEAN REVERSION ========================

    static OpportunityDetector indexMeanReversion(Direction direction) {
        boolean isLong = direction.isLong();

        return OpportunityDetector.builder()
                .type(isLong ? "index_mean_reversion_long" : "index_mean_reversion_short")
                .description(isLong
                        ? "Index stretched 0.6%+ below VWAP with RSI oversold outside a trend"
                        : "Index stretched 0.6%+ above VWAP with RSI overbought outside a trend")
                .direction(direction)
                .assetClass(AssetClass.INDEX)
                .category(StrategyCategory.MEAN_REVERSION)
                .idealStyle(TradingStyle.DAY_TRADE)
                .gate(ctx -> {
                    FeatureSnapshot f = ctx.getFeatures();
                    if (!marketHoursOk(ctx)) return false;
                    if (regime(f) == MarketRegime.TRENDING) return false;
                    Double rsi = rsi(f);
                    Double dist = vwapDistancePct(f);
                    if (rsi == null || dist == null) return false;
                    return isLong ? (rsi <= 32 && dist <= -0.6) : (rsi >= 68 && dist >= 0.6);
                })
                .scoreFactor(rsiExtreme(0.30, direction))
                .scoreFactor(vwapStretch(0.30, direction))
                .scoreFactor(regimeFit(0.20, StrategyCategory.MEAN_REVERSION))
                .scoreFactor(ScoreFactor.of("vix_context", 0.10, (f, o) -> {
                    VixLevel vix = vix(f);
                    switch (vix) {
                        case HIGH:
                            return 80;
                        case EXTREME:
                            return 70;
                        case LOW:
                            return 45;
                        default:
                            return 60;
                    }
                }))
                .scoreFactor(divergence(0.10, direction))
                .build();
    }

    // ======================== OPENING DRIVE ========================

    static OpportunityDetector openingDrive(Direction direction) {
        boolean isLong = direction.isLong();

        return OpportunityDetector.builder()
                .type(isLong ? "opening_drive_bullish" : "opening_drive_bearish")
                .description(isLong
                        ? "First 45 minutes drive 0.25%+ above the open, holding above VWAP"
                        : "First 45 minutes drive 0.25%+ below the open, holding below VWAP")
                .direction(direction)
                .assetClass(AssetClass.INDEX)
                .category(StrategyCategory.BREAKOUT)
                .idealStyle(TradingStyle.SCALP)
                .gate(ctx -> {
                    FeatureSnapshot f = ctx.getFeatures();
                    if (!marketHoursOk(ctx)) return false;
                    if (!inWindow(f, 5, 45)) return false;
                    Double drive = pctFrom(price(f), open(f));
                    Double dist = vwapDistancePct(f);
                    if (drive == null || dist == null) return false;
                    int s = direction.sign();
                    if (drive * s < 0.25 || dist * s <= 0) return false;
                    Double rvol = rvol(f);
                    if (rvol != null && rvol < 1.5) return false;
                    Double orb = number(f, isLong ? "orbHigh" : "orbLow");
                    return orb == null || (price(f) - orb) * s > 0;
                })
                .scoreFactor(ScoreFactor.of("drive_strength", 0.30, (f, o) -> {
                    Double drive = pctFrom(price(f), open(f));
                    if (drive == null) return NEUTRAL;
                    return ramp(drive * direction.sign(), 0.25, 50, 1.0, 100);
                }))
                .scoreFactor(relativeVolume("volume", 0.25))
                .scoreFactor(vwapPosition(0.20, direction))
                .scoreFactor(ScoreFactor.of("orb_break", 0.15, (f, o) -> {
                    Double orb = number(f, direction.isLong() ? "orbHigh" : "orbLow");
                    Double price = price(f);
                    if (orb == null || price == null) return NEUTRAL;
                    return (price - orb) * direction.sign() > 0 ? 100 : 30;
                }))
                .scoreFactor(emaStack("trend", 0.10, direction))
                .build();
    }
}
