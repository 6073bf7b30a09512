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
 * Flow-primary detectors: options order flow is the trigger, price action confirms.
 *
 * They read the snapshot's flow aggregates, not the options chain, so they do
 * not require options data and stay usable in backtests that replay flow.
 */
public final class FlowDetectors {

    private FlowDetectors() {
        throw new UnsupportedOperationException("Catalog class");
    }

    public static List<OpportunityDetector> all() {
        return List.of(
                sweepMomentum(Direction.LONG),
                sweepMomentum(Direction.SHORT),
                institutionalFlow(Direction.LONG),
                institutionalFlow(Direction.SHORT));
    }

    private static OpportunityDetector.OpportunityDetectorBuilder base(Direction direction) {
        return OpportunityDetector.builder()
                .direction(direction)
                .assetClass(AssetClass.STOCK)
                .assetClass(AssetClass.EQUITY_ETF)
                .assetClass(AssetClass.INDEX)
                .flowPrimary(true)
                .category(StrategyCategory.ALL);
    }

    // ======================== SWEEP MOMENTUM ========================

    static OpportunityDetector sweepMomentum(Direction direction) {
        boolean isLong = direction.isLong();

        return base(direction)
                .type(isLong ? "sweep_momentum_long" : "sweep_momentum_short")
                .description(isLong
                        ? "Cluster of bullish sweeps with price holding above VWAP"
                        : "Cluster of bearish sweeps with price holding below VWAP")
                .idealStyle(TradingStyle.SCALP)
                .gate(ctx -> {
                    FeatureSnapshot f = ctx.getFeatures();
                    FeatureSnapshot.Flow flow = flow(f);
                    if (!marketHoursOk(ctx) || flow == null) return false;
                    if (flow.getSweepCount() == null || flow.getSweepCount() < 3) return false;
                    if (flow.getFlowScore() == null || flow.getFlowScore() < 60) return false;
                    if (!flowBias(f, direction)) return false;
                    Double dist = vwapDistancePct(f);
                    if (dist == null || dist * direction.sign() <= 0) return false;
                    Double rvol = rvol(f);
                    return rvol == null || rvol >= 1.2;
                })
                .scoreFactor(ScoreFactor.of("sweep_intensity", 0.35, (f, o) -> sweepIntensity(flow(f), 3)))
                .scoreFactor(ScoreFactor.of("flow_score", 0.25, (f, o) -> {
                    FeatureSnapshot.Flow flow = flow(f);
                    return flow != null && flow.getFlowScore() != null ? flow.getFlowScore() : NEUTRAL;
                }))
                .scoreFactor(ScoreFactor.of("price_confirmation", 0.20,
                        (f, o) -> vwapPositionScore(vwapDistancePct(f), direction)))
                .scoreFactor(relativeVolume("volume", 0.20))
                .build();
    }

    // ======================== INSTITUTIONAL FLOW ========================

    static OpportunityDetector institutionalFlow(Direction direction) {
        boolean isLong = direction.isLong();

        return base(direction)
                .type(isLong ? "institutional_flow_bullish" : "institutional_flow_bearish")
                .description(isLong
                        ? "Aggressive institutional call buying: 5+ sweeps, 70%+ buy pressure, 40%+ large trades"
                        : "Aggressive institutional put buying: 5+ sweeps, 30%- buy pressure, 40%+ large trades")
                .idealStyle(TradingStyle.DAY_TRADE)
                .gate(ctx -> {
                    FeatureSnapshot f = ctx.getFeatures();
                    FeatureSnapshot.Flow flow = flow(f);
                    if (!marketHoursOk(ctx) || flow == null) return false;
                    if (flow.getFlowScore() == null || flow.getFlowScore() < 80) return false;
                    if (flow.getSweepCount() == null || flow.getSweepCount() < 5) return false;
                    Double buy = flow.getBuyPressure();
                    if (buy == null) return false;
                    if (isLong ? buy < 70 : buy > 30) return false;
                    if (flow.getLargeTradePercentage() == null || flow.getLargeTradePercentage() < 40) return false;
                    String aggr = aggressiveness(f);
                    if (!"AGGRESSIVE".equals(aggr) && !"VERY_AGGRESSIVE".equals(aggr)) return false;
                    return flowBias(f, direction);
                })
                .scoreFactor(ScoreFactor.of("institutional_score", 0.35, (f, o) -> {
                    FeatureSnapshot.Flow flow = flow(f);
                    return flow != null && flow.getFlowScore() != null ? flow.getFlowScore() : 0;
                }))
                .scoreFactor(ScoreFactor.of("sweep_intensity", 0.25, (f, o) -> sweepIntensity(flow(f), 5)))
                .scoreFactor(ScoreFactor.of("buy_sell_pressure", 0.20, (f, o) -> {
                    FeatureSnapshot.Flow flow = flow(f);
                    if (flow == null || flow.getBuyPressure() == null) return 0;
                    return isLong ? flow.getBuyPressure() : 100 - flow.getBuyPressure();
                }))
                .scoreFactor(ScoreFactor.of("large_trade_pct", 0.15, (f, o) -> {
                    FeatureSnapshot.Flow flow = flow(f);
                    if (flow == null || flow.getLargeTradePercentage() == null) return 0;
                    return Math.min(100, flow.getLargeTradePercentage() * 1.5);
                }))
                .scoreFactor(ScoreFactor.of("aggressiveness", 0.05, (f, o) -> {
                    String aggr = aggressiveness(f);
                    if ("VERY_AGGRESSIVE".equals(aggr)) return 100;
                    if ("AGGRESSIVE".equals(aggr)) return 80;
                    return aggr == null ? 0 : 40;
                }))
                .build();
    }

    /**
     * Sweep count scaled so the gate minimum scores 60 and twice the minimum scores 100.
     */
    private static double sweepIntensity(FeatureSnapshot.Flow flow, int gateMinimum) {
        if (flow == null || flow.getSweepCount() == null) return 0;
        return ramp(flow.getSweepCount(), gateMinimum, 60, gateMinimum * 2.0, 100);
    }
}
