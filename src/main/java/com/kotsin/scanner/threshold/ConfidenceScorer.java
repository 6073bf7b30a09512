package com.kotsin.scanner.threshold;

import com.kotsin.scanner.detector.FeatureReader;
import com.kotsin.scanner.detector.MtfAlignment;
import com.kotsin.scanner.model.ConfidenceAssessment;
import com.kotsin.scanner.model.ConfidenceLevel;
import com.kotsin.scanner.model.Direction;
import com.kotsin.scanner.model.FeatureSnapshot;
import com.kotsin.scanner.model.MarketRegime;
import com.kotsin.scanner.model.VixLevel;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;

/**
 * ConfidenceScorer - Advisory confidence for an emitted signal.
 *
 * Two stages:
 * 1. DATA QUALITY - weighted availability of inputs; each missing critical
 *    input (price, volume, ATR) costs 15 points of ceiling
 * 2. CONTEXT - flow alignment, regime stability, MTF alignment and VIX
 *
 * The result is attached to the signal and never gates emission.
 */
@Component
public class ConfidenceScorer {

    static final double CRITICAL_PENALTY = 15.0;

    /**
     * Weighted availability table. Weights are relative; completeness is the
     * available share of the total.
     */
    enum DataField {
        PRICE(20, true, f -> FeatureReader.price(f) != null),
        PRICE_CHANGE(5, false, f -> FeatureReader.prevClose(f) != null),
        VOLUME(12, true, f -> f.getVolume() != null && f.getVolume().getCurrent() != null),
        VOLUME_AVG(5, false, f -> FeatureReader.avgVolume(f) != null),
        RELATIVE_VOLUME(8, false, f -> FeatureReader.rvol(f) != null),
        VWAP(10, false, f -> FeatureReader.vwap(f) != null),
        VWAP_DISTANCE(5, false, f -> FeatureReader.vwapDistancePct(f) != null),
        RSI(8, false, f -> FeatureReader.rsi(f) != null),
        EMA(6, false, f -> FeatureReader.ema(f, 21) != null || FeatureReader.ema(f, 9) != null),
        ATR(10, true, f -> FeatureReader.atr(f) != null),
        MTF_1M(2, false, f -> FeatureReader.timeframe(f, "1m") != null),
        MTF_5M(4, false, f -> FeatureReader.timeframe(f, "5m") != null),
        MTF_15M(3, false, f -> FeatureReader.timeframe(f, "15m") != null),
        MTF_60M(2, false, f -> FeatureReader.timeframe(f, "60m") != null),
        FLOW(5, false, f -> f.getFlow() != null),
        FLOW_SCORE(4, false, f -> f.getFlow() != null && f.getFlow().getFlowScore() != null),
        FLOW_BIAS(3, false, f -> f.getFlow() != null && f.getFlow().getFlowBias() != null),
        ORB(3, false, f -> FeatureReader.number(f, "orbHigh") != null || FeatureReader.number(f, "orbLow") != null),
        PRIOR_DAY_LEVELS(4, false, f -> FeatureReader.prevClose(f) != null),
        SWING_LEVELS(2, false, f -> FeatureReader.number(f, "swingHigh") != null
                || FeatureReader.number(f, "swingLow") != null),
        VIX_LEVEL(5, false, f -> FeatureReader.pattern(f, "vix_level") != null),
        MARKET_REGIME(5, false, f -> FeatureReader.pattern(f, "market_regime") != null),
        SESSION(3, false, f -> f.getSession() != null);

        final double weight;
        final boolean critical;
        final Predicate<FeatureSnapshot> available;

        DataField(double weight, boolean critical, Predicate<FeatureSnapshot> available) {
            this.weight = weight;
            this.critical = critical;
            this.available = available;
        }
    }

    public ConfidenceAssessment assess(FeatureSnapshot f, Direction direction, double compositeScore) {
        // ========== DATA QUALITY ==========
        double total = 0;
        double present = 0;
        List<String> missingCritical = new ArrayList<>();
        for (DataField field : DataField.values()) {
            total += field.weight;
            boolean has = f != null && field.available.test(f);
            if (has) {
                present += field.weight;
            } else if (field.critical) {
                missingCritical.add(field.name().toLowerCase(Locale.ROOT));
            }
        }
        int completeness = (int) Math.round(present / total * 100.0);
        double base = Math.min(100.0, 100.0 - CRITICAL_PENALTY * missingCritical.size());
        double bonus = 0;
        if (completeness < 50) {
            bonus = -20;
        } else if (completeness < 70) {
            bonus = -10;
        } else if (completeness >= 90) {
            bonus = 5;
        }
        double dataConfidence = clamp(base * completeness / 100.0 + bonus);

        // ========== CONTEXT ==========
        List<String> adjustments = new ArrayList<>();
        double adjustment = 0;

        FeatureSnapshot.Flow flow = FeatureReader.flow(f);
        if (FeatureReader.flowBias(f, direction)) {
            if (flow.getFlowScore() != null && flow.getFlowScore() >= 70) {
                adjustment += 10;
                adjustments.add("flow strongly aligned +10");
            } else {
                adjustment += 5;
                adjustments.add("flow aligned +5");
            }
        } else if (FeatureReader.flowOpposes(f, direction)) {
            adjustment -= 10;
            adjustments.add("flow opposed -10");
        }

        MarketRegime regime = FeatureReader.regime(f);
        if (regime == MarketRegime.VOLATILE) {
            adjustment -= 10;
            adjustments.add("volatile regime -10");
        } else if (regime == MarketRegime.CHOPPY) {
            adjustment -= 5;
            adjustments.add("choppy regime -5");
        }

        if (f != null && f.getMtf() != null && !f.getMtf().isEmpty()
                && MtfAlignment.score(f, direction) >= 75) {
            adjustment += 5;
            adjustments.add("MTF aligned +5");
        }

        VixLevel vix = FeatureReader.vix(f);
        if (vix == VixLevel.EXTREME) {
            adjustment -= 10;
            adjustments.add("extreme VIX -10");
        } else if (vix == VixLevel.HIGH) {
            adjustment -= 5;
            adjustments.add("high VIX -5");
        }

        double confidence = clamp(compositeScore * dataConfidence / 100.0 + adjustment);
        ConfidenceLevel level = ConfidenceLevel.of(confidence);

        String summary = String.format("%s confidence (%.0f): data %d%% complete%s%s",
                level, confidence, completeness,
                missingCritical.isEmpty() ? "" : ", missing " + String.join("/", missingCritical),
                adjustments.isEmpty() ? "" : "; " + String.join(", ", adjustments));

        return ConfidenceAssessment.builder()
                .dataCompleteness(completeness)
                .dataConfidence(dataConfidence)
                .confidence(confidence)
                .level(level)
                .missingCritical(missingCritical)
                .adjustments(adjustments)
                .summary(summary)
                .build();
    }

    private static double clamp(double v) {
        return Math.max(0.0, Math.min(100.0, v));
    }
}
