package com.kotsin.scanner.detector;

import com.kotsin.scanner.model.AssetClass;
import com.kotsin.scanner.model.Direction;
import com.kotsin.scanner.model.FactorContribution;
import com.kotsin.scanner.model.FeatureSnapshot;
import com.kotsin.scanner.model.OptionsChainContext;
import com.kotsin.scanner.model.StrategyCategory;
import com.kotsin.scanner.model.TradingStyle;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * OpportunityDetector - A declarative pattern: a fail-closed gate plus an
 * ordered list of weighted score factors.
 *
 * Detectors are plain values built in the catalog classes. They hold no state
 * and may be evaluated concurrently across symbols.
 */
@Slf4j
@Getter
@Builder
public class OpportunityDetector {

    @FunctionalInterface
    public interface Gate {
        boolean test(DetectionContext context);
    }

    /**
     * Unique id, e.g. "breakout_bullish"
     */
    private final String type;

    private final String description;

    private final Direction direction;

    @Singular
    private final Set<AssetClass> assetClasses;

    private final boolean requiresOptionsData;

    /**
     * Options order flow is the primary trigger rather than confirmation
     */
    private final boolean flowPrimary;

    private final StrategyCategory category;

    /**
     * Style the pattern was designed for. Informational, style scoring picks the actual style.
     */
    private final TradingStyle idealStyle;

    private final Gate gate;

    @Singular
    private final List<ScoreFactor> scoreFactors;

    // ======================== GATE ========================

    /**
     * Run the gate. Returns false, never throws, when options data is required
     * but missing or when the gate itself fails on malformed input.
     */
    public boolean detect(DetectionContext context) {
        if (context == null || context.getFeatures() == null) return false;
        if (requiresOptionsData && !context.hasOptions()) return false;
        try {
            return gate.test(context);
        } catch (RuntimeException e) {
            log.warn("[DETECTOR] {} gate failed for {}, treating as no detection: {}",
                    type, context.symbol(), e.toString());
            return false;
        }
    }

    public boolean detect(FeatureSnapshot features, OptionsChainContext options) {
        return detect(DetectionContext.live(features, options));
    }

    // ======================== SCORE ========================

    /**
     * Composite score = sum(weight * factor), clamped to [0,100]. Weights are not renormalized.
     */
    public DetectionResult score(FeatureSnapshot features, OptionsChainContext options) {
        List<FactorContribution> breakdown = new ArrayList<>(scoreFactors.size());
        double total = 0.0;
        for (ScoreFactor factor : scoreFactors) {
            double value = factor.evaluate(features, options);
            double contribution = factor.getWeight() * value;
            total += contribution;
            breakdown.add(FactorContribution.builder()
                    .name(factor.getName())
                    .weight(factor.getWeight())
                    .score(value)
                    .contribution(contribution)
                    .build());
        }
        return DetectionResult.builder()
                .detectorType(type)
                .compositeScore(Math.max(0.0, Math.min(100.0, total)))
                .factors(breakdown)
                .build();
    }

    // ======================== HELPERS ========================

    public boolean appliesTo(AssetClass assetClass) {
        return assetClasses.contains(assetClass);
    }

    public double totalWeight() {
        double sum = 0.0;
        for (ScoreFactor f : scoreFactors) {
            sum += f.getWeight();
        }
        return sum;
    }

    public StrategyCategory getCategory() {
        return category != null ? category : StrategyCategory.categorize(type);
    }

    @Override
    public String toString() {
        return String.format("OpportunityDetector[%s %s classes=%s factors=%d options=%s]",
                type, direction, assetClasses, scoreFactors.size(), requiresOptionsData);
    }
}
