package com.kotsin.scanner.threshold;

import com.kotsin.scanner.detector.OpportunityDetector;
import com.kotsin.scanner.model.AnalysisMode;
import com.kotsin.scanner.model.FeatureSnapshot;
import com.kotsin.scanner.model.RiskReward;
import com.kotsin.scanner.model.StyleScores;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * ThresholdValidator - Decides whether a scored detection clears its thresholds.
 *
 * Checks, in order:
 * 1. Strategy enabled for the regime (adaptive layer only)
 * 2. Base score >= minBaseScore
 * 3. Recommended style score >= minStyleScore
 * 4. Risk/reward >= minRiskReward
 *
 * With the adaptive layer on (LIVE mode only) each effective threshold is the
 * stricter of the configured and the adaptive value.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ThresholdValidator {

    private final AdaptiveThresholdCalculator adaptiveCalculator;

    public ValidationResult validate(OpportunityDetector detector, FeatureSnapshot features,
                                     double baseScore, StyleScores styles, RiskReward riskReward,
                                     ResolvedThresholds resolved, AnalysisMode mode, boolean adaptiveEnabled) {
        List<String> warnings = new ArrayList<>();
        if (styles != null && styles.getWarnings() != null) {
            warnings.addAll(styles.getWarnings());
        }

        double minBase = resolved.getMinBaseScore();
        double minStyle = resolved.getMinStyleScore();
        double minRr = resolved.getMinRiskReward();
        double size = 1.0;
        AdaptiveThresholds adaptive = null;

        if (adaptiveEnabled && mode != AnalysisMode.HISTORICAL) {
            adaptive = adaptiveCalculator.compute(features, detector);
            warnings.addAll(adaptive.getWarnings());
            size = adaptive.getSizeMultiplier();
            if (!adaptive.isStrategyEnabled()) {
                return fail(String.format("Strategy disabled in %s regime: %s",
                        adaptive.getRegime().name().toLowerCase(Locale.ROOT), adaptive.getStrategyNotes()),
                        warnings, minBase, minStyle, minRr, size, adaptive);
            }
            minBase = Math.max(minBase, adaptive.getMinBaseScore());
            minStyle = Math.max(minStyle, adaptive.getMinStyleScore());
            minRr = Math.max(minRr, adaptive.getMinRiskReward());
        }

        String label = adaptive != null ? "adaptive threshold" : "threshold";

        if (baseScore < minBase) {
            String context = adaptive != null
                    ? String.format(" (%s, VIX: %s, Regime: %s)", adaptive.getTimeWindow().getLabel(),
                    adaptive.getVixLevel(), adaptive.getRegime())
                    : "";
            return fail(String.format("Base score %.1f < %s %.1f%s", baseScore, label, minBase, context),
                    warnings, minBase, minStyle, minRr, size, adaptive);
        }

        double styleScore = styles != null ? styles.getRecommendedStyleScore() : 0.0;
        if (styleScore < minStyle) {
            return fail(String.format("Style score %.1f (%s) < %s %.1f", styleScore,
                    styles != null ? styles.getRecommendedStyle() : "none", label, minStyle),
                    warnings, minBase, minStyle, minRr, size, adaptive);
        }

        double ratio = riskReward != null ? riskReward.getRatio() : 0.0;
        if (ratio < minRr) {
            return fail(String.format("Risk/reward %.2f < %s %.1f", ratio, label, minRr),
                    warnings, minBase, minStyle, minRr, size, adaptive);
        }

        return ValidationResult.builder()
                .passed(true)
                .warnings(warnings)
                .minBaseScore(minBase)
                .minStyleScore(minStyle)
                .minRiskReward(minRr)
                .sizeMultiplier(size)
                .adaptive(adaptive)
                .build();
    }

    private static ValidationResult fail(String reason, List<String> warnings, double minBase, double minStyle,
                                         double minRr, double size, AdaptiveThresholds adaptive) {
        log.debug("[THRESHOLDS] Rejected: {}", reason);
        return ValidationResult.builder()
                .passed(false)
                .reason(reason)
                .warnings(warnings)
                .minBaseScore(minBase)
                .minStyleScore(minStyle)
                .minRiskReward(minRr)
                .sizeMultiplier(size)
                .adaptive(adaptive)
                .build();
    }

    // ======================== RESULT ========================

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ValidationResult {
        private boolean passed;
        private String reason;

        @Builder.Default
        private List<String> warnings = new ArrayList<>();

        /** Effective thresholds the detection was held to */
        private double minBaseScore;
        private double minStyleScore;
        private double minRiskReward;

        @Builder.Default
        private double sizeMultiplier = 1.0;

        /** Null unless the adaptive layer ran */
        private AdaptiveThresholds adaptive;

        @Override
        public String toString() {
            if (passed) {
                return String.format("PASSED (base>=%.1f style>=%.1f rr>=%.1f, %d warnings)",
                        minBaseScore, minStyleScore, minRiskReward, warnings.size());
            }
            return "REJECTED: " + reason;
        }
    }
}
