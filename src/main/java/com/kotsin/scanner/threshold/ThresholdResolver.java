package com.kotsin.scanner.threshold;

import com.kotsin.scanner.config.ScannerConfig;
import com.kotsin.scanner.model.AnalysisMode;
import com.kotsin.scanner.model.AssetClass;

/**
 * Layers threshold config: defaults, then asset class, then detector type,
 * then historical overrides (HISTORICAL mode only). Later layers win field by field.
 */
public final class ThresholdResolver {

    private ThresholdResolver() {
        throw new UnsupportedOperationException("Utility class");
    }

    public static ResolvedThresholds resolve(ScannerConfig config, AssetClass assetClass,
                                             String detectorType, AnalysisMode mode) {
        ScannerConfig.Thresholds defaults = config.getThresholds();
        ResolvedThresholds resolved = ResolvedThresholds.builder()
                .minBaseScore(defaults.getMinBaseScore())
                .minStyleScore(defaults.getMinStyleScore())
                .minRiskReward(defaults.getMinRiskReward())
                .maxSignalsPerSymbolPerHour(defaults.getMaxSignalsPerSymbolPerHour())
                .cooldownMinutes(defaults.getCooldownMinutes())
                .build();

        if (assetClass != null) {
            resolved = apply(resolved, config.getAssetClassThresholds().get(assetClass));
        }
        if (detectorType != null) {
            resolved = apply(resolved, config.getDetectorThresholds().get(detectorType));
        }
        if (mode == AnalysisMode.HISTORICAL) {
            resolved = apply(resolved, config.getHistoricalThresholds());
        }
        return resolved;
    }

    static ResolvedThresholds apply(ResolvedThresholds base, ScannerConfig.ThresholdOverride override) {
        if (override == null) return base;
        ResolvedThresholds.ResolvedThresholdsBuilder b = base.toBuilder();
        if (override.getMinBaseScore() != null) b.minBaseScore(override.getMinBaseScore());
        if (override.getMinStyleScore() != null) b.minStyleScore(override.getMinStyleScore());
        if (override.getMinRiskReward() != null) b.minRiskReward(override.getMinRiskReward());
        if (override.getMaxSignalsPerSymbolPerHour() != null) {
            b.maxSignalsPerSymbolPerHour(override.getMaxSignalsPerSymbolPerHour());
        }
        if (override.getCooldownMinutes() != null) b.cooldownMinutes(override.getCooldownMinutes());
        return b.build();
    }
}
