package com.kotsin.scanner.config;

import com.kotsin.scanner.dedup.RateCapScope;
import com.kotsin.scanner.model.AssetClass;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * ScannerConfig - Filters and thresholds for the composite scanner.
 *
 * Bound from application.yml under "scanner":
 * scanner.filters.min-rvol=0.8
 * scanner.thresholds.min-base-score=80
 * scanner.asset-class-thresholds.INDEX.min-base-score=85
 * scanner.detector-thresholds.gamma_squeeze_bullish.cooldown-minutes=45
 *
 * Runtime changes go through CompositeScanner.updateConfig, which validates
 * and swaps in a copy. Instances handed to the scanner are never mutated by it.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "scanner")
public class ScannerConfig {

    private Filters filters = new Filters();

    /**
     * Defaults applied to every detector before overrides
     */
    private Thresholds thresholds = new Thresholds();

    /**
     * Partial overrides per asset class. Seeded with the stricter INDEX set;
     * application.yml entries replace it per key.
     */
    private Map<AssetClass, ThresholdOverride> assetClassThresholds = defaultAssetClassThresholds();

    /**
     * Partial overrides per detector type, applied after the asset class layer
     */
    private Map<String, ThresholdOverride> detectorThresholds = new LinkedHashMap<>();

    /**
     * Applied last, only in HISTORICAL analysis mode
     */
    private ThresholdOverride historicalThresholds = ThresholdOverride.builder()
            .minBaseScore(60.0)
            .minStyleScore(65.0)
            .minRiskReward(1.3)
            .build();

    private Adaptive adaptive = new Adaptive();

    /**
     * Bar width used to build bar time keys
     */
    private int barIntervalMinutes = 1;

    private RateCapScope rateCapScope = RateCapScope.SYMBOL_DETECTOR;

    /**
     * Stamped on every emitted signal
     */
    private String detectorVersion = "1.0.0";

    // ============ FILTERS ============

    @Data
    public static class Filters {
        private boolean marketHoursOnly = true;

        /**
         * Let detectors and the market-hours filter run outside the regular session
         */
        private boolean allowNonRegularHours = false;

        private double minRvol = 0.8;

        /**
         * Maximum bid/ask spread in percent of price
         */
        private double maxSpreadPct = 0.5;

        private Set<String> blacklist = new LinkedHashSet<>();

        private boolean requireMinimumLiquidity = false;

        private double minAvgVolume = 500_000;
    }

    // ============ THRESHOLDS ============

    @Data
    public static class Thresholds {
        private double minBaseScore = 80.0;
        private double minStyleScore = 85.0;
        private double minRiskReward = 2.0;
        private int maxSignalsPerSymbolPerHour = 2;
        private int cooldownMinutes = 30;
    }

    /**
     * Partial threshold set. Null fields inherit from the layer below.
     */
    @Data
    @Builder(toBuilder = true)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ThresholdOverride {
        private Double minBaseScore;
        private Double minStyleScore;
        private Double minRiskReward;
        private Integer maxSignalsPerSymbolPerHour;
        private Integer cooldownMinutes;
    }

    // ============ ADAPTIVE ============

    @Data
    public static class Adaptive {
        /**
         * Raise thresholds by time of day, VIX level and market regime (LIVE mode only)
         */
        private boolean enabled = false;
    }

    private static Map<AssetClass, ThresholdOverride> defaultAssetClassThresholds() {
        Map<AssetClass, ThresholdOverride> defaults = new LinkedHashMap<>();
        defaults.put(AssetClass.INDEX, ThresholdOverride.builder()
                .minBaseScore(85.0)
                .minStyleScore(88.0)
                .minRiskReward(2.5)
                .maxSignalsPerSymbolPerHour(2)
                .cooldownMinutes(20)
                .build());
        return defaults;
    }

    // ============ COPY ============

    /**
     * Deep copy, so callers can keep mutating their instance after handing it over.
     */
    public ScannerConfig copy() {
        ScannerConfig copy = new ScannerConfig();

        Filters f = new Filters();
        f.setMarketHoursOnly(filters.isMarketHoursOnly());
        f.setAllowNonRegularHours(filters.isAllowNonRegularHours());
        f.setMinRvol(filters.getMinRvol());
        f.setMaxSpreadPct(filters.getMaxSpreadPct());
        f.setBlacklist(new LinkedHashSet<>(filters.getBlacklist()));
        f.setRequireMinimumLiquidity(filters.isRequireMinimumLiquidity());
        f.setMinAvgVolume(filters.getMinAvgVolume());
        copy.setFilters(f);

        Thresholds t = new Thresholds();
        t.setMinBaseScore(thresholds.getMinBaseScore());
        t.setMinStyleScore(thresholds.getMinStyleScore());
        t.setMinRiskReward(thresholds.getMinRiskReward());
        t.setMaxSignalsPerSymbolPerHour(thresholds.getMaxSignalsPerSymbolPerHour());
        t.setCooldownMinutes(thresholds.getCooldownMinutes());
        copy.setThresholds(t);

        Map<AssetClass, ThresholdOverride> byClass = new LinkedHashMap<>();
        assetClassThresholds.forEach((k, v) -> byClass.put(k, v == null ? null : v.toBuilder().build()));
        copy.setAssetClassThresholds(byClass);

        Map<String, ThresholdOverride> byType = new LinkedHashMap<>();
        detectorThresholds.forEach((k, v) -> byType.put(k, v == null ? null : v.toBuilder().build()));
        copy.setDetectorThresholds(byType);

        copy.setHistoricalThresholds(historicalThresholds == null ? null : historicalThresholds.toBuilder().build());

        Adaptive a = new Adaptive();
        a.setEnabled(adaptive.isEnabled());
        copy.setAdaptive(a);

        copy.setBarIntervalMinutes(barIntervalMinutes);
        copy.setRateCapScope(rateCapScope);
        copy.setDetectorVersion(detectorVersion);
        return copy;
    }
}
