package com.kotsin.scanner.threshold;

import com.kotsin.scanner.config.ScannerConfig;
import com.kotsin.scanner.model.AnalysisMode;
import com.kotsin.scanner.model.AssetClass;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ThresholdResolver - layered threshold config")
class ThresholdResolverTest {

    private ScannerConfig config;

    @BeforeEach
    void setUp() {
        config = new ScannerConfig();
        config.getAssetClassThresholds().put(AssetClass.INDEX, ScannerConfig.ThresholdOverride.builder()
                .minBaseScore(85.0).minStyleScore(88.0).minRiskReward(2.5).cooldownMinutes(20)
                .build());
        config.getDetectorThresholds().put("gamma_squeeze_bullish", ScannerConfig.ThresholdOverride.builder()
                .cooldownMinutes(45)
                .build());
    }

    @Test
    @DisplayName("Should use defaults when no override applies")
    void testDefaults() {
        ResolvedThresholds t = ThresholdResolver.resolve(config, AssetClass.STOCK, "breakout_bullish", AnalysisMode.LIVE);

        assertEquals(80.0, t.getMinBaseScore());
        assertEquals(85.0, t.getMinStyleScore());
        assertEquals(2.0, t.getMinRiskReward());
        assertEquals(2, t.getMaxSignalsPerSymbolPerHour());
        assertEquals(30, t.getCooldownMinutes());
    }

    @Test
    @DisplayName("Asset class override should replace only the fields it sets")
    void testAssetClassLayer() {
        ResolvedThresholds t = ThresholdResolver.resolve(config, AssetClass.INDEX, "eod_pin_setup", AnalysisMode.LIVE);

        assertEquals(85.0, t.getMinBaseScore());
        assertEquals(88.0, t.getMinStyleScore());
        assertEquals(2.5, t.getMinRiskReward());
        assertEquals(20, t.getCooldownMinutes());
        assertEquals(2, t.getMaxSignalsPerSymbolPerHour(), "inherited from defaults");
    }

    @Test
    @DisplayName("Detector override should win over the asset class layer")
    void testDetectorLayer() {
        ResolvedThresholds t = ThresholdResolver.resolve(config, AssetClass.INDEX, "gamma_squeeze_bullish", AnalysisMode.LIVE);

        assertEquals(45, t.getCooldownMinutes());
        assertEquals(85.0, t.getMinBaseScore());
    }

    @Test
    @DisplayName("Historical overrides should apply only in historical mode")
    void testHistoricalLayer() {
        ResolvedThresholds live = ThresholdResolver.resolve(config, AssetClass.STOCK, "breakout_bullish", AnalysisMode.LIVE);
        ResolvedThresholds historical = ThresholdResolver.resolve(config, AssetClass.STOCK, "breakout_bullish", AnalysisMode.HISTORICAL);

        assertEquals(80.0, live.getMinBaseScore());
        assertEquals(60.0, historical.getMinBaseScore());
        assertEquals(65.0, historical.getMinStyleScore());
        assertEquals(1.3, historical.getMinRiskReward());
        assertEquals(30, historical.getCooldownMinutes());
    }

    @Test
    @DisplayName("Fresh config should hold INDEX to the stricter set without any yml")
    void testSeededIndexThresholds() {
        ScannerConfig fresh = new ScannerConfig();

        ResolvedThresholds index = ThresholdResolver.resolve(fresh, AssetClass.INDEX, "eod_pin_setup", AnalysisMode.LIVE);
        ResolvedThresholds stock = ThresholdResolver.resolve(fresh, AssetClass.STOCK, "eod_pin_setup", AnalysisMode.LIVE);

        assertEquals(85.0, index.getMinBaseScore());
        assertEquals(88.0, index.getMinStyleScore());
        assertEquals(2.5, index.getMinRiskReward());
        assertEquals(20, index.getCooldownMinutes());
        assertEquals(80.0, stock.getMinBaseScore());
        assertEquals(30, stock.getCooldownMinutes());
    }
}
