package com.kotsin.scanner.config;

import com.kotsin.scanner.model.AssetClass;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ScannerConfigValidator - startup and runtime config checks")
class ScannerConfigValidatorTest {

    private ScannerConfig config;

    @BeforeEach
    void setUp() {
        config = new ScannerConfig();
    }

    // ========== VALID CONFIG ==========

    @Test
    @DisplayName("Defaults should be valid")
    void testDefaultsValid() {
        assertTrue(ScannerConfigValidator.validate(config).isEmpty());
        assertDoesNotThrow(() -> ScannerConfigValidator.validateOrThrow(config));
    }

    @Test
    @DisplayName("Startup validation should pass on the bound config")
    void testStartupValidation() {
        ScannerConfigValidator validator = new ScannerConfigValidator(config);
        assertDoesNotThrow(validator::validateConfiguration);
    }

    // ========== INVALID CONFIG ==========

    @Test
    @DisplayName("Should collect every violation in one pass")
    void testCollectsAllErrors() {
        config.getFilters().setMinRvol(-0.1);
        config.getThresholds().setMinBaseScore(120);
        config.getThresholds().setMaxSignalsPerSymbolPerHour(0);
        config.getThresholds().setCooldownMinutes(-5);
        config.setBarIntervalMinutes(0);

        List<String> errors = ScannerConfigValidator.validate(config);

        assertEquals(5, errors.size());
        assertTrue(errors.contains("filters.minRvol must be >= 0, was -0.1"));
        assertTrue(errors.contains("thresholds.minBaseScore must be within [0,100], was 120.0"));
        assertTrue(errors.contains("thresholds.maxSignalsPerSymbolPerHour must be >= 1, was 0"));
        assertTrue(errors.contains("thresholds.cooldownMinutes must be >= 0, was -5"));
        assertTrue(errors.contains("barIntervalMinutes must be >= 1, was 0"));
    }

    @Test
    @DisplayName("Should check overrides field by field, ignoring unset fields")
    void testOverrides() {
        config.getAssetClassThresholds().put(AssetClass.INDEX, ScannerConfig.ThresholdOverride.builder()
                .minRiskReward(-1.0)
                .build());
        config.getDetectorThresholds().put("eod_pin_setup", ScannerConfig.ThresholdOverride.builder()
                .cooldownMinutes(120)
                .build());

        List<String> errors = ScannerConfigValidator.validate(config);

        assertEquals(List.of("assetClassThresholds.INDEX.minRiskReward must be >= 0, was -1.0"), errors);
    }

    @Test
    @DisplayName("Should reject null sections")
    void testNullSections() {
        config.setFilters(null);
        config.setRateCapScope(null);
        config.getDetectorThresholds().put("breakout_bullish", null);

        List<String> errors = ScannerConfigValidator.validate(config);

        assertTrue(errors.contains("filters is not configured"));
        assertTrue(errors.contains("rateCapScope must not be null"));
        assertTrue(errors.contains("detectorThresholds.breakout_bullish must not be null"));
        assertEquals(List.of("config is null"), ScannerConfigValidator.validate(null));
    }

    @Test
    @DisplayName("validateOrThrow should list the violations in the message")
    void testValidateOrThrow() {
        config.getFilters().setMaxSpreadPct(0);

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> ScannerConfigValidator.validateOrThrow(config));

        assertEquals("Invalid scanner configuration: filters.maxSpreadPct must be > 0, was 0.0", e.getMessage());
    }

    // ========== COPY ==========

    @Test
    @DisplayName("copy should be deep: later edits to the source do not leak")
    void testDeepCopy() {
        config.getFilters().getBlacklist().add("GME");
        config.getAssetClassThresholds().put(AssetClass.INDEX, ScannerConfig.ThresholdOverride.builder()
                .minBaseScore(85.0)
                .build());

        ScannerConfig copy = config.copy();
        config.getFilters().getBlacklist().add("AMC");
        config.getFilters().setMinRvol(3.0);
        config.getAssetClassThresholds().get(AssetClass.INDEX).setMinBaseScore(99.0);
        config.getThresholds().setCooldownMinutes(1);
        config.getHistoricalThresholds().setMinBaseScore(10.0);

        assertEquals(1, copy.getFilters().getBlacklist().size());
        assertEquals(0.8, copy.getFilters().getMinRvol(), 1e-9);
        assertEquals(85.0, copy.getAssetClassThresholds().get(AssetClass.INDEX).getMinBaseScore(), 1e-9);
        assertEquals(30, copy.getThresholds().getCooldownMinutes());
        assertEquals(60.0, copy.getHistoricalThresholds().getMinBaseScore(), 1e-9);
    }
}
