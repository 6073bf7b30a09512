package com.kotsin.scanner.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Validates scanner configuration on startup and on every runtime update.
 *
 * All violations are collected before failing so one pass reports everything.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ScannerConfigValidator {

    private final ScannerConfig config;

    @EventListener(ApplicationReadyEvent.class)
    public void validateConfiguration() {
        log.info("[CONFIG] Validating scanner configuration...");
        validateOrThrow(config);
        log.info("[CONFIG] Scanner configuration valid: thresholds={}, filters={}, adaptive={}",
                config.getThresholds(), config.getFilters(), config.getAdaptive().isEnabled());
    }

    /**
     * @throws IllegalArgumentException listing every violation
     */
    public static void validateOrThrow(ScannerConfig candidate) {
        List<String> errors = validate(candidate);
        if (!errors.isEmpty()) {
            log.warn("[CONFIG] Configuration rejected with {} errors:", errors.size());
            errors.forEach(error -> log.warn("[CONFIG]   - {}", error));
            throw new IllegalArgumentException("Invalid scanner configuration: " + String.join("; ", errors));
        }
    }

    public static List<String> validate(ScannerConfig candidate) {
        List<String> errors = new ArrayList<>();
        if (candidate == null) {
            errors.add("config is null");
            return errors;
        }

        // Filters
        ScannerConfig.Filters filters = candidate.getFilters();
        if (filters == null) {
            errors.add("filters is not configured");
        } else {
            if (filters.getMinRvol() < 0) {
                errors.add("filters.minRvol must be >= 0, was " + filters.getMinRvol());
            }
            if (filters.getMaxSpreadPct() <= 0) {
                errors.add("filters.maxSpreadPct must be > 0, was " + filters.getMaxSpreadPct());
            }
            if (filters.getMinAvgVolume() < 0) {
                errors.add("filters.minAvgVolume must be >= 0, was " + filters.getMinAvgVolume());
            }
            if (filters.getBlacklist() == null) {
                errors.add("filters.blacklist must not be null");
            }
        }

        // Thresholds
        ScannerConfig.Thresholds t = candidate.getThresholds();
        if (t == null) {
            errors.add("thresholds is not configured");
        } else {
            checkScore(errors, "thresholds.minBaseScore", t.getMinBaseScore());
            checkScore(errors, "thresholds.minStyleScore", t.getMinStyleScore());
            checkRiskReward(errors, "thresholds.minRiskReward", t.getMinRiskReward());
            checkMaxPerHour(errors, "thresholds.maxSignalsPerSymbolPerHour", t.getMaxSignalsPerSymbolPerHour());
            checkCooldown(errors, "thresholds.cooldownMinutes", t.getCooldownMinutes());
        }

        if (candidate.getAssetClassThresholds() == null) {
            errors.add("assetClassThresholds must not be null");
        } else {
            candidate.getAssetClassThresholds().forEach((assetClass, override) -> {
                if (assetClass == null) {
                    errors.add("assetClassThresholds has a null asset class key");
                }
                checkOverride(errors, "assetClassThresholds." + assetClass, override);
            });
        }

        if (candidate.getDetectorThresholds() == null) {
            errors.add("detectorThresholds must not be null");
        } else {
            for (Map.Entry<String, ScannerConfig.ThresholdOverride> e : candidate.getDetectorThresholds().entrySet()) {
                if (e.getKey() == null || e.getKey().isBlank()) {
                    errors.add("detectorThresholds has a blank detector type key");
                }
                checkOverride(errors, "detectorThresholds." + e.getKey(), e.getValue());
            }
        }

        if (candidate.getHistoricalThresholds() != null) {
            checkOverride(errors, "historicalThresholds", candidate.getHistoricalThresholds());
        }

        if (candidate.getAdaptive() == null) {
            errors.add("adaptive is not configured");
        }
        if (candidate.getBarIntervalMinutes() < 1) {
            errors.add("barIntervalMinutes must be >= 1, was " + candidate.getBarIntervalMinutes());
        }
        if (candidate.getRateCapScope() == null) {
            errors.add("rateCapScope must not be null");
        }
        return errors;
    }

    // ============ CHECKS ============

    private static void checkOverride(List<String> errors, String path, ScannerConfig.ThresholdOverride o) {
        if (o == null) {
            errors.add(path + " must not be null");
            return;
        }
        if (o.getMinBaseScore() != null) checkScore(errors, path + ".minBaseScore", o.getMinBaseScore());
        if (o.getMinStyleScore() != null) checkScore(errors, path + ".minStyleScore", o.getMinStyleScore());
        if (o.getMinRiskReward() != null) checkRiskReward(errors, path + ".minRiskReward", o.getMinRiskReward());
        if (o.getMaxSignalsPerSymbolPerHour() != null) {
            checkMaxPerHour(errors, path + ".maxSignalsPerSymbolPerHour", o.getMaxSignalsPerSymbolPerHour());
        }
        if (o.getCooldownMinutes() != null) checkCooldown(errors, path + ".cooldownMinutes", o.getCooldownMinutes());
    }

    private static void checkScore(List<String> errors, String path, double value) {
        if (Double.isNaN(value) || value < 0 || value > 100) {
            errors.add(path + " must be within [0,100], was " + value);
        }
    }

    private static void checkRiskReward(List<String> errors, String path, double value) {
        if (Double.isNaN(value) || value < 0) {
            errors.add(path + " must be >= 0, was " + value);
        }
    }

    private static void checkMaxPerHour(List<String> errors, String path, int value) {
        if (value < 1) {
            errors.add(path + " must be >= 1, was " + value);
        }
    }

    private static void checkCooldown(List<String> errors, String path, int value) {
        if (value < 0) {
            errors.add(path + " must be >= 0, was " + value);
        }
    }
}
