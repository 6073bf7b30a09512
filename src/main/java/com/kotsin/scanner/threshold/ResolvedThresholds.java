package com.kotsin.scanner.threshold;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Effective thresholds for one (asset class, detector type, mode) after all config layers.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ResolvedThresholds {
    private double minBaseScore;
    private double minStyleScore;
    private double minRiskReward;
    private int maxSignalsPerSymbolPerHour;
    private int cooldownMinutes;
}
