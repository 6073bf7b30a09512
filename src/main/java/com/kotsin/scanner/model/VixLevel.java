package com.kotsin.scanner.model;

import lombok.Getter;

import java.util.Locale;

/**
 * VIX classification with its adaptive-threshold adjustments.
 */
@Getter
public enum VixLevel {
    LOW(-5, -3, -0.2, 1.2),
    MEDIUM(0, 0, 0.0, 1.0),
    HIGH(5, 5, 0.3, 0.7),
    EXTREME(15, 12, 0.7, 0.4);

    private final double minBaseAdjustment;
    private final double minStyleAdjustment;
    private final double minRiskRewardAdjustment;
    private final double sizeMultiplier;

    VixLevel(double minBaseAdjustment, double minStyleAdjustment,
             double minRiskRewardAdjustment, double sizeMultiplier) {
        this.minBaseAdjustment = minBaseAdjustment;
        this.minStyleAdjustment = minStyleAdjustment;
        this.minRiskRewardAdjustment = minRiskRewardAdjustment;
        this.sizeMultiplier = sizeMultiplier;
    }

    /**
     * Parse the "vix_level" pattern value. Unknown values read as MEDIUM.
     */
    public static VixLevel from(Object raw) {
        if (raw == null) return MEDIUM;
        String s = raw.toString().trim().toUpperCase(Locale.ROOT);
        for (VixLevel v : values()) {
            if (v.name().equals(s)) return v;
        }
        return MEDIUM;
    }
}
