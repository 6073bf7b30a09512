package com.kotsin.scanner.model;

import lombok.Getter;

/**
 * Trading style profiles. Each carries the timeframe its ATR is read from and
 * the ATR multiples used for stop and targets.
 */
@Getter
public enum TradingStyle {
    SCALP("scalp", "5m", 0.75, new double[]{1.0, 1.5, 2.0}, 1.5),
    DAY_TRADE("day_trade", "15m", 1.0, new double[]{1.5, 2.5, 3.5}, 1.8),
    SWING("swing", "60m", 1.5, new double[]{2.0, 3.0, 4.0}, 2.0);

    private final String label;
    private final String primaryTimeframe;
    private final double stopAtrMultiplier;
    private final double[] targetAtrMultipliers;
    private final double profileMinRiskReward;

    TradingStyle(String label, String primaryTimeframe, double stopAtrMultiplier,
                 double[] targetAtrMultipliers, double profileMinRiskReward) {
        this.label = label;
        this.primaryTimeframe = primaryTimeframe;
        this.stopAtrMultiplier = stopAtrMultiplier;
        this.targetAtrMultipliers = targetAtrMultipliers;
        this.profileMinRiskReward = profileMinRiskReward;
    }

    public double targetMultiplier(int index) {
        return targetAtrMultipliers[index];
    }
}
