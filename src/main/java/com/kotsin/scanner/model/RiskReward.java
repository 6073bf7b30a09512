package com.kotsin.scanner.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * ATR-based trade plan for a detection. The ratio is measured against T2.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RiskReward {
    private TradingStyle style;
    private double entry;
    private double stop;
    /** T1, T2, T3 */
    private List<Double> targets;
    private double atrUsed;
    private double riskAmount;
    private double rewardPotential;
    private double ratio;
}
