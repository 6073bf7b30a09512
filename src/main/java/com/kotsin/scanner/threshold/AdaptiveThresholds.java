package com.kotsin.scanner.threshold;

import com.kotsin.scanner.model.MarketRegime;
import com.kotsin.scanner.model.StrategyCategory;
import com.kotsin.scanner.model.VixLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Context-adapted thresholds for one detector at one moment.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AdaptiveThresholds {

    private double minBaseScore;
    private double minStyleScore;
    private double minRiskReward;

    /**
     * Suggested position size relative to normal (time window x VIX)
     */
    private double sizeMultiplier;

    private TimeWindow timeWindow;
    private VixLevel vixLevel;
    private MarketRegime regime;
    private StrategyCategory category;

    @Builder.Default
    private boolean strategyEnabled = true;

    private String strategyNotes;

    @Builder.Default
    private List<String> warnings = new ArrayList<>();
}
