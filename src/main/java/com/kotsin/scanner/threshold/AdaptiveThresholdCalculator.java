package com.kotsin.scanner.threshold;

import com.kotsin.scanner.detector.FeatureReader;
import com.kotsin.scanner.detector.OpportunityDetector;
import com.kotsin.scanner.model.FeatureSnapshot;
import com.kotsin.scanner.model.MarketRegime;
import com.kotsin.scanner.model.StrategyCategory;
import com.kotsin.scanner.model.VixLevel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * AdaptiveThresholdCalculator - Raises or relaxes score thresholds with market context.
 *
 * Three layers:
 * 1. TIME OF DAY - opening drive and power hour are permissive, lunch chop strict
 * 2. VIX LEVEL - elevated volatility adds to every threshold and cuts size
 * 3. REGIME x STRATEGY - e.g. breakouts in a range need an extreme setup
 *
 * Combination: minBase = max(time + vix, regime base, +10 when the strategy is
 * disabled for the regime), minStyle = time + vix, minRR = max(time + vix, regime RR).
 */
@Slf4j
@Component
public class AdaptiveThresholdCalculator {

    private record RegimeRule(double minBase, double minRiskReward, boolean enabled, String notes) {
    }

    private final Map<MarketRegime, Map<StrategyCategory, RegimeRule>> regimeTable = buildRegimeTable();

    public AdaptiveThresholds compute(FeatureSnapshot features, OpportunityDetector detector) {
        return compute(features == null ? null : features.getTimestamp(),
                FeatureReader.vix(features),
                FeatureReader.regime(features),
                detector.getCategory());
    }

    public AdaptiveThresholds compute(Instant timestamp, VixLevel vix, MarketRegime regime, StrategyCategory category) {
        VixLevel vixLevel = vix != null ? vix : VixLevel.MEDIUM;
        MarketRegime marketRegime = regime != null ? regime : MarketRegime.UNKNOWN;
        StrategyCategory strategy = category != null ? category : StrategyCategory.ALL;
        TimeWindow window = TimeWindow.at(timestamp);
        List<String> warnings = new ArrayList<>();

        if (!window.isSessionWindow()) {
            warnings.add("Outside regular trading hours - using conservative defaults");
        }

        RegimeRule rule = regimeTable.getOrDefault(marketRegime, Map.of()).get(strategy);
        boolean enabled = rule == null || rule.enabled();
        String notes = rule != null ? rule.notes() : "";
        if (!enabled) {
            warnings.add(String.format("%s strategy not recommended in %s regime: %s",
                    strategy.name().toLowerCase(Locale.ROOT), marketRegime.name().toLowerCase(Locale.ROOT), notes));
        }

        double timeVixBase = window.getMinBaseScore() + vixLevel.getMinBaseAdjustment();
        double regimeBase = rule != null ? rule.minBase() : window.getMinBaseScore();
        double minBase = Math.max(timeVixBase, enabled ? regimeBase : regimeBase + 10);

        double minStyle = window.getMinStyleScore() + vixLevel.getMinStyleAdjustment();

        double timeVixRr = window.getMinRiskReward() + vixLevel.getMinRiskRewardAdjustment();
        double regimeRr = rule != null ? rule.minRiskReward() : window.getMinRiskReward();
        double minRr = Math.max(timeVixRr, regimeRr);

        double size = window.getSizeMultiplier() * vixLevel.getSizeMultiplier();

        if (minBase > 85) {
            warnings.add("Very high threshold - only best-in-class setups will qualify");
        }
        if (size < 0.5) {
            warnings.add("Low position size recommended - high volatility environment");
        }

        AdaptiveThresholds result = AdaptiveThresholds.builder()
                .minBaseScore(Math.round(minBase))
                .minStyleScore(Math.round(minStyle))
                .minRiskReward(Math.round(minRr * 10) / 10.0)
                .sizeMultiplier(Math.round(size * 100) / 100.0)
                .timeWindow(window)
                .vixLevel(vixLevel)
                .regime(marketRegime)
                .category(strategy)
                .strategyEnabled(enabled)
                .strategyNotes(notes)
                .warnings(warnings)
                .build();

        log.debug("[THRESHOLDS] Adaptive {} / VIX {} / {} / {}: base={} style={} rr={} size={}",
                window.getLabel(), vixLevel, marketRegime, strategy,
                result.getMinBaseScore(), result.getMinStyleScore(),
                result.getMinRiskReward(), result.getSizeMultiplier());
        return result;
    }

    // ======================== REGIME TABLE ========================

    private static Map<MarketRegime, Map<StrategyCategory, RegimeRule>> buildRegimeTable() {
        Map<MarketRegime, Map<StrategyCategory, RegimeRule>> table = new EnumMap<>(MarketRegime.class);

        Map<StrategyCategory, RegimeRule> trending = new EnumMap<>(StrategyCategory.class);
        trending.put(StrategyCategory.BREAKOUT, new RegimeRule(65, 1.3, true,
                "Breakouts work well in trends - lower threshold"));
        trending.put(StrategyCategory.MEAN_REVERSION, new RegimeRule(85, 2.0, false,
                "Fighting the trend - high risk, require extreme setup"));
        trending.put(StrategyCategory.TREND_CONTINUATION, new RegimeRule(60, 1.2, true,
                "Best strategy for trending markets - lowest threshold"));
        trending.put(StrategyCategory.GAMMA, new RegimeRule(70, 1.5, true,
                "Gamma plays can work with trend"));
        trending.put(StrategyCategory.REVERSAL, new RegimeRule(88, 2.2, false,
                "Reversals in trends are counter-trend - very risky"));
        trending.put(StrategyCategory.ALL, new RegimeRule(70, 1.5, true,
                "Generic catch-all for trending markets"));
        table.put(MarketRegime.TRENDING, trending);

        Map<StrategyCategory, RegimeRule> ranging = new EnumMap<>(StrategyCategory.class);
        ranging.put(StrategyCategory.BREAKOUT, new RegimeRule(85, 2.0, false,
                "Breakouts fail 70%+ in ranges - avoid or require extreme setup"));
        ranging.put(StrategyCategory.MEAN_REVERSION, new RegimeRule(65, 1.3, true,
                "Mean reversion is the play in ranges - lower threshold"));
        ranging.put(StrategyCategory.TREND_CONTINUATION, new RegimeRule(80, 1.8, false,
                "No trend to continue - avoid"));
        ranging.put(StrategyCategory.GAMMA, new RegimeRule(72, 1.5, true,
                "Gamma pinning can work well in ranges"));
        ranging.put(StrategyCategory.REVERSAL, new RegimeRule(70, 1.4, true,
                "Range reversals at extremes work well"));
        ranging.put(StrategyCategory.ALL, new RegimeRule(72, 1.5, true,
                "Generic catch-all for ranging markets"));
        table.put(MarketRegime.RANGING, ranging);

        Map<StrategyCategory, RegimeRule> choppy = new EnumMap<>(StrategyCategory.class);
        choppy.put(StrategyCategory.BREAKOUT, new RegimeRule(92, 2.5, false,
                "Choppy markets = false breakouts - avoid"));
        choppy.put(StrategyCategory.MEAN_REVERSION, new RegimeRule(78, 1.5, true,
                "Can work with extra confirmation"));
        choppy.put(StrategyCategory.TREND_CONTINUATION, new RegimeRule(88, 2.2, false,
                "No trend in chop - avoid"));
        choppy.put(StrategyCategory.GAMMA, new RegimeRule(82, 1.8, true,
                "Gamma plays can work but need wider stops"));
        choppy.put(StrategyCategory.REVERSAL, new RegimeRule(75, 1.5, true,
                "Reversals at extreme chop levels can work"));
        choppy.put(StrategyCategory.ALL, new RegimeRule(82, 1.8, true,
                "Generic catch-all for choppy markets - require higher confidence"));
        table.put(MarketRegime.CHOPPY, choppy);

        Map<StrategyCategory, RegimeRule> volatileRegime = new EnumMap<>(StrategyCategory.class);
        volatileRegime.put(StrategyCategory.BREAKOUT, new RegimeRule(85, 2.0, true,
                "Breakouts can work but need wider stops"));
        volatileRegime.put(StrategyCategory.MEAN_REVERSION, new RegimeRule(80, 1.8, true,
                "Extreme moves often revert - but volatile"));
        volatileRegime.put(StrategyCategory.TREND_CONTINUATION, new RegimeRule(82, 2.0, true,
                "Can ride volatility but size down"));
        volatileRegime.put(StrategyCategory.GAMMA, new RegimeRule(78, 1.6, true,
                "Gamma squeezes love volatility"));
        volatileRegime.put(StrategyCategory.REVERSAL, new RegimeRule(72, 1.4, true,
                "Volatility creates reversal opportunities"));
        volatileRegime.put(StrategyCategory.ALL, new RegimeRule(78, 1.6, true,
                "Generic catch-all for volatile markets - size down"));
        table.put(MarketRegime.VOLATILE, volatileRegime);

        return table;
    }
}
