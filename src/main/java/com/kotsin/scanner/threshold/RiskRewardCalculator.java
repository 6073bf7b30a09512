package com.kotsin.scanner.threshold;

import com.kotsin.scanner.config.ScannerConstants;
import com.kotsin.scanner.detector.FeatureReader;
import com.kotsin.scanner.model.Direction;
import com.kotsin.scanner.model.FeatureSnapshot;
import com.kotsin.scanner.model.RiskReward;
import com.kotsin.scanner.model.TradingStyle;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * ATR-based stop and targets for a trading style.
 *
 * Stop = entry -/+ ATR x stop multiple; targets = entry +/- ATR x target multiples.
 * The ratio is reward to T2 over risk to the stop.
 */
@Component
public class RiskRewardCalculator {

    /**
     * @return the plan, or null when the snapshot has no usable price
     */
    public RiskReward calculate(FeatureSnapshot f, Direction direction, TradingStyle style) {
        Double entry = FeatureReader.price(f);
        if (entry == null) {
            return null;
        }
        double atr = resolveAtr(f, style);
        int sign = direction.sign();

        double stop = entry - sign * atr * style.getStopAtrMultiplier();
        List<Double> targets = new ArrayList<>(3);
        for (int i = 0; i < 3; i++) {
            targets.add(entry + sign * atr * style.targetMultiplier(i));
        }

        double risk = Math.abs(entry - stop);
        double reward = Math.abs(targets.get(1) - entry);
        double ratio = risk > 0 ? reward / risk : 0.0;

        return RiskReward.builder()
                .style(style)
                .entry(entry)
                .stop(stop)
                .targets(targets)
                .atrUsed(atr)
                .riskAmount(risk)
                .rewardPotential(reward)
                .ratio(ratio)
                .build();
    }

    /**
     * ATR from the style's primary timeframe, then 5m, then the snapshot itself, then a fixed fallback.
     */
    static double resolveAtr(FeatureSnapshot f, TradingStyle style) {
        Double atr = FeatureReader.atr(FeatureReader.timeframe(f, style.getPrimaryTimeframe()));
        if (atr == null) {
            atr = FeatureReader.atr(FeatureReader.timeframe(f, "5m"));
        }
        if (atr == null) {
            atr = FeatureReader.atr(f);
        }
        return atr != null ? atr : ScannerConstants.DEFAULT_ATR;
    }
}
