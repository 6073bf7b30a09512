package com.kotsin.scanner.threshold;

import com.kotsin.scanner.config.ScannerConstants;
import com.kotsin.scanner.detector.MtfAlignment;
import com.kotsin.scanner.model.FeatureSnapshot;
import com.kotsin.scanner.model.MarketRegime;
import com.kotsin.scanner.model.StyleScores;
import com.kotsin.scanner.model.TradingStyle;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

import static com.kotsin.scanner.detector.FeatureReader.*;

/**
 * StyleScorer - Re-weights a detector's base score for scalp, day trade and swing.
 *
 * Each context factor multiplies the three style multipliers; the products are
 * clamped to [0.5, 1.5] and applied to the base score. The recommended style is
 * the highest scoring one (scalp, then day trade, then swing on ties).
 */
@Slf4j
@Component
public class StyleScorer {

    private static final double MIN_MULTIPLIER = 0.5;
    private static final double MAX_MULTIPLIER = 1.5;

    public StyleScores score(double baseScore, FeatureSnapshot f) {
        double[] m = {1.0, 1.0, 1.0};
        List<String> warnings = new ArrayList<>();
        TimeWindow window = TimeWindow.at(f != null ? f.getTimestamp() : null);

        // ========== TIME OF DAY ==========
        switch (window) {
            case PRE_MARKET -> apply(m, 0.6, 0.7, 0.9);
            case OPENING_DRIVE -> apply(m, 1.35, 1.15, 0.75);
            case MID_MORNING -> apply(m, 1.1, 1.15, 1.0);
            case LATE_MORNING -> apply(m, 1.0, 1.1, 1.05);
            case LUNCH_CHOP -> {
                apply(m, 0.55, 0.75, 1.0);
                warnings.add("Lunch chop - low follow-through for short holds");
            }
            case EARLY_AFTERNOON -> apply(m, 0.85, 1.0, 1.05);
            case AFTERNOON -> apply(m, 0.95, 1.1, 1.0);
            case POWER_HOUR -> apply(m, 1.25, 1.2, 0.85);
            case WEEKEND -> apply(m, 0.4, 0.5, 1.2);
            default -> apply(m, 0.5, 0.6, 0.9);
        }

        // ========== VOLATILITY (ATR % of price) ==========
        Double price = price(f);
        Double atr = atr(f);
        if (price != null && atr != null) {
            double atrPct = atr / price * 100.0;
            if (atrPct > 2.5) {
                apply(m, 0.7, 1.05, 1.25);
            } else if (atrPct > 1.5) {
                apply(m, 0.9, 1.1, 1.15);
            } else if (atrPct < 0.5) {
                apply(m, 1.15, 0.85, 0.65);
            } else if (atrPct < 1.0) {
                apply(m, 1.1, 0.95, 0.8);
            }
        }

        // ========== VOLUME ==========
        double rvol = or(rvol(f), 1.0);
        if (rvol > 1.5) {
            apply(m, 1.3, 1.15, 1.0);
        } else if (rvol < 0.5) {
            apply(m, 0.6, 0.75, 0.95);
            warnings.add("Low volume - wide spreads likely");
        } else if (rvol < 0.75) {
            apply(m, 0.8, 0.9, 0.98);
        }

        // ========== KEY LEVEL ==========
        if (nearKeyLevel(f)) {
            apply(m, 1.25, 1.15, 1.1);
        }

        // ========== RSI EXTREME ==========
        Double rsi = rsi(f);
        if (rsi != null && (rsi < 30 || rsi > 70)) {
            apply(m, 0.85, 1.1, 1.25);
        }

        // ========== MTF ALIGNMENT ==========
        double mtf = MtfAlignment.score(f);
        if (mtf > 80) {
            apply(m, 1.05, 1.15, 1.3);
        } else if (mtf > 60) {
            apply(m, 1.0, 1.05, 1.1);
        } else if (mtf < 40) {
            apply(m, 1.0, 0.8, 0.6);
            warnings.add("Poor MTF alignment - avoid swing trades");
        }

        // ========== REGIME ==========
        MarketRegime regime = regime(f);
        switch (regime) {
            case TRENDING -> apply(m, 1.0, 1.15, 1.25);
            case RANGING -> apply(m, 1.1, 1.0, 0.85);
            case CHOPPY -> {
                apply(m, 0.65, 0.75, 0.55);
                warnings.add("Choppy regime - reduce position sizes");
            }
            case VOLATILE -> apply(m, 0.85, 1.1, 1.2);
            default -> {
                // unclassified regime leaves styles unchanged
            }
        }

        // ========== SESSION ==========
        boolean weekend = window == TimeWindow.WEEKEND && !Boolean.TRUE.equals(regularHoursFlag(f));
        boolean preMarket = "pre_market".equals(text(f, "session"))
                || (Boolean.FALSE.equals(regularHoursFlag(f)) && window == TimeWindow.PRE_MARKET);
        boolean afterHours = "after_hours".equals(text(f, "session"))
                || (Boolean.FALSE.equals(regularHoursFlag(f)) && window == TimeWindow.AFTER_HOURS);
        if (preMarket) {
            apply(m, 0.5, 0.6, 0.85);
            warnings.add("Pre-market - liquidity may be thin");
        }
        if (afterHours) {
            apply(m, 0.4, 0.5, 0.8);
            warnings.add("After-hours - limited liquidity");
        }
        if (weekend) {
            apply(m, 0.3, 0.4, 1.15);
            warnings.add("Weekend - signals for planning only");
        }

        // ========== TIME TO CLOSE ==========
        Integer sinceOpen = minutesSinceOpen(f);
        if (sinceOpen != null) {
            int toClose = Math.max(0, ScannerConstants.REGULAR_SESSION_MINUTES - sinceOpen);
            if (toClose < 30 && !afterHours && !weekend) {
                apply(m, 1.1, 0.6, 1.0);
            } else if (toClose < 60) {
                apply(m, 1.0, 0.85, 1.0);
            }
        }

        double scalp = clamp(baseScore * clamp(m[0], MIN_MULTIPLIER, MAX_MULTIPLIER), 0, 100);
        double day = clamp(baseScore * clamp(m[1], MIN_MULTIPLIER, MAX_MULTIPLIER), 0, 100);
        double swing = clamp(baseScore * clamp(m[2], MIN_MULTIPLIER, MAX_MULTIPLIER), 0, 100);

        TradingStyle best = TradingStyle.SCALP;
        double bestScore = scalp;
        if (day > bestScore) {
            best = TradingStyle.DAY_TRADE;
            bestScore = day;
        }
        if (swing > bestScore) {
            best = TradingStyle.SWING;
            bestScore = swing;
        }

        log.debug("[THRESHOLDS] Style multipliers {} scalp={} day={} swing={} -> {}",
                window, m[0], m[1], m[2], best);

        return StyleScores.builder()
                .scalpScore(scalp)
                .dayTradeScore(day)
                .swingScore(swing)
                .recommendedStyle(best)
                .recommendedStyleScore(bestScore)
                .warnings(warnings)
                .build();
    }

    private static boolean nearKeyLevel(FeatureSnapshot f) {
        if (flag(f, "near_orb_high") || flag(f, "near_orb_low")
                || flag(f, "near_swing_high") || flag(f, "near_swing_low")) {
            return true;
        }
        Double dist = vwapDistancePct(f);
        return dist != null && Math.abs(dist) < 0.25;
    }

    private static Boolean regularHoursFlag(FeatureSnapshot f) {
        return f != null && f.getSession() != null ? f.getSession().getIsRegularHours() : null;
    }

    private static void apply(double[] m, double scalp, double day, double swing) {
        m[0] *= scalp;
        m[1] *= day;
        m[2] *= swing;
    }

    private static double clamp(double v, double lo, double hi) {
        return Math.max(lo, Math.min(hi, v));
    }
}
