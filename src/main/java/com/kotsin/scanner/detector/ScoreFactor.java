package com.kotsin.scanner.detector;

import com.kotsin.scanner.model.FeatureSnapshot;
import com.kotsin.scanner.model.OptionsChainContext;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * ScoreFactor - Named, weighted scoring function over a snapshot.
 *
 * The evaluator should return a value in [0,100] and handle its own missing
 * inputs. Results are clamped here so a sloppy evaluator can never push a
 * composite score out of range.
 */
@Slf4j
@Getter
public final class ScoreFactor {

    @FunctionalInterface
    public interface Evaluator {
        double evaluate(FeatureSnapshot features, OptionsChainContext options);
    }

    private final String name;
    private final double weight;
    private final Evaluator evaluator;

    private ScoreFactor(String name, double weight, Evaluator evaluator) {
        this.name = name;
        this.weight = weight;
        this.evaluator = evaluator;
    }

    public static ScoreFactor of(String name, double weight, Evaluator evaluator) {
        return new ScoreFactor(name, weight, evaluator);
    }

    /**
     * Evaluate and clamp to [0,100]. NaN and evaluator failures score 0.
     */
    public double evaluate(FeatureSnapshot features, OptionsChainContext options) {
        double value;
        try {
            value = evaluator.evaluate(features, options);
        } catch (RuntimeException e) {
            log.debug("[FACTOR] {} failed for {}: {}", name,
                    features != null ? features.getSymbol() : null, e.toString());
            return 0.0;
        }
        if (Double.isNaN(value)) return 0.0;
        return Math.max(0.0, Math.min(100.0, value));
    }

    @Override
    public String toString() {
        return String.format("ScoreFactor[%s w=%.2f]", name, weight);
    }
}
