package com.kotsin.scanner.detector;

import com.kotsin.scanner.model.AnalysisMode;
import com.kotsin.scanner.model.FeatureSnapshot;
import com.kotsin.scanner.model.OptionsChainContext;
import lombok.Getter;

/**
 * Inputs handed to a detector gate: the snapshot, the optional options context
 * and the session policy of the current scan.
 */
@Getter
public final class DetectionContext {

    private final FeatureSnapshot features;
    private final OptionsChainContext options;
    private final AnalysisMode mode;
    private final boolean allowNonRegularHours;

    private DetectionContext(FeatureSnapshot features, OptionsChainContext options,
                             AnalysisMode mode, boolean allowNonRegularHours) {
        this.features = features;
        this.options = options;
        this.mode = mode != null ? mode : AnalysisMode.LIVE;
        this.allowNonRegularHours = allowNonRegularHours;
    }

    public static DetectionContext of(FeatureSnapshot features, OptionsChainContext options,
                                      AnalysisMode mode, boolean allowNonRegularHours) {
        return new DetectionContext(features, options, mode, allowNonRegularHours);
    }

    public static DetectionContext live(FeatureSnapshot features, OptionsChainContext options) {
        return new DetectionContext(features, options, AnalysisMode.LIVE, false);
    }

    public boolean hasOptions() {
        return options != null;
    }

    public String symbol() {
        return features != null ? features.getSymbol() : null;
    }
}
