package com.kotsin.scanner.service;

import com.kotsin.scanner.model.AnalysisMode;
import com.kotsin.scanner.model.FeatureSnapshot;
import com.kotsin.scanner.model.OptionsChainContext;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One entry of a batch scan.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScanRequest {
    private String symbol;
    private FeatureSnapshot features;

    /** Null when no options chain is available for the symbol */
    private OptionsChainContext options;

    @Builder.Default
    private AnalysisMode mode = AnalysisMode.LIVE;

    public static ScanRequest of(String symbol, FeatureSnapshot features) {
        return ScanRequest.builder().symbol(symbol).features(features).build();
    }
}
