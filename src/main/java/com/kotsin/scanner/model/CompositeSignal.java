package com.kotsin.scanner.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * CompositeSignal - An emitted detection.
 *
 * Ownership passes to the listeners on emission. The scanner keeps only a
 * deduplication record afterwards.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CompositeSignal {

    private String symbol;

    private String detectorType;

    private Direction direction;

    private AssetClass assetClass;

    /** Weighted confluence score 0-100 */
    private double compositeScore;

    private StyleScores styleScores;

    private RiskReward riskReward;

    /** Advisory confidence 0-100 */
    private double confidence;

    private ConfidenceAssessment confidenceDetail;

    @Builder.Default
    private List<FactorContribution> factors = new ArrayList<>();

    private String barTimeKey;

    /** Bar (event) time the detection belongs to */
    private Instant barTime;

    /** Wall-clock time of emission */
    private Instant detectedAt;

    /** Position size multiplier from the adaptive layer, 1.0 when it is off */
    @Builder.Default
    private double sizeMultiplier = 1.0;

    private String detectorVersion;

    private AnalysisMode analysisMode;

    private boolean filtered;

    @Override
    public String toString() {
        return String.format("CompositeSignal[%s %s %s score=%.1f conf=%.0f key=%s]",
                symbol, detectorType, direction, compositeScore, confidence, barTimeKey);
    }
}
