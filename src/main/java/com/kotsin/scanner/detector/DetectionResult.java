package com.kotsin.scanner.detector;

import com.kotsin.scanner.model.FactorContribution;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Raw confluence score of one detector with its per-factor breakdown.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DetectionResult {
    private String detectorType;
    private double compositeScore;
    @Builder.Default
    private List<FactorContribution> factors = new ArrayList<>();
}
