package com.kotsin.scanner.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Advisory confidence attached to an emitted signal. Never gates emission.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ConfidenceAssessment {

    /** Percent of weighted input data present, 0-100 */
    private int dataCompleteness;

    /** Confidence in the inputs alone, after critical-data caps and completeness bonus */
    private double dataConfidence;

    /** Final confidence 0-100 */
    private double confidence;

    private ConfidenceLevel level;

    @Builder.Default
    private List<String> missingCritical = new ArrayList<>();

    /** Context adjustments applied, e.g. "flow aligned +10" */
    @Builder.Default
    private List<String> adjustments = new ArrayList<>();

    private String summary;
}
