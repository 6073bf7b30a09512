package com.kotsin.scanner.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One line of a confluence breakdown: factor score and its weighted share.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class FactorContribution {
    private String name;
    private double weight;
    /** Factor score 0-100 */
    private double score;
    /** weight * score */
    private double contribution;
}
