package com.kotsin.scanner.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Base score re-weighted for each trading style. The recommended style is the
 * highest scoring one and drives stop/target placement.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class StyleScores {
    private double scalpScore;
    private double dayTradeScore;
    private double swingScore;
    private TradingStyle recommendedStyle;
    private double recommendedStyleScore;

    @Builder.Default
    private List<String> warnings = new ArrayList<>();

    public double scoreFor(TradingStyle style) {
        switch (style) {
            case SCALP:
                return scalpScore;
            case SWING:
                return swingScore;
            default:
                return dayTradeScore;
        }
    }
}
