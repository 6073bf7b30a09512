package com.kotsin.scanner.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * FeatureSnapshot - Point-in-time bundle of computed indicators for one symbol.
 *
 * Produced externally once per tick per symbol. The engine only reads it:
 * detectors, factors and the scanner never mutate a snapshot.
 *
 * Every section is optional. A missing section means "unknown", which
 * detectors treat as a failed gate and factors treat as a neutral input.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FeatureSnapshot {

    private String symbol;

    /**
     * Bar time of the snapshot (event time). Cooldowns and bar keys use this, not wall clock.
     */
    private Instant timestamp;

    private Price price;

    private Volume volume;

    private Vwap vwap;

    /**
     * RSI values keyed by period (14 is the canonical one)
     */
    @Builder.Default
    private Map<Integer, Double> rsi = new HashMap<>();

    /**
     * EMA values keyed by period (8, 9, 21, 34, 50 ...)
     */
    @Builder.Default
    private Map<Integer, Double> ema = new HashMap<>();

    /**
     * ATR values keyed by period
     */
    @Builder.Default
    private Map<Integer, Double> atr = new HashMap<>();

    private Session session;

    /**
     * Pattern flags and context values: market_regime, vix_level, breakout_bullish,
     * breakout_bearish, divergence, orbHigh, orbLow, patientCandle ...
     */
    @Builder.Default
    private Map<String, Object> patterns = new HashMap<>();

    /**
     * Options order-flow aggregates, absent when no flow feed is attached
     */
    private Flow flow;

    /**
     * Higher/lower timeframe snapshots keyed by timeframe label ("1m", "5m", "15m", "60m")
     */
    @Builder.Default
    private Map<String, FeatureSnapshot> mtf = new HashMap<>();

    /**
     * Bid/ask spread as a percentage of price
     */
    private Double spreadPct;

    // ======================== SECTIONS ========================

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Price {
        private Double current;
        private Double open;
        private Double high;
        private Double low;
        private Double prevClose;
        /** Close of the previous bar */
        private Double prev;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Volume {
        private Double current;
        private Double avg;
        /** RVOL: current volume / average volume baseline */
        private Double relativeToAvg;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Vwap {
        private Double value;
        /** Percent deviation of price from VWAP, positive above */
        private Double distancePct;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Session {
        private Integer minutesSinceOpen;
        /** Null means unknown and is read as regular hours */
        private Boolean isRegularHours;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Flow {
        /** Institutional conviction 0-100 */
        private Double flowScore;
        /** bullish / bearish / neutral */
        private String flowBias;
        private Integer sweepCount;
        private Integer blockCount;
        /** Percent of premium on the buy side 0-100 */
        private Double buyPressure;
        private Double largeTradePercentage;
        /** PASSIVE / NORMAL / AGGRESSIVE / VERY_AGGRESSIVE */
        private String aggressiveness;
        private Double putCallRatio;
    }
}
