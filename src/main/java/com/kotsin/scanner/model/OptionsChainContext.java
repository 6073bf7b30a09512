package com.kotsin.scanner.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * OptionsChainContext - Dealer positioning derived from the options chain.
 *
 * Supplied only for symbols where an options provider is attached. Detectors that
 * declare {@code requiresOptionsData} never run without it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class OptionsChainContext {

    /**
     * Dealer net gamma exposure. Negative = dealers short gamma (hedging amplifies moves),
     * positive = dealers long gamma (hedging dampens moves, price pins).
     */
    private Double dealerNetGamma;

    /**
     * Price where dealer net gamma changes sign
     */
    private Double gammaFlipLevel;

    private Double maxGammaStrike;

    private Double maxPainStrike;

    /** Strike with the largest call open interest above price */
    private Double callWallStrike;

    /** Strike with the largest put open interest below price */
    private Double putWallStrike;

    @Builder.Default
    private NavigableMap<Double, Long> openInterestByStrike = new TreeMap<>();

    private Integer minutesToExpiry;

    private boolean zeroDte;

    private Double putCallRatio;

    /**
     * Open interest at an exact strike, 0 when the strike is not listed.
     */
    public long openInterestAt(double strike) {
        if (openInterestByStrike == null) return 0L;
        Long oi = openInterestByStrike.get(strike);
        return oi != null ? oi : 0L;
    }

    /**
     * Total open interest for strikes within +/- band of a price.
     */
    public long openInterestNear(double price, double band) {
        if (openInterestByStrike == null || openInterestByStrike.isEmpty()) return 0L;
        long total = 0;
        for (Map.Entry<Double, Long> e : openInterestByStrike.subMap(price - band, true, price + band, true).entrySet()) {
            total += e.getValue() != null ? e.getValue() : 0L;
        }
        return total;
    }

    public boolean isDealerShortGamma() {
        return dealerNetGamma != null && dealerNetGamma < 0;
    }

    public boolean isDealerLongGamma() {
        return dealerNetGamma != null && dealerNetGamma > 0;
    }
}
