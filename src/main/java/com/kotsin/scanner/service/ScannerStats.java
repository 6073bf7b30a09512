package com.kotsin.scanner.service;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScannerStats {
    private long totalScans;
    private long totalSignals;
    private long totalFiltered;

    /** Detector evaluations that threw and were skipped */
    private long detectorErrors;

    private Map<String, Long> signalsByType;
    private Map<String, Long> signalsBySymbol;

    public double getEmissionRate() {
        return totalScans > 0 ? (double) (totalScans - totalFiltered) / totalScans * 100 : 0;
    }

    @Override
    public String toString() {
        return String.format("CompositeScanner: %d scans, %d signals, %d filtered, %d detector errors (%.1f%% emitting)",
                totalScans, totalSignals, totalFiltered, detectorErrors, getEmissionRate());
    }
}
