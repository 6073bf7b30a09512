package com.kotsin.scanner.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one scanSymbol call. Either at least one signal was emitted, or the
 * result is filtered with the reason of the first rejection.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ScanResult {

    private boolean filtered;

    /** First emitted signal, null when filtered */
    private CompositeSignal signal;

    /** All signals emitted by this call, in registry order */
    @Builder.Default
    private List<CompositeSignal> signals = new ArrayList<>();

    private String filterReason;

    /** Detectors whose gate returned true, regardless of final emission */
    private int detectionCount;

    private long scanTimeMs;

    public static ScanResult emitted(List<CompositeSignal> signals, int detectionCount, long scanTimeMs) {
        return ScanResult.builder()
                .filtered(false)
                .signal(signals.get(0))
                .signals(new ArrayList<>(signals))
                .detectionCount(detectionCount)
                .scanTimeMs(scanTimeMs)
                .build();
    }

    public static ScanResult filtered(String reason, int detectionCount, long scanTimeMs) {
        return ScanResult.builder()
                .filtered(true)
                .filterReason(reason)
                .detectionCount(detectionCount)
                .scanTimeMs(scanTimeMs)
                .build();
    }
}
