package com.kotsin.scanner.dedup;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Lightweight trace of an emitted signal. The full signal is not retained.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeduplicationRecord {
    private String symbol;
    private String detectorType;
    private String barTimeKey;

    /** Event time of the bar that produced the signal */
    private Instant emittedAt;
}
