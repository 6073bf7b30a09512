package com.kotsin.scanner.dedup;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Snapshot of the deduplication store for dashboards.
 * Ages are in milliseconds relative to the time passed to getStats, null when empty.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeduplicationStats {
    private long totalSignals;
    private int uniqueSymbols;
    private Long oldestSignalAgeMs;
    private Long newestSignalAgeMs;

    @Override
    public String toString() {
        return String.format("DedupStats[signals=%d symbols=%d oldestAge=%sms newestAge=%sms]",
                totalSignals, uniqueSymbols, oldestSignalAgeMs, newestSignalAgeMs);
    }
}
