package com.kotsin.scanner.monitoring;

import com.kotsin.scanner.dedup.DeduplicationStats;
import com.kotsin.scanner.service.CompositeScanner;
import com.kotsin.scanner.service.ScannerStats;
import com.kotsin.scanner.service.SignalLogPublisher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic scanner statistics report.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(value = "scanner.monitor.enabled", havingValue = "true", matchIfMissing = true)
public class ScannerMonitor {

    private final CompositeScanner scanner;
    private final SignalLogPublisher publisher;

    @Scheduled(fixedRateString = "${scanner.monitor.report-interval-ms:60000}")
    public void reportMetrics() {
        ScannerStats stats = scanner.getStats();
        DeduplicationStats dedup = scanner.getDeduplicationStats();

        log.info("[MONITOR] {}", stats);
        log.info("[MONITOR] {}", dedup);
        log.info("[MONITOR] {}", publisher.getStats());

        if (stats.getDetectorErrors() > 0) {
            log.warn("[MONITOR] {} detector evaluations failed since startup", stats.getDetectorErrors());
        }
    }
}
