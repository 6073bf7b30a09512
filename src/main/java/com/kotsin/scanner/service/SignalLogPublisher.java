package com.kotsin.scanner.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kotsin.scanner.model.CompositeSignal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

/**
 * SignalLogPublisher - Default signal sink: one JSON line per emitted signal.
 *
 * Serialization failures are counted and logged, never thrown back into the scan.
 */
@Slf4j
@Component
public class SignalLogPublisher implements CompositeSignalListener {

    private final ObjectMapper objectMapper;

    // Statistics
    private final AtomicLong totalPublished = new AtomicLong(0);
    private final AtomicLong publishFailed = new AtomicLong(0);

    public SignalLogPublisher(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void onSignal(CompositeSignal signal) {
        if (signal == null) {
            return;
        }
        try {
            String payload = objectMapper.writeValueAsString(signal);
            totalPublished.incrementAndGet();
            log.info("[SIGNAL_PUB] {} {} {} score={} confidence={} | {}",
                    signal.getSymbol(), signal.getDetectorType(), signal.getDirection(),
                    String.format("%.1f", signal.getCompositeScore()),
                    String.format("%.0f", signal.getConfidence()), payload);
        } catch (JsonProcessingException e) {
            publishFailed.incrementAndGet();
            log.error("[SIGNAL_PUB] Failed to serialize signal {} {}: {}",
                    signal.getSymbol(), signal.getDetectorType(), e.getMessage());
        }
    }

    public PublisherStats getStats() {
        return PublisherStats.builder()
                .totalPublished(totalPublished.get())
                .publishFailed(publishFailed.get())
                .build();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PublisherStats {
        private long totalPublished;
        private long publishFailed;

        @Override
        public String toString() {
            return String.format("SignalLogPublisher: %d published, %d failed", totalPublished, publishFailed);
        }
    }
}
