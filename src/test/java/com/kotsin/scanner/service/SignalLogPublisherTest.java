package com.kotsin.scanner.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kotsin.scanner.model.AssetClass;
import com.kotsin.scanner.model.CompositeSignal;
import com.kotsin.scanner.model.Direction;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("SignalLogPublisher - JSON log sink")
class SignalLogPublisherTest {

    private static CompositeSignal signal() {
        return CompositeSignal.builder()
                .symbol("SPY")
                .detectorType("breakout_bullish")
                .direction(Direction.LONG)
                .assetClass(AssetClass.EQUITY_ETF)
                .compositeScore(89.1)
                .confidence(64.0)
                .barTime(Instant.parse("2026-03-04T15:00:00Z"))
                .build();
    }

    @Test
    @DisplayName("Should count every published signal")
    void testPublish() {
        SignalLogPublisher publisher = new SignalLogPublisher(new ObjectMapper().findAndRegisterModules());

        publisher.onSignal(signal());
        publisher.onSignal(signal());
        publisher.onSignal(null);

        assertEquals(2, publisher.getStats().getTotalPublished());
        assertEquals(0, publisher.getStats().getPublishFailed());
        assertEquals("SignalLogPublisher: 2 published, 0 failed", publisher.getStats().toString());
    }

    @Test
    @DisplayName("Serialization failure should be counted, not thrown")
    void testSerializationFailure() throws JsonProcessingException {
        ObjectMapper mapper = mock(ObjectMapper.class);
        when(mapper.writeValueAsString(any())).thenThrow(new JsonProcessingException("boom") { });
        SignalLogPublisher publisher = new SignalLogPublisher(mapper);

        assertDoesNotThrow(() -> publisher.onSignal(signal()));

        assertEquals(0, publisher.getStats().getTotalPublished());
        assertEquals(1, publisher.getStats().getPublishFailed());
    }
}
