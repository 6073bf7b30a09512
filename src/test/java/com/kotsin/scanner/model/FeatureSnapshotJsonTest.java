package com.kotsin.scanner.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kotsin.scanner.detector.FeatureReader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.InputStream;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("FeatureSnapshot - JSON shape from the external feature builder")
class FeatureSnapshotJsonTest {

    private ObjectMapper mapper;

    @BeforeEach
    void setUp() {
        mapper = new ObjectMapper().findAndRegisterModules();
    }

    private FeatureSnapshot load() throws Exception {
        try (InputStream in = getClass().getResourceAsStream("/fixtures/spy-breakout.json")) {
            assertNotNull(in, "fixture missing");
            return mapper.readValue(in, FeatureSnapshot.class);
        }
    }

    @Test
    @DisplayName("Should read every section of the fixture")
    void testDeserialize() throws Exception {
        FeatureSnapshot f = load();

        assertEquals("SPY", f.getSymbol());
        assertEquals(Instant.parse("2026-03-04T15:00:00Z"), f.getTimestamp());
        assertEquals(500.0, FeatureReader.price(f), 1e-9);
        assertEquals(2.5, FeatureReader.rvol(f), 1e-9);
        assertEquals(1.2, FeatureReader.vwapDistancePct(f), 1e-9);
        assertEquals(65.0, FeatureReader.rsi(f), 1e-9);
        assertEquals(470.0, FeatureReader.ema(f, 21), 1e-9);
        assertEquals(3.0, FeatureReader.atr(f), 1e-9);
        assertEquals(Integer.valueOf(30), FeatureReader.minutesSinceOpen(f));
        assertTrue(f.getSession().getIsRegularHours());
        assertTrue(FeatureReader.flag(f, "breakout_bullish"));
        assertEquals(MarketRegime.TRENDING, FeatureReader.regime(f));
        assertEquals(VixLevel.LOW, FeatureReader.vix(f));
        assertTrue(FeatureReader.flowBias(f, Direction.LONG));
        assertEquals(Integer.valueOf(4), f.getFlow().getSweepCount());
    }

    @Test
    @DisplayName("Should ignore unknown fields from newer feature builders")
    void testUnknownFieldsIgnored() {
        assertDoesNotThrow(this::load);
    }

    @Test
    @DisplayName("Should treat absent sections as unknown")
    void testMissingSections() throws Exception {
        FeatureSnapshot f = mapper.readValue("{\"symbol\":\"AAPL\"}", FeatureSnapshot.class);

        assertNull(FeatureReader.price(f));
        assertNull(FeatureReader.rvol(f));
        assertNull(FeatureReader.rsi(f));
        assertNull(FeatureReader.atr(f));
        assertEquals(MarketRegime.UNKNOWN, FeatureReader.regime(f));
    }

    @Test
    @DisplayName("Should serialize emitted signals without nulls")
    void testSignalSerialization() throws Exception {
        CompositeSignal signal = CompositeSignal.builder()
                .symbol("SPY")
                .detectorType("breakout_bullish")
                .direction(Direction.LONG)
                .compositeScore(88.5)
                .barTime(Instant.parse("2026-03-04T15:00:00Z"))
                .build();

        String json = mapper.writeValueAsString(signal);

        assertTrue(json.contains("\"detectorType\":\"breakout_bullish\""));
        assertFalse(json.contains("riskReward"));
        CompositeSignal back = mapper.readValue(json, CompositeSignal.class);
        assertEquals(signal.getBarTime(), back.getBarTime());
    }
}
