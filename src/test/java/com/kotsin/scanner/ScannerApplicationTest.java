package com.kotsin.scanner;

import com.kotsin.scanner.config.ScannerConfig;
import com.kotsin.scanner.dedup.RateCapScope;
import com.kotsin.scanner.detector.DetectorRegistry;
import com.kotsin.scanner.model.AssetClass;
import com.kotsin.scanner.service.CompositeScanner;
import com.kotsin.scanner.service.SignalLogPublisher;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static com.kotsin.scanner.support.FeatureSnapshots.spyBreakout;
import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = "scanner.monitor.enabled=false")
@DisplayName("ScannerApplication - context wiring and config binding")
class ScannerApplicationTest {

    @Autowired
    private ScannerConfig config;

    @Autowired
    private DetectorRegistry registry;

    @Autowired
    private CompositeScanner scanner;

    @Autowired
    private SignalLogPublisher publisher;

    @Test
    @DisplayName("Should bind layered thresholds from application.yml")
    void testConfigBinding() {
        assertEquals(80.0, config.getThresholds().getMinBaseScore(), 1e-9);
        assertEquals(85.0, config.getAssetClassThresholds().get(AssetClass.INDEX).getMinBaseScore(), 1e-9);
        assertEquals(Integer.valueOf(20), config.getAssetClassThresholds().get(AssetClass.INDEX).getCooldownMinutes());
        assertNull(config.getAssetClassThresholds().get(AssetClass.EQUITY_ETF).getCooldownMinutes());
        assertEquals(Integer.valueOf(45), config.getDetectorThresholds().get("gamma_squeeze_bullish").getCooldownMinutes());
        assertEquals(Integer.valueOf(120), config.getDetectorThresholds().get("eod_pin_setup").getCooldownMinutes());
        assertEquals(RateCapScope.SYMBOL_DETECTOR, config.getRateCapScope());
        assertFalse(config.getAdaptive().isEnabled());
    }

    @Test
    @DisplayName("Should register the full detector catalogue")
    void testRegistry() {
        assertEquals(31, registry.size());
    }

    @Test
    @DisplayName("Emitted signals should reach the log publisher")
    void testPublisherWired() {
        scanner.clearDeduplication();
        long before = publisher.getStats().getTotalPublished();

        assertFalse(scanner.scanSymbol("SPY", spyBreakout()).isFiltered());

        assertEquals(before + 1, publisher.getStats().getTotalPublished());
    }
}
