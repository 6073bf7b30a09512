package com.kotsin.scanner.detector;

import com.kotsin.scanner.model.AssetClass;
import com.kotsin.scanner.model.Direction;
import com.kotsin.scanner.model.FeatureSnapshot;
import com.kotsin.scanner.model.OptionsChainContext;
import com.kotsin.scanner.support.FeatureSnapshots;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DetectorRegistry - catalogue invariants and queries")
class DetectorRegistryTest {

    private DetectorRegistry registry;

    @BeforeEach
    void setUp() {
        registry = DetectorRegistry.standard();
    }

    // ========== CATALOGUE ==========

    @Nested
    @DisplayName("Catalogue")
    class Catalogue {

        @Test
        @DisplayName("Should register all 31 detectors")
        void testSize() {
            assertEquals(31, registry.size());
            assertEquals(31, registry.all().size());
        }

        @Test
        @DisplayName("Every detector's weights should sum to 1.0 within tolerance")
        void testWeightSums() {
            for (OpportunityDetector d : registry.all()) {
                assertEquals(1.0, d.totalWeight(), 0.02, d.getType());
                for (ScoreFactor factor : d.getScoreFactors()) {
                    assertTrue(factor.getWeight() > 0 && factor.getWeight() <= 1.0,
                            d.getType() + "." + factor.getName());
                }
            }
        }

        @Test
        @DisplayName("Detector types should be unique and findable")
        void testUniqueTypes() {
            Set<String> types = new HashSet<>();
            for (OpportunityDetector d : registry.all()) {
                assertTrue(types.add(d.getType()), "duplicate " + d.getType());
                assertSame(d, registry.find(d.getType()).orElseThrow());
            }
            assertTrue(registry.find("no_such_detector").isEmpty());
            assertTrue(registry.find(null).isEmpty());
        }

        @Test
        @DisplayName("Standard registry should be rebuilt, not shared")
        void testStandardIsFresh() {
            assertNotSame(registry, DetectorRegistry.standard());
            assertEquals(31, DetectorRegistry.standard().size());
        }
    }

    // ========== QUERIES ==========

    @Nested
    @DisplayName("Queries")
    class Queries {

        @Test
        @DisplayName("Equity-only and index-only subsets should match the catalogues")
        void testSubsets() {
            assertEquals(6, registry.equityOnly().size());
            assertEquals(11, registry.indexOnly().size());
            assertEquals(5, registry.optionsDependent().size());
            assertEquals(4, registry.flowPrimary().size());
            assertEquals(26, registry.backtestable().size());

            registry.equityOnly().forEach(d -> assertFalse(d.appliesTo(AssetClass.INDEX), d.getType()));
            registry.indexOnly().forEach(d -> assertFalse(d.appliesTo(AssetClass.STOCK), d.getType()));
            registry.backtestable().forEach(d -> assertFalse(d.isRequiresOptionsData(), d.getType()));
        }

        @Test
        @DisplayName("Options-dependent detectors should be excluded without an options context")
        void testForAssetClass() {
            List<OpportunityDetector> withoutOptions = registry.forAssetClass(AssetClass.INDEX, false);
            List<OpportunityDetector> withOptions = registry.forAssetClass(AssetClass.INDEX, true);

            assertEquals(withOptions.size() - 5, withoutOptions.size());
            withoutOptions.forEach(d -> assertFalse(d.isRequiresOptionsData(), d.getType()));
            registry.forAssetClass(AssetClass.STOCK, true)
                    .forEach(d -> assertTrue(d.appliesTo(AssetClass.STOCK), d.getType()));
            assertEquals(20, registry.forAssetClass(AssetClass.EQUITY_ETF, false).size());
        }
    }

    // ========== REGISTRATION ==========

    @Nested
    @DisplayName("Registration invariants")
    class Registration {

        private OpportunityDetector.OpportunityDetectorBuilder valid() {
            return OpportunityDetector.builder()
                    .type("custom_long")
                    .direction(Direction.LONG)
                    .assetClass(AssetClass.STOCK)
                    .gate(ctx -> true)
                    .scoreFactor(ScoreFactor.of("a", 0.5, (f, o) -> 50))
                    .scoreFactor(ScoreFactor.of("b", 0.5, (f, o) -> 50));
        }

        @Test
        @DisplayName("Should accept a well-formed detector")
        void testValid() {
            DetectorRegistry empty = new DetectorRegistry();
            empty.register(valid().build());
            assertEquals(1, empty.size());
        }

        @Test
        @DisplayName("Should reject a duplicate type")
        void testDuplicate() {
            OpportunityDetector copy = valid().type("breakout_bullish").build();
            assertThrows(IllegalStateException.class, () -> registry.register(copy));
        }

        @Test
        @DisplayName("Should reject weights far from 1.0")
        void testWeightSum() {
            OpportunityDetector light = valid().clearScoreFactors()
                    .scoreFactor(ScoreFactor.of("a", 0.5, (f, o) -> 50))
                    .scoreFactor(ScoreFactor.of("b", 0.3, (f, o) -> 50))
                    .build();
            IllegalStateException e = assertThrows(IllegalStateException.class,
                    () -> new DetectorRegistry().register(light));
            assertTrue(e.getMessage().contains("weights sum to 0.800"));
        }

        @Test
        @DisplayName("Should accept a sum inside the rounding tolerance")
        void testWeightTolerance() {
            OpportunityDetector rounded = valid().clearScoreFactors()
                    .scoreFactor(ScoreFactor.of("a", 0.33, (f, o) -> 50))
                    .scoreFactor(ScoreFactor.of("b", 0.33, (f, o) -> 50))
                    .scoreFactor(ScoreFactor.of("c", 0.33, (f, o) -> 50))
                    .build();
            assertDoesNotThrow(() -> new DetectorRegistry().register(rounded));
        }

        @Test
        @DisplayName("Should reject a weight outside (0,1]")
        void testWeightRange() {
            OpportunityDetector negative = valid().clearScoreFactors()
                    .scoreFactor(ScoreFactor.of("a", 1.2, (f, o) -> 50))
                    .scoreFactor(ScoreFactor.of("b", -0.2, (f, o) -> 50))
                    .build();
            assertThrows(IllegalStateException.class, () -> new DetectorRegistry().register(negative));
        }

        @Test
        @DisplayName("Should reject missing gate, direction, asset classes or factors")
        void testMissingParts() {
            DetectorRegistry empty = new DetectorRegistry();
            assertThrows(IllegalStateException.class, () -> empty.register(null));
            assertThrows(IllegalStateException.class, () -> empty.register(valid().gate(null).build()));
            assertThrows(IllegalStateException.class, () -> empty.register(valid().direction(null).build()));
            assertThrows(IllegalStateException.class, () -> empty.register(valid().type(" ").build()));
            assertThrows(IllegalStateException.class, () -> empty.register(valid().clearAssetClasses().build()));
            assertThrows(IllegalStateException.class, () -> empty.register(valid().clearScoreFactors().build()));
            assertEquals(0, empty.size());
        }
    }

    // ========== PROPERTIES ==========

    @Nested
    @DisplayName("Properties over random snapshots")
    class Properties {

        private static final int SAMPLES = 500;

        @Test
        @DisplayName("Scores should stay within [0,100] for any input")
        void testScoreRange() {
            Random random = new Random(42);
            for (int i = 0; i < SAMPLES; i++) {
                FeatureSnapshot f = randomSnapshot(random);
                OptionsChainContext o = random.nextBoolean() ? randomOptions(random, f) : null;
                for (OpportunityDetector d : registry.all()) {
                    double score = d.score(f, o).getCompositeScore();
                    assertTrue(score >= 0 && score <= 100, d.getType() + " scored " + score);
                }
            }
        }

        @Test
        @DisplayName("Gates should never throw and should reject closed-market snapshots in live mode")
        void testClosedMarketNeverDetects() {
            Random random = new Random(7);
            for (int i = 0; i < SAMPLES; i++) {
                FeatureSnapshot f = randomSnapshot(random).toBuilder()
                        .session(FeatureSnapshot.Session.builder()
                                .minutesSinceOpen(random.nextInt(390))
                                .isRegularHours(false)
                                .build())
                        .build();
                OptionsChainContext o = randomOptions(random, f);
                for (OpportunityDetector d : registry.all()) {
                    assertFalse(d.detect(DetectionContext.live(f, o)), d.getType());
                }
            }
        }

        @Test
        @DisplayName("Gates should reject an empty snapshot")
        void testEmptySnapshotNeverDetects() {
            FeatureSnapshot empty = FeatureSnapshot.builder().symbol("AAPL").build();
            for (OpportunityDetector d : registry.all()) {
                assertFalse(d.detect(empty, null), d.getType());
            }
        }

        private FeatureSnapshot randomSnapshot(Random r) {
            double price = 20 + r.nextDouble() * 600;
            double vwap = price * (1 + (r.nextDouble() - 0.5) * 0.06);
            Map<String, Object> patterns = new HashMap<>();
            patterns.put("breakout_bullish", r.nextBoolean());
            patterns.put("breakout_bearish", r.nextBoolean());
            patterns.put("patientCandle", r.nextBoolean());
            patterns.put("orbHigh", price * (1 + (r.nextDouble() - 0.5) * 0.02));
            patterns.put("orbLow", price * (1 - r.nextDouble() * 0.02));
            patterns.put("market_regime", pick(r, "trending", "ranging", "choppy", "volatile", "unknown"));
            patterns.put("vix_level", pick(r, "low", "medium", "high", "extreme"));

            Map<Integer, Double> ema = new HashMap<>();
            ema.put(8, price * (1 + (r.nextDouble() - 0.5) * 0.02));
            ema.put(21, price * (1 + (r.nextDouble() - 0.5) * 0.04));
            ema.put(34, price * (1 + (r.nextDouble() - 0.5) * 0.05));
            ema.put(50, price * (1 + (r.nextDouble() - 0.5) * 0.06));

            return FeatureSnapshot.builder()
                    .symbol("RND")
                    .timestamp(Instant.parse("2026-03-04T14:30:00Z").plusSeconds(r.nextInt(6 * 3600)))
                    .price(FeatureSnapshot.Price.builder()
                            .current(price)
                            .open(price * (1 + (r.nextDouble() - 0.5) * 0.02))
                            .high(price * (1 + r.nextDouble() * 0.01))
                            .low(price * (1 - r.nextDouble() * 0.01))
                            .prev(price * (1 + (r.nextDouble() - 0.5) * 0.01))
                            .prevClose(price * (1 + (r.nextDouble() - 0.5) * 0.03))
                            .build())
                    .volume(r.nextInt(5) == 0 ? null : FeatureSnapshot.Volume.builder()
                            .relativeToAvg(r.nextDouble() * 4).avg(1e6).current(1e6).build())
                    .vwap(FeatureSnapshot.Vwap.builder().value(vwap).build())
                    .rsi(FeatureSnapshots.map(14, r.nextDouble() * 100))
                    .ema(ema)
                    .atr(FeatureSnapshots.map(14, price * r.nextDouble() * 0.03))
                    .session(FeatureSnapshot.Session.builder()
                            .minutesSinceOpen(r.nextInt(390)).isRegularHours(true).build())
                    .patterns(patterns)
                    .flow(r.nextBoolean() ? null : FeatureSnapshot.Flow.builder()
                            .flowScore(r.nextDouble() * 100)
                            .flowBias(pick(r, "bullish", "bearish", "neutral"))
                            .sweepCount(r.nextInt(12))
                            .blockCount(r.nextInt(6))
                            .buyPressure(r.nextDouble() * 100)
                            .largeTradePercentage(r.nextDouble() * 60)
                            .aggressiveness(pick(r, "PASSIVE", "NORMAL", "AGGRESSIVE", "VERY_AGGRESSIVE"))
                            .build())
                    .build();
        }

        private OptionsChainContext randomOptions(Random r, FeatureSnapshot f) {
            double price = f.getPrice().getCurrent();
            TreeMap<Double, Long> oi = new TreeMap<>();
            for (int i = -5; i <= 5; i++) {
                oi.put(Math.round(price * (1 + i * 0.0025)) * 1.0, (long) r.nextInt(100_000));
            }
            return OptionsChainContext.builder()
                    .dealerNetGamma((r.nextDouble() - 0.5) * 1e10)
                    .gammaFlipLevel(price * (1 + (r.nextDouble() - 0.5) * 0.01))
                    .callWallStrike(price * (1 + r.nextDouble() * 0.02))
                    .putWallStrike(price * (1 - r.nextDouble() * 0.02))
                    .maxGammaStrike(price * (1 + (r.nextDouble() - 0.5) * 0.02))
                    .maxPainStrike(price * (1 + (r.nextDouble() - 0.5) * 0.01))
                    .openInterestByStrike(oi)
                    .zeroDte(r.nextBoolean())
                    .minutesToExpiry(r.nextInt(600))
                    .build();
        }

        private String pick(Random r, String... values) {
            return values[r.nextInt(values.length)];
        }
    }
}
