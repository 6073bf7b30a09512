package com.kotsin.scanner.threshold;

import com.kotsin.scanner.model.ConfidenceAssessment;
import com.kotsin.scanner.model.ConfidenceLevel;
import com.kotsin.scanner.model.Direction;
import com.kotsin.scanner.model.FeatureSnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Locale;

import static com.kotsin.scanner.support.FeatureSnapshots.spyBreakout;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ConfidenceScorer - data quality and context confidence")
class ConfidenceScorerTest {

    private static final double SCORE = 89.075;

    private ConfidenceScorer scorer;

    @BeforeEach
    void setUp() {
        scorer = new ConfidenceScorer();
    }

    private static FeatureSnapshot.Flow flow(double score, String bias) {
        return FeatureSnapshot.Flow.builder().flowScore(score).flowBias(bias).build();
    }

    @Test
    @DisplayName("Core price, volume and indicator data should give 72% completeness")
    void testCoreDataOnly() {
        ConfidenceAssessment a = scorer.assess(spyBreakout(), Direction.LONG, SCORE);

        assertEquals(72, a.getDataCompleteness());
        assertEquals(72.0, a.getDataConfidence(), 1e-9);
        assertEquals(SCORE * 72.0 / 100.0, a.getConfidence(), 1e-9);
        assertEquals(ConfidenceLevel.MEDIUM, a.getLevel());
        assertTrue(a.getMissingCritical().isEmpty());
        assertTrue(a.getAdjustments().isEmpty());
    }

    @Test
    @DisplayName("Strongly aligned flow should add data and a +10 bonus")
    void testAlignedFlow() {
        FeatureSnapshot f = spyBreakout().toBuilder().flow(flow(72.0, "bullish")).build();

        ConfidenceAssessment a = scorer.assess(f, Direction.LONG, SCORE);

        assertEquals(81, a.getDataCompleteness());
        assertEquals(List.of("flow strongly aligned +10"), a.getAdjustments());
        assertEquals(SCORE * 81.0 / 100.0 + 10, a.getConfidence(), 1e-9);
        assertEquals(ConfidenceLevel.HIGH, a.getLevel());
    }

    @Test
    @DisplayName("Weakly aligned flow should add +5, opposed flow should subtract 10")
    void testFlowDirection() {
        FeatureSnapshot weak = spyBreakout().toBuilder().flow(flow(55.0, "bullish")).build();
        FeatureSnapshot opposed = spyBreakout().toBuilder().flow(flow(80.0, "bearish")).build();

        assertEquals(List.of("flow aligned +5"), scorer.assess(weak, Direction.LONG, SCORE).getAdjustments());
        assertEquals(List.of("flow opposed -10"), scorer.assess(opposed, Direction.LONG, SCORE).getAdjustments());
        assertEquals(List.of("flow strongly aligned +10"),
                scorer.assess(opposed, Direction.SHORT, SCORE).getAdjustments());
    }

    @Test
    @DisplayName("Volatile regime and extreme VIX should each cost 10")
    void testHostileContext() {
        FeatureSnapshot f = spyBreakout();
        f.getPatterns().put("market_regime", "volatile");
        f.getPatterns().put("vix_level", "extreme");

        ConfidenceAssessment a = scorer.assess(f, Direction.LONG, SCORE);

        assertEquals(79, a.getDataCompleteness());
        assertEquals(List.of("volatile regime -10", "extreme VIX -10"), a.getAdjustments());
        assertEquals(SCORE * 79.0 / 100.0 - 20, a.getConfidence(), 1e-9);
        assertTrue(a.getSummary().contains("data 79% complete"));
    }

    @Test
    @DisplayName("Empty snapshot should report every critical input missing")
    void testEmptySnapshot() {
        ConfidenceAssessment a = scorer.assess(FeatureSnapshot.builder().symbol("SPY").build(), Direction.LONG, SCORE);

        assertEquals(0, a.getDataCompleteness());
        assertEquals(List.of("price", "volume", "atr"), a.getMissingCritical());
        assertEquals(0.0, a.getConfidence(), 1e-9);
        assertEquals(ConfidenceLevel.VERY_LOW, a.getLevel());
        assertTrue(a.getSummary().contains("missing price/volume/atr"));
    }

    @Test
    @DisplayName("Missing critical names should not depend on the default locale")
    void testMissingCriticalLocaleIndependent() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            ConfidenceAssessment a = scorer.assess(FeatureSnapshot.builder().symbol("SPY").build(), Direction.LONG, SCORE);

            assertEquals(List.of("price", "volume", "atr"), a.getMissingCritical());
        } finally {
            Locale.setDefault(previous);
        }
    }

    @Test
    @DisplayName("Each missing critical input should cost 15 points of ceiling")
    void testCriticalPenalty() {
        FeatureSnapshot f = spyBreakout().toBuilder().atr(null).build();

        ConfidenceAssessment a = scorer.assess(f, Direction.LONG, SCORE);

        assertEquals(List.of("atr"), a.getMissingCritical());
        // 86 of 134 weight present
        assertEquals(64, a.getDataCompleteness());
        assertEquals(85.0 * 64 / 100.0 - 10, a.getDataConfidence(), 1e-9);
    }
}
