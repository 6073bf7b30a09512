package com.kotsin.scanner.threshold;

import com.kotsin.scanner.model.MarketRegime;
import com.kotsin.scanner.model.StrategyCategory;
import com.kotsin.scanner.model.VixLevel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Instant;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AdaptiveThresholdCalculator - time, VIX and regime layers")
class AdaptiveThresholdCalculatorTest {

    private static final Instant MID_MORNING = Instant.parse("2026-03-04T15:00:00Z");
    private static final Instant LUNCH = Instant.parse("2026-03-04T17:00:00Z");
    private static final Instant POWER_HOUR = Instant.parse("2026-03-04T20:30:00Z");
    private static final Instant SATURDAY = Instant.parse("2026-03-07T15:00:00Z");

    private AdaptiveThresholdCalculator calculator;

    @BeforeEach
    void setUp() {
        calculator = new AdaptiveThresholdCalculator();
    }

    @Nested
    @DisplayName("Time windows")
    class TimeWindows {

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource({
                "2026-03-04T13:00:00Z, PRE_MARKET",
                "2026-03-04T14:30:00Z, OPENING_DRIVE",
                "2026-03-04T14:59:59Z, OPENING_DRIVE",
                "2026-03-04T15:00:00Z, MID_MORNING",
                "2026-03-04T17:00:00Z, LUNCH_CHOP",
                "2026-03-04T20:30:00Z, POWER_HOUR",
                "2026-03-04T22:00:00Z, AFTER_HOURS",
                "2026-03-05T02:00:00Z, CLOSED",
                "2026-03-07T15:00:00Z, WEEKEND",
                "2026-07-01T13:30:00Z, OPENING_DRIVE"
        })
        @DisplayName("Should map Eastern Time to the session window")
        void testWindowAt(String instant, TimeWindow expected) {
            assertEquals(expected, TimeWindow.at(Instant.parse(instant)));
        }

        @Test
        @DisplayName("Unknown time should read as closed")
        void testNullTime() {
            assertEquals(TimeWindow.CLOSED, TimeWindow.at(null));
            assertFalse(TimeWindow.CLOSED.isSessionWindow());
            assertTrue(TimeWindow.LUNCH_CHOP.isSessionWindow());
        }
    }

    @Test
    @DisplayName("Neutral context should return the time-window baseline")
    void testBaseline() {
        AdaptiveThresholds t = calculator.compute(MID_MORNING, VixLevel.MEDIUM, MarketRegime.UNKNOWN, StrategyCategory.BREAKOUT);

        assertEquals(72.0, t.getMinBaseScore());
        assertEquals(75.0, t.getMinStyleScore());
        assertEquals(1.5, t.getMinRiskReward());
        assertEquals(1.0, t.getSizeMultiplier());
        assertTrue(t.isStrategyEnabled());
        assertTrue(t.getWarnings().isEmpty());
    }

    @Test
    @DisplayName("High VIX at lunch should raise every threshold and cut size")
    void testLunchHighVix() {
        AdaptiveThresholds t = calculator.compute(LUNCH, VixLevel.HIGH, MarketRegime.UNKNOWN, StrategyCategory.ALL);

        assertEquals(90.0, t.getMinBaseScore());
        assertEquals(93.0, t.getMinStyleScore());
        assertEquals(2.5, t.getMinRiskReward());
        assertEquals(0.42, t.getSizeMultiplier());
        assertTrue(t.getWarnings().stream().anyMatch(w -> w.contains("Very high threshold")));
        assertTrue(t.getWarnings().stream().anyMatch(w -> w.contains("Low position size")));
    }

    @Test
    @DisplayName("Disabled strategy warning should not depend on the default locale")
    void testWarningLocaleIndependent() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            AdaptiveThresholds t = calculator.compute(MID_MORNING, VixLevel.MEDIUM, MarketRegime.RANGING,
                    StrategyCategory.BREAKOUT);

            assertTrue(t.getWarnings().stream()
                            .anyMatch(w -> w.startsWith("breakout strategy not recommended in ranging regime")),
                    t.getWarnings().toString());
        } finally {
            Locale.setDefault(previous);
        }
    }

    @Test
    @DisplayName("Breakouts in a range should be disabled with a +10 penalty")
    void testDisabledStrategy() {
        AdaptiveThresholds t = calculator.compute(MID_MORNING, VixLevel.MEDIUM, MarketRegime.RANGING, StrategyCategory.BREAKOUT);

        assertFalse(t.isStrategyEnabled());
        assertEquals(95.0, t.getMinBaseScore());
        assertEquals(2.0, t.getMinRiskReward());
        assertTrue(t.getStrategyNotes().startsWith("Breakouts fail 70%+ in ranges"));
    }

    @Test
    @DisplayName("Trend continuation in a trend at power hour should be the most permissive")
    void testFavourableContext() {
        AdaptiveThresholds t = calculator.compute(POWER_HOUR, VixLevel.LOW, MarketRegime.TRENDING,
                StrategyCategory.TREND_CONTINUATION);

        assertEquals(63.0, t.getMinBaseScore());
        assertEquals(69.0, t.getMinStyleScore());
        assertEquals(1.2, t.getMinRiskReward());
        assertEquals(1.32, t.getSizeMultiplier());
        assertTrue(t.isStrategyEnabled());
    }

    @Test
    @DisplayName("Weekend should use conservative defaults with a warning")
    void testWeekend() {
        AdaptiveThresholds t = calculator.compute(SATURDAY, null, null, null);

        assertEquals(TimeWindow.WEEKEND, t.getTimeWindow());
        assertEquals(VixLevel.MEDIUM, t.getVixLevel());
        assertEquals(MarketRegime.UNKNOWN, t.getRegime());
        assertEquals(75.0, t.getMinBaseScore());
        assertTrue(t.getWarnings().get(0).startsWith("Outside regular trading hours"));
    }
}
