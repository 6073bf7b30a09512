package com.kotsin.scanner.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AssetClass - symbol classification")
class AssetClassTest {

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
            "SPX, INDEX",
            "$NDX, INDEX",
            "I:RUT, INDEX",
            "spy, EQUITY_ETF",
            "QQQ, EQUITY_ETF",
            "XLF, EQUITY_ETF",
            "AAPL, STOCK",
            "TSLA, STOCK"
    })
    @DisplayName("Should classify known tickers")
    void testClassification(String symbol, AssetClass expected) {
        assertEquals(expected, AssetClass.of(symbol));
    }

    @Test
    @DisplayName("Should treat blank or null symbols as stocks")
    void testBlankSymbol() {
        assertEquals(AssetClass.STOCK, AssetClass.of(null));
        assertEquals(AssetClass.STOCK, AssetClass.of("  "));
    }

    @Test
    @DisplayName("Should parse regime and VIX labels leniently")
    void testContextParsing() {
        assertEquals(MarketRegime.TRENDING, MarketRegime.from("trending_down"));
        assertEquals(MarketRegime.RANGING, MarketRegime.from("ranging"));
        assertEquals(MarketRegime.UNKNOWN, MarketRegime.from("sideways"));
        assertEquals(MarketRegime.UNKNOWN, MarketRegime.from(null));

        assertEquals(VixLevel.HIGH, VixLevel.from("high"));
        assertEquals(VixLevel.MEDIUM, VixLevel.from(null));
        assertEquals(VixLevel.MEDIUM, VixLevel.from(42));
    }

    @Test
    @DisplayName("Should derive strategy category from detector type")
    void testCategorize() {
        assertEquals(StrategyCategory.BREAKOUT, StrategyCategory.categorize("kcu_orb_breakout_long"));
        assertEquals(StrategyCategory.MEAN_REVERSION, StrategyCategory.categorize("index_mean_reversion_short"));
        assertEquals(StrategyCategory.GAMMA, StrategyCategory.categorize("gamma_flip_bullish"));
        assertEquals(StrategyCategory.REVERSAL, StrategyCategory.categorize("power_hour_reversal_bullish"));
        assertEquals(StrategyCategory.ALL, StrategyCategory.categorize("sweep_momentum_long"));
    }
}
