package com.kotsin.scanner.service;

import com.kotsin.scanner.config.ScannerConfig;
import com.kotsin.scanner.detector.FeatureReader;
import com.kotsin.scanner.detector.SessionGuards;
import com.kotsin.scanner.model.AnalysisMode;
import com.kotsin.scanner.model.FeatureSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;

/**
 * Symbol-level filters applied before any detector runs. The first failing
 * filter short-circuits with its reason.
 *
 * Order: blacklist, market hours, relative volume, spread, liquidity.
 * RVOL and spread checks are skipped when the snapshot does not carry them.
 */
@Slf4j
@Component
public class UniversalFilters {

    public static final String REASON_PREFIX = "Failed universal filters: ";

    /**
     * @return the failure reason, or empty when the symbol may be scanned
     */
    public Optional<String> check(String symbol, FeatureSnapshot features, ScannerConfig config, AnalysisMode mode) {
        ScannerConfig.Filters filters = config.getFilters();

        if (isBlacklisted(symbol, filters)) {
            return fail(symbol, "blacklist");
        }

        if (filters.isMarketHoursOnly()
                && !SessionGuards.isRegularHours(features)
                && mode != AnalysisMode.HISTORICAL
                && !filters.isAllowNonRegularHours()) {
            return fail(symbol, "market hours (outside regular session)");
        }

        Double rvol = FeatureReader.rvol(features);
        if (rvol != null && rvol < filters.getMinRvol()) {
            return fail(symbol, String.format("relative volume %.2f < %.2f", rvol, filters.getMinRvol()));
        }

        Double spread = features != null ? features.getSpreadPct() : null;
        if (spread != null && spread > filters.getMaxSpreadPct()) {
            return fail(symbol, String.format("spread %.2f%% > %.2f%%", spread, filters.getMaxSpreadPct()));
        }

        if (filters.isRequireMinimumLiquidity()) {
            Double avgVolume = FeatureReader.avgVolume(features);
            if (avgVolume == null || avgVolume < filters.getMinAvgVolume()) {
                return fail(symbol, String.format("liquidity (avg volume %s < %.0f)",
                        avgVolume == null ? "unknown" : String.format("%.0f", avgVolume),
                        filters.getMinAvgVolume()));
            }
        }

        return Optional.empty();
    }

    private static boolean isBlacklisted(String symbol, ScannerConfig.Filters filters) {
        if (symbol == null || filters.getBlacklist() == null) return false;
        String s = symbol.trim().toUpperCase(Locale.ROOT);
        for (String entry : filters.getBlacklist()) {
            if (entry != null && entry.trim().toUpperCase(Locale.ROOT).equals(s)) {
                return true;
            }
        }
        return false;
    }

    private static Optional<String> fail(String symbol, String category) {
        log.debug("[SCANNER] {} failed universal filter: {}", symbol, category);
        return Optional.of(REASON_PREFIX + category);
    }
}
