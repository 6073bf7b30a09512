package com.kotsin.scanner.model;

/**
 * How a scan call should treat session timing.
 *
 * LIVE applies the market-hours gates. HISTORICAL is used for weekend review and
 * backtests: non-regular-hours snapshots are allowed through and the historical
 * threshold overrides are layered on top.
 */
public enum AnalysisMode {
    LIVE,
    HISTORICAL
}
