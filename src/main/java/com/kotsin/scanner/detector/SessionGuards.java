package com.kotsin.scanner.detector;

import com.kotsin.scanner.model.AnalysisMode;
import com.kotsin.scanner.model.FeatureSnapshot;

/**
 * Session-timing gates shared by detectors.
 */
public final class SessionGuards {

    private SessionGuards() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * An unknown flag counts as regular hours. Only an explicit false means the
     * market is closed, so a feed that omits the flag never disables live detection.
     */
    public static boolean isRegularHours(FeatureSnapshot f) {
        if (f == null || f.getSession() == null) return true;
        Boolean flag = f.getSession().getIsRegularHours();
        return flag == null || flag;
    }

    /**
     * Regular hours, or a scan that explicitly allows closed-market analysis.
     */
    public static boolean marketHoursOk(DetectionContext ctx) {
        return isRegularHours(ctx.getFeatures())
                || ctx.getMode() == AnalysisMode.HISTORICAL
                || ctx.isAllowNonRegularHours();
    }

    /**
     * minutesSinceOpen within [from, to). Unknown session time fails.
     */
    public static boolean inWindow(FeatureSnapshot f, int fromMinute, int toMinute) {
        Integer m = FeatureReader.minutesSinceOpen(f);
        return m != null && m >= fromMinute && m < toMinute;
    }

    /**
     * minutesSinceOpen at least the given minute. Unknown session time passes in
     * historical analysis, where daily bars carry no intraday clock.
     */
    public static boolean atLeastMinutesIn(DetectionContext ctx, int minute) {
        Integer m = FeatureReader.minutesSinceOpen(ctx.getFeatures());
        if (m == null) return ctx.getMode() == AnalysisMode.HISTORICAL;
        return m >= minute;
    }
}
