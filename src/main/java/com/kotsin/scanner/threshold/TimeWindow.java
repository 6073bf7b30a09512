package com.kotsin.scanner.threshold;

import com.kotsin.scanner.config.ScannerConstants;
import lombok.Getter;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.ZonedDateTime;

/**
 * Time-of-day windows of the US equity session (Eastern Time), with the
 * baseline thresholds and position size each window warrants.
 *
 * Windows are half-open [start, end) in minutes since ET midnight.
 */
@Getter
public enum TimeWindow {
    PRE_MARKET("Pre-Market", 240, 570, 80, 82, 2.0, 0.5),
    OPENING_DRIVE("Opening Drive", 570, 600, 65, 70, 1.2, 1.0),
    MID_MORNING("Mid-Morning", 600, 660, 72, 75, 1.5, 1.0),
    LATE_MORNING("Late Morning", 660, 690, 75, 78, 1.6, 0.9),
    LUNCH_CHOP("Lunch Chop", 690, 810, 85, 88, 2.2, 0.6),
    EARLY_AFTERNOON("Early Afternoon", 810, 870, 72, 75, 1.5, 0.9),
    AFTERNOON("Afternoon", 870, 900, 70, 73, 1.4, 1.0),
    POWER_HOUR("Power Hour", 900, 960, 68, 72, 1.3, 1.1),
    AFTER_HOURS("After Hours", 960, 1200, 85, 88, 2.5, 0.3),

    // Conservative defaults outside every session window
    CLOSED("Closed", -1, -1, 75, 78, 1.5, 0.5),
    WEEKEND("Weekend", -1, -1, 75, 78, 1.5, 0.5);

    private final String label;
    private final int startMinute;
    private final int endMinute;
    private final double minBaseScore;
    private final double minStyleScore;
    private final double minRiskReward;
    private final double sizeMultiplier;

    TimeWindow(String label, int startMinute, int endMinute,
               double minBaseScore, double minStyleScore, double minRiskReward, double sizeMultiplier) {
        this.label = label;
        this.startMinute = startMinute;
        this.endMinute = endMinute;
        this.minBaseScore = minBaseScore;
        this.minStyleScore = minStyleScore;
        this.minRiskReward = minRiskReward;
        this.sizeMultiplier = sizeMultiplier;
    }

    public static TimeWindow at(Instant timestamp) {
        if (timestamp == null) {
            return CLOSED;
        }
        ZonedDateTime et = timestamp.atZone(ScannerConstants.MARKET_ZONE);
        DayOfWeek day = et.getDayOfWeek();
        if (day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY) {
            return WEEKEND;
        }
        int minute = et.getHour() * 60 + et.getMinute();
        for (TimeWindow window : values()) {
            if (window.startMinute >= 0 && minute >= window.startMinute && minute < window.endMinute) {
                return window;
            }
        }
        return CLOSED;
    }

    public boolean isSessionWindow() {
        return startMinute >= 0;
    }
}
