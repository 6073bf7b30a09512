package com.kotsin.scanner.dedup;

import lombok.Getter;

/**
 * Outcome of an atomic check-and-record against the deduplication store.
 */
@Getter
public final class DedupCheck {

    public enum Outcome {
        RECORDED,
        DUPLICATE_BAR,
        COOLDOWN,
        RATE_CAP
    }

    private final Outcome outcome;
    private final String reason;

    private DedupCheck(Outcome outcome, String reason) {
        this.outcome = outcome;
        this.reason = reason;
    }

    public static DedupCheck recorded() {
        return new DedupCheck(Outcome.RECORDED, null);
    }

    public static DedupCheck duplicateBar(String barTimeKey) {
        return new DedupCheck(Outcome.DUPLICATE_BAR, "Duplicate bar time key: " + barTimeKey);
    }

    public static DedupCheck cooldown(int cooldownMinutes, long remainingSeconds) {
        return new DedupCheck(Outcome.COOLDOWN, String.format(
                "In cooldown (%d minutes, %ds remaining)", cooldownMinutes, remainingSeconds));
    }

    public static DedupCheck rateCap(int maxPerHour, RateCapScope scope) {
        return new DedupCheck(Outcome.RATE_CAP, String.format(
                "Max signals per hour exceeded (%d, scope %s)", maxPerHour, scope));
    }

    public boolean isRecorded() {
        return outcome == Outcome.RECORDED;
    }

    @Override
    public String toString() {
        return isRecorded() ? "RECORDED" : outcome + ": " + reason;
    }
}
