package com.kotsin.scanner.model;

public enum ConfidenceLevel {
    HIGH,
    MEDIUM,
    LOW,
    VERY_LOW;

    public static ConfidenceLevel of(double confidence) {
        if (confidence >= 80) return HIGH;
        if (confidence >= 60) return MEDIUM;
        if (confidence >= 40) return LOW;
        return VERY_LOW;
    }
}
