package com.kotsin.scanner.model;

public enum Direction {
    LONG,
    SHORT;

    public boolean isLong() {
        return this == LONG;
    }

    /**
     * +1 for LONG, -1 for SHORT. Lets directional factors share one formula.
     */
    public int sign() {
        return this == LONG ? 1 : -1;
    }
}
