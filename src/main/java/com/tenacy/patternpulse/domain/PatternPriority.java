package com.tenacy.patternpulse.domain;

public enum PatternPriority {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public boolean isAtLeast(PatternPriority other) {
        return this.ordinal() >= other.ordinal();
    }
}
