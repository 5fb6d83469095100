package com.tenacy.patternpulse.domain;

public enum PatternSeverity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}
