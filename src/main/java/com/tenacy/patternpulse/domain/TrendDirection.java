package com.tenacy.patternpulse.domain;

public enum TrendDirection {
    DECREASING,
    STABLE,
    INCREASING
}
