package com.tenacy.patternpulse.domain;

public enum ErrorCategory {
    PERFORMANCE,
    INFRASTRUCTURE,
    SECURITY,
    BUSINESS_LOGIC,
    APPLICATION_LOGIC,
    DATA_QUALITY,
    DATA_ACCESS,
    UNKNOWN
}
