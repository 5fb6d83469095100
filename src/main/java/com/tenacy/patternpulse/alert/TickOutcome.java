package com.tenacy.patternpulse.alert;

/**
 * 주기 점검 한 번의 결과.
 */
public enum TickOutcome {
    NONE,
    REACTIVATED,
    SUPPRESSED,
    ESCALATED;

    public boolean changed() {
        return this != NONE;
    }
}
