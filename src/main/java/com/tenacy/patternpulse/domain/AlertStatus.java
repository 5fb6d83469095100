package com.tenacy.patternpulse.domain;

import java.util.EnumSet;
import java.util.Set;

public enum AlertStatus {
    ACTIVE,
    ACKNOWLEDGED,
    RESOLVED,
    SUPPRESSED;

    public static final Set<AlertStatus> UNRESOLVED = EnumSet.of(ACTIVE, ACKNOWLEDGED, SUPPRESSED);

    public boolean isEscalatable() {
        return this == ACTIVE || this == ACKNOWLEDGED;
    }
}
