package com.tenacy.patternpulse.domain;

public enum PatternStatus {
    ACTIVE,
    INVESTIGATION_PENDING,
    IN_PROGRESS,
    RESOLVED,
    IGNORED,
    ARCHIVED;

    /**
     * 새로운 발생이 들어오면 카운트를 초기화하고 다시 ACTIVE로 열어야 하는 상태인지 여부
     */
    public boolean isClosed() {
        return this == RESOLVED || this == ARCHIVED;
    }
}
