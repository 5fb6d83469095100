package com.tenacy.patternpulse.domain;

public enum AlertSeverity {
    INFO,       // 새 패턴, 영향 낮음
    WARNING,    // 증가 추세, 중간 영향
    CRITICAL,   // 높은 빈도, 사용자 영향 큼
    EMERGENCY;  // 서비스 저하 감지

    public boolean isHigherThan(AlertSeverity other) {
        return this.ordinal() > other.ordinal();
    }
}
