package com.tenacy.patternpulse.domain;

public enum PatternType {
    TRANSIENT,   // 짧게 발생 후 사라지는 패턴
    PERSISTENT,  // 장시간 지속되는 패턴
    TRENDING,    // 발생 빈도가 증가하는 패턴
    CYCLIC,      // 주기적으로 반복되는 패턴
    CORRELATED   // 다른 패턴과 함께 발생하는 패턴
}
