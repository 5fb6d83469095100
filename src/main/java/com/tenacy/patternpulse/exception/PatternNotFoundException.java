package com.tenacy.patternpulse.exception;

public class PatternNotFoundException extends RuntimeException {

    public PatternNotFoundException(String id) {
        super("패턴을 찾을 수 없습니다: " + id);
    }
}
