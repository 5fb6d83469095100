package com.tenacy.patternpulse.exception;

public class AlertNotFoundException extends RuntimeException {

    public AlertNotFoundException(String id) {
        super("알림을 찾을 수 없습니다: " + id);
    }
}
