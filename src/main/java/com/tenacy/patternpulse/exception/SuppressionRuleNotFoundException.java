package com.tenacy.patternpulse.exception;

public class SuppressionRuleNotFoundException extends RuntimeException {

    public SuppressionRuleNotFoundException(String id) {
        super("억제 규칙을 찾을 수 없습니다: " + id);
    }
}
