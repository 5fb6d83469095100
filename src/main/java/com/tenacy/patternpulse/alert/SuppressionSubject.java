package com.tenacy.patternpulse.alert;

import com.tenacy.patternpulse.domain.ErrorPattern;
import com.tenacy.patternpulse.domain.PatternAlert;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * 억제 규칙 조건이 참조할 수 있는 알림/패턴 필드 값 모음.
 */
public final class SuppressionSubject {

    private final Map<String, String> values;

    private SuppressionSubject(Map<String, String> values) {
        this.values = values;
    }

    public static SuppressionSubject of(PatternAlert alert, ErrorPattern pattern) {
        Map<String, String> values = new HashMap<>();
        put(values, "patternId", pattern.getId());
        put(values, "patternName", alert.getPatternName() != null ? alert.getPatternName() : pattern.getName());
        put(values, "severity", alert.getSeverity());
        put(values, "status", alert.getStatus());
        put(values, "application", pattern.getApplicationName());
        put(values, "component", pattern.getComponentName());
        put(values, "exceptionType", pattern.getExceptionType());
        put(values, "severityLabel", pattern.getSeverityLabel());
        put(values, "priority", pattern.getPriority());
        put(values, "category", pattern.getCategory());
        put(values, "source", pattern.getSourceKind());
        put(values, "message", pattern.getDescription());
        put(values, "triggerCount", alert.getTriggerCount());
        put(values, "escalationLevel", alert.getEscalationLevel());
        put(values, "occurrenceCount", pattern.getOccurrenceCount());
        put(values, "affectedUsers", pattern.getAffectedUsers());
        put(values, "occurrenceRate", pattern.getOccurrenceRate());
        return new SuppressionSubject(values);
    }

    /**
     * 필드 이름은 대소문자를 구분하지 않는다. 알 수 없는 필드는 빈 값.
     */
    public Optional<String> value(String field) {
        if (field == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(values.get(field.toLowerCase(Locale.ROOT)));
    }

    private static void put(Map<String, String> values, String field, Object value) {
        values.put(field.toLowerCase(Locale.ROOT), value == null ? "" : String.valueOf(value));
    }
}
