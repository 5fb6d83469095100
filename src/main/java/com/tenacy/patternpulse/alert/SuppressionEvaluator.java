package com.tenacy.patternpulse.alert;

import com.tenacy.patternpulse.domain.SuppressionCondition;
import com.tenacy.patternpulse.domain.SuppressionRule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * 억제 규칙 평가. 모든 조건이 만족해야 일치하며 조건이 없는 규칙은 아무것도 억제하지 않는다.
 */
@Component
@Slf4j
public class SuppressionEvaluator {

    public Optional<SuppressionRule> findMatch(List<SuppressionRule> rules, SuppressionSubject subject, LocalDateTime now) {
        for (SuppressionRule rule : rules) {
            if (matches(rule, subject, now)) {
                return Optional.of(rule);
            }
        }
        return Optional.empty();
    }

    public boolean matches(SuppressionRule rule, SuppressionSubject subject, LocalDateTime now) {
        if (rule == null || !rule.isEffective(now) || rule.getConditions().isEmpty()) {
            return false;
        }
        for (SuppressionCondition condition : rule.getConditions()) {
            if (!matches(condition, subject)) {
                return false;
            }
        }
        return true;
    }

    boolean matches(SuppressionCondition condition, SuppressionSubject subject) {
        if (condition.getOperator() == null) {
            return false;
        }
        Optional<String> actualValue = subject.value(condition.getField());
        if (actualValue.isEmpty()) {
            return false;
        }

        String actual = actualValue.get();
        String expected = condition.getValue() == null ? "" : condition.getValue();
        String actualLower = actual.toLowerCase(Locale.ROOT);
        String expectedLower = expected.toLowerCase(Locale.ROOT);

        return switch (condition.getOperator()) {
            case EQUALS -> actual.equalsIgnoreCase(expected);
            case NOT_EQUALS -> !actual.equalsIgnoreCase(expected);
            case CONTAINS -> actualLower.contains(expectedLower);
            case NOT_CONTAINS -> !actualLower.contains(expectedLower);
            case STARTS_WITH -> actualLower.startsWith(expectedLower);
            case ENDS_WITH -> actualLower.endsWith(expectedLower);
            case REGEX -> regex(actual, expected);
            case GREATER_THAN -> compare(actual, expected) > 0;
            case LESS_THAN -> compare(actual, expected) < 0;
            case GREATER_THAN_OR_EQUAL -> compare(actual, expected) >= 0;
            case LESS_THAN_OR_EQUAL -> compare(actual, expected) <= 0;
        };
    }

    private boolean regex(String actual, String expression) {
        try {
            return Pattern.compile(expression, Pattern.CASE_INSENSITIVE).matcher(actual).find();
        } catch (PatternSyntaxException e) {
            log.debug("잘못된 정규식 조건 - 불일치로 처리: {}", expression);
            return false;
        }
    }

    // 양쪽 모두 숫자면 숫자 비교, 아니면 대소문자 무시 문자열 비교
    private int compare(String actual, String expected) {
        Double left = parseNumber(actual);
        Double right = parseNumber(expected);
        if (left != null && right != null) {
            return Double.compare(left, right);
        }
        return actual.compareToIgnoreCase(expected);
    }

    private Double parseNumber(String value) {
        try {
            return Double.valueOf(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
