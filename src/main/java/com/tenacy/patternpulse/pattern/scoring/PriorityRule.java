package com.tenacy.patternpulse.pattern.scoring;

import com.tenacy.patternpulse.domain.PatternPriority;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 우선순위 규칙 한 줄. 비어 있는 조건은 항상 만족한다.
 * 규칙 테이블은 위에서부터 평가되며 처음 일치한 규칙이 이긴다.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PriorityRule {

    private String severityLabel;           // 대소문자 무시 비교
    private Integer countAbove;             // occurrenceCount > countAbove
    private String exceptionTypeContains;   // 대소문자 구분
    private PatternPriority priority;

    public static PriorityRule of(String severityLabel, Integer countAbove, PatternPriority priority) {
        return new PriorityRule(severityLabel, countAbove, null, priority);
    }

    public static PriorityRule typeContains(String token, PatternPriority priority) {
        return new PriorityRule(null, null, token, priority);
    }

    public boolean matches(String label, int count, String exceptionType) {
        if (severityLabel != null && !severityLabel.equalsIgnoreCase(label)) {
            return false;
        }
        if (countAbove != null && count <= countAbove) {
            return false;
        }
        return exceptionTypeContains == null
                || (exceptionType != null && exceptionType.contains(exceptionTypeContains));
    }
}
