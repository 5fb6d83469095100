package com.tenacy.patternpulse.pattern;

import com.tenacy.patternpulse.ingest.ErrorFact;
import lombok.Value;

/**
 * 그룹핑 복합 키. 네 필드가 정확히 같을 때만 같은 패턴이다.
 */
@Value
public class PatternKey {

    String severityLabel;
    String exceptionType;
    String applicationName;
    String componentName;

    public static PatternKey of(ErrorFact fact) {
        return new PatternKey(
                nullToEmpty(fact.getSeverityLabel()),
                nullToEmpty(fact.getExceptionType()),
                nullToEmpty(fact.getApplicationName()),
                nullToEmpty(fact.getComponentName()));
    }

    public String signature() {
        return Signatures.sha256Hex(severityLabel + Signatures.SEPARATOR
                + exceptionType + Signatures.SEPARATOR
                + applicationName + Signatures.SEPARATOR
                + componentName);
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
