package com.tenacy.patternpulse.ingest;

import com.tenacy.patternpulse.domain.SourceKind;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.Set;

/**
 * 소스에 상관없이 정규화된 단일 에러 관측값. 생성 후 변경되지 않는다.
 */
@Value
@Builder
public class ErrorFact {

    /** 타임스탬프를 읽을 수 없을 때 사용하는 기본값 */
    public static final LocalDateTime MIN_TIMESTAMP = LocalDateTime.of(1, 1, 1, 0, 0);

    LocalDateTime timestamp;
    String message;
    String exceptionType;
    String applicationName;
    String componentName;
    String severityLabel;
    String stackTrace;
    SourceKind sourceKind;

    // 기본값으로 대체된 필드 이름
    @Singular
    Set<String> defaultedFields;

    public boolean hasReadableTimestamp() {
        return !MIN_TIMESTAMP.equals(timestamp);
    }
}
