package com.tenacy.patternpulse.ingest;

import com.fasterxml.jackson.databind.JsonNode;
import com.tenacy.patternpulse.domain.SourceKind;

/**
 * 소스별 원시 행을 {@link ErrorFact}로 바꾸는 정규화기.
 * 읽을 수 없는 필드는 예외 대신 기본값으로 채우고 defaultedFields에 기록한다.
 */
public interface RawRowNormalizer {

    SourceKind source();

    ErrorFact normalize(JsonNode row);
}
