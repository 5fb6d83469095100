package com.tenacy.patternpulse.domain;

import com.tenacy.patternpulse.ingest.UnsupportedSourceException;

import java.util.Locale;

/**
 * 에러 행이 어디에서 왔는지 나타내는 수집 소스 태그. 스코어링 프로파일 선택에도 사용된다.
 */
public enum SourceKind {
    DATABASE("database-import"),
    APM("apm-import");

    private final String tag;

    SourceKind(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }

    public static SourceKind from(String value) {
        if (value == null || value.isBlank()) {
            throw new UnsupportedSourceException(value);
        }
        try {
            return SourceKind.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new UnsupportedSourceException(value);
        }
    }
}
