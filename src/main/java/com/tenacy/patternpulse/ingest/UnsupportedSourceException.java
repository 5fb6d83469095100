package com.tenacy.patternpulse.ingest;

public class UnsupportedSourceException extends RuntimeException {

    public UnsupportedSourceException(String source) {
        super("지원하지 않는 수집 소스입니다: " + source);
    }
}
