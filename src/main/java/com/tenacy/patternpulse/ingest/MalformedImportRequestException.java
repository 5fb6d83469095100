package com.tenacy.patternpulse.ingest;

public class MalformedImportRequestException extends RuntimeException {

    public MalformedImportRequestException(String message) {
        super(message);
    }

    public MalformedImportRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
