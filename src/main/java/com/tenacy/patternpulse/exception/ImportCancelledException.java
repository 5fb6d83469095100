package com.tenacy.patternpulse.exception;

/**
 * 저장 전에 가져오기 작업이 취소됨. 배치 전체가 버려진다.
 */
public class ImportCancelledException extends RuntimeException {

    public ImportCancelledException(String message) {
        super(message);
    }
}
