package com.tenacy.patternpulse.ingest;

import org.springframework.util.StringUtils;

public final class ExceptionTypeExtractor {

    public static final String UNKNOWN = "Unknown";

    private static final int MAX_LENGTH = 50;

    private ExceptionTypeExtractor() {
    }

    /**
     * 예외 텍스트 첫 줄에서 타입 토큰을 뽑는다.
     * 콜론이 있으면 콜론 앞부분, 없으면 앞 50자(잘리면 "..." 추가).
     */
    public static String extract(String exceptionText) {
        if (!StringUtils.hasText(exceptionText)) {
            return UNKNOWN;
        }

        String firstLine = exceptionText.strip().lines().findFirst().orElse("");

        int colon = firstLine.indexOf(':');
        if (colon >= 0) {
            String type = firstLine.substring(0, colon).trim();
            return type.isEmpty() ? UNKNOWN : type;
        }

        if (firstLine.length() > MAX_LENGTH) {
            return firstLine.substring(0, MAX_LENGTH) + "...";
        }
        return firstLine;
    }
}
