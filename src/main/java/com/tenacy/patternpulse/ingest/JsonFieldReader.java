package com.tenacy.patternpulse.ingest;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Optional;

/**
 * 원시 행(JsonNode)에서 필드를 읽는 헬퍼. 후보 이름을 순서대로 찾고
 * "error.message" 같은 점 표기는 평탄한 키와 중첩 객체 둘 다 허용한다.
 */
final class JsonFieldReader {

    private JsonFieldReader() {
    }

    static Optional<String> text(JsonNode row, String... candidates) {
        for (String name : candidates) {
            JsonNode node = find(row, name);
            if (node != null && !node.isNull() && node.isValueNode()) {
                String value = node.asText();
                if (!value.isBlank()) {
                    return Optional.of(value);
                }
            }
        }
        return Optional.empty();
    }

    static Optional<LocalDateTime> timestamp(JsonNode row, String... candidates) {
        for (String name : candidates) {
            JsonNode node = find(row, name);
            if (node == null || node.isNull()) {
                continue;
            }
            if (node.isNumber()) {
                return Optional.of(fromEpochMillis(node.asLong()));
            }
            if (node.isTextual()) {
                Optional<LocalDateTime> parsed = parse(node.asText().trim());
                if (parsed.isPresent()) {
                    return parsed;
                }
            }
        }
        return Optional.empty();
    }

    private static JsonNode find(JsonNode row, String name) {
        JsonNode direct = row.get(name);
        if (direct != null) {
            return direct;
        }
        if (name.indexOf('.') < 0) {
            return null;
        }
        JsonNode current = row;
        for (String part : name.split("\\.")) {
            if (current == null || !current.isObject()) {
                return null;
            }
            current = current.get(part);
        }
        return current;
    }

    private static Optional<LocalDateTime> parse(String text) {
        if (text.isEmpty()) {
            return Optional.empty();
        }
        if (text.chars().allMatch(Character::isDigit)) {
            try {
                return Optional.of(fromEpochMillis(Long.parseLong(text)));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }

        // "2024-01-01 10:00:00" 형식도 ISO로 맞춘다
        String iso = text.length() > 10 && text.charAt(10) == ' '
                ? text.substring(0, 10) + 'T' + text.substring(11)
                : text;
        try {
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(iso, OffsetDateTime::from, LocalDateTime::from);
            if (parsed instanceof OffsetDateTime offset) {
                return Optional.of(offset.withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime());
            }
            return Optional.of((LocalDateTime) parsed);
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    private static LocalDateTime fromEpochMillis(long millis) {
        return LocalDateTime.ofInstant(Instant.ofEpochMilli(millis), ZoneOffset.UTC);
    }
}
