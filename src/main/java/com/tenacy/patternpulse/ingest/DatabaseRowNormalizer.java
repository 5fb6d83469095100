package com.tenacy.patternpulse.ingest;

import com.fasterxml.jackson.databind.JsonNode;
import com.tenacy.patternpulse.domain.SourceKind;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;

@Component
public class DatabaseRowNormalizer implements RawRowNormalizer {

    @Override
    public SourceKind source() {
        return SourceKind.DATABASE;
    }

    @Override
    public ErrorFact normalize(JsonNode row) {
        ErrorFact.ErrorFactBuilder fact = ErrorFact.builder().sourceKind(SourceKind.DATABASE);

        fact.timestamp(JsonFieldReader.timestamp(row, "TimeStamp", "timestamp", "time_stamp")
                .orElseGet(() -> {
                    fact.defaultedField("timestamp");
                    return ErrorFact.MIN_TIMESTAMP;
                }));

        fact.severityLabel(read(fact, "severityLabel", row, "LogLevel", "log_level", "logLevel")
                .toLowerCase(Locale.ROOT).trim());
        fact.message(read(fact, "message", row, "Message", "message"));
        fact.applicationName(read(fact, "applicationName", row, "Application", "application"));
        fact.componentName(read(fact, "componentName", row, "Logger", "logger"));
        fact.stackTrace(JsonFieldReader.text(row, "StackTrace", "stack_trace", "stackTrace").orElse(null));

        Optional<String> exception = JsonFieldReader.text(row, "Exception", "exception");
        if (exception.isEmpty()) {
            fact.defaultedField("exceptionType");
        }
        fact.exceptionType(ExceptionTypeExtractor.extract(exception.orElse("")));

        return fact.build();
    }

    private String read(ErrorFact.ErrorFactBuilder fact, String field, JsonNode row, String... names) {
        Optional<String> value = JsonFieldReader.text(row, names);
        if (value.isEmpty()) {
            fact.defaultedField(field);
            return "";
        }
        return value.get();
    }
}
