package com.tenacy.patternpulse.ingest;

import com.fasterxml.jackson.databind.JsonNode;
import com.tenacy.patternpulse.domain.SourceKind;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
public class ApmRowNormalizer implements RawRowNormalizer {

    // APM 결과에는 로그 레벨이 없으므로 모두 error로 취급
    static final String SEVERITY_LABEL = "error";

    @Override
    public SourceKind source() {
        return SourceKind.APM;
    }

    @Override
    public ErrorFact normalize(JsonNode row) {
        ErrorFact.ErrorFactBuilder fact = ErrorFact.builder()
                .sourceKind(SourceKind.APM)
                .severityLabel(SEVERITY_LABEL);

        fact.timestamp(JsonFieldReader.timestamp(row, "timestamp")
                .orElseGet(() -> {
                    fact.defaultedField("timestamp");
                    return ErrorFact.MIN_TIMESTAMP;
                }));

        fact.message(read(fact, "message", row, "error.message", "errorMessage"));
        fact.applicationName(read(fact, "applicationName", row, "appName"));
        fact.componentName(read(fact, "componentName", row, "name", "transactionName"));
        fact.stackTrace(JsonFieldReader.text(row, "stackTrace", "error.stack_trace").orElse(null));

        Optional<String> errorClass = JsonFieldReader.text(row, "error.class", "errorClass");
        if (errorClass.isEmpty()) {
            fact.defaultedField("exceptionType");
        }
        fact.exceptionType(ExceptionTypeExtractor.extract(errorClass.orElse("")));

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
