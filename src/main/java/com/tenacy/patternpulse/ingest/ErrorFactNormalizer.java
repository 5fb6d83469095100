package com.tenacy.patternpulse.ingest;

import com.fasterxml.jackson.databind.JsonNode;
import com.tenacy.patternpulse.domain.SourceKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Service
@Slf4j
public class ErrorFactNormalizer {

    private final Map<SourceKind, RawRowNormalizer> normalizers = new EnumMap<>(SourceKind.class);
    private final Counter decodeDefaultCounter;

    public ErrorFactNormalizer(List<RawRowNormalizer> normalizers, MeterRegistry meterRegistry) {
        for (RawRowNormalizer normalizer : normalizers) {
            this.normalizers.put(normalizer.source(), normalizer);
        }
        this.decodeDefaultCounter = Counter.builder("patternpulse.facts.decode.defaults")
                .description("기본값으로 대체된 필드 수")
                .register(meterRegistry);
        log.info("정규화기 등록 완료: {}", this.normalizers.keySet());
    }

    public ErrorFact normalize(SourceKind source, JsonNode row) {
        RawRowNormalizer normalizer = normalizers.get(source);
        if (normalizer == null) {
            throw new UnsupportedSourceException(String.valueOf(source));
        }
        if (row == null || !row.isObject()) {
            throw new MalformedImportRequestException("원시 행은 JSON 객체여야 합니다: " + row);
        }

        ErrorFact fact = normalizer.normalize(row);
        if (!fact.getDefaultedFields().isEmpty()) {
            decodeDefaultCounter.increment(fact.getDefaultedFields().size());
            log.debug("{} 행에서 기본값으로 대체된 필드: {}", source, fact.getDefaultedFields());
        }
        return fact;
    }

    public List<ErrorFact> normalizeAll(SourceKind source, List<JsonNode> rows) {
        List<ErrorFact> facts = new ArrayList<>(rows.size());
        for (JsonNode row : rows) {
            facts.add(normalize(source, row));
        }
        return facts;
    }
}
