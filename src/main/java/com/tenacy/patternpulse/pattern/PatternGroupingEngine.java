package com.tenacy.patternpulse.pattern;

import com.tenacy.patternpulse.ingest.ErrorFact;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 팩트 배치를 복합 키 기준으로 정확히 분할한다. 처음 나타난 순서를 유지한다.
 */
@Component
@Slf4j
public class PatternGroupingEngine {

    public List<PatternGroup> group(List<ErrorFact> facts) {
        if (facts == null || facts.isEmpty()) {
            return List.of();
        }

        Map<PatternKey, PatternGroup> groups = new LinkedHashMap<>();
        for (ErrorFact fact : facts) {
            PatternKey key = PatternKey.of(fact);
            groups.computeIfAbsent(key, k -> new PatternGroup(k, fact.getSourceKind())).add(fact);
        }

        log.debug("{}개 팩트를 {}개 그룹으로 분할", facts.size(), groups.size());
        return new ArrayList<>(groups.values());
    }
}
