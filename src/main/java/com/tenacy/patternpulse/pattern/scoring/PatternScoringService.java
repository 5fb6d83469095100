package com.tenacy.patternpulse.pattern.scoring;

import com.tenacy.patternpulse.domain.SourceKind;
import com.tenacy.patternpulse.ingest.UnsupportedSourceException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 소스 종류에 맞는 {@link PatternScorer}를 골라 점수를 계산한다.
 */
@Service
@Slf4j
public class PatternScoringService {

    private final Map<SourceKind, PatternScorer> scorers = new EnumMap<>(SourceKind.class);

    public PatternScoringService(List<PatternScorer> scorers) {
        for (PatternScorer scorer : scorers) {
            this.scorers.put(scorer.source(), scorer);
        }
    }

    public PatternScore score(ScoringInput input) {
        PatternScorer scorer = scorers.get(input.getSourceKind());
        if (scorer == null) {
            throw new UnsupportedSourceException(String.valueOf(input.getSourceKind()));
        }
        PatternScore score = scorer.score(input);
        log.debug("스코어 계산 - source: {}, count: {}, priority: {}, confidence: {}",
                input.getSourceKind(), input.getOccurrenceCount(), score.getPriority(), score.getConfidence());
        return score;
    }
}
