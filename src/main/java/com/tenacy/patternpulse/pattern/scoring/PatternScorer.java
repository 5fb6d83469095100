package com.tenacy.patternpulse.pattern.scoring;

import com.tenacy.patternpulse.domain.SourceKind;

/**
 * 소스 프로파일별 스코어링 전략.
 */
public interface PatternScorer {

    SourceKind source();

    PatternScore score(ScoringInput input);
}
