package com.tenacy.patternpulse.pattern.scoring;

import com.tenacy.patternpulse.domain.PatternPriority;

import java.util.List;

/**
 * 프로파일 공통 계산: 발생률, 우선순위 규칙 테이블 평가, 값 보정.
 */
public abstract class AbstractPatternScorer implements PatternScorer {

    protected static final double MAX_CONFIDENCE = 0.98;

    @Override
    public PatternScore score(ScoringInput input) {
        int count = Math.max(0, input.getOccurrenceCount());

        return PatternScore.builder()
                .confidence(clamp(confidence(input), 0, MAX_CONFIDENCE))
                .priority(priority(input))
                .affectedUsers(Math.max(0, userImpact(input)))
                .occurrenceRate(finiteOrZero(occurrenceRate(count, input.getTimespanHours())))
                .revenueImpact(Math.max(0, finiteOrZero(revenueImpact(input))))
                .csatScore(clamp(csat(count), 1.0, 5.0))
                .serviceLevelImpact(clamp(serviceLevelImpact(count), 0, 100.0))
                .build();
    }

    protected abstract double confidence(ScoringInput input);

    protected abstract PatternPriority priority(ScoringInput input);

    protected abstract int userImpact(ScoringInput input);

    protected abstract double revenueImpact(ScoringInput input);

    protected abstract double csat(int count);

    protected abstract double serviceLevelImpact(int count);

    protected static PatternPriority evaluate(List<PriorityRule> rules, PatternPriority fallback, ScoringInput input) {
        for (PriorityRule rule : rules) {
            if (rule.matches(input.getSeverityLabel(), input.getOccurrenceCount(), input.getExceptionType())) {
                return rule.getPriority();
            }
        }
        return fallback;
    }

    static double occurrenceRate(int count, double timespanHours) {
        if (count >= 2 && timespanHours > 0) {
            return count / timespanHours;
        }
        return count;
    }

    static double clamp(double value, double min, double max) {
        double finite = finiteOrZero(value);
        return Math.max(min, Math.min(max, finite));
    }

    static double finiteOrZero(double value) {
        return Double.isFinite(value) ? value : 0;
    }
}
