package com.tenacy.patternpulse.pattern.scoring;

import com.tenacy.patternpulse.config.PatternPulseProperties;
import com.tenacy.patternpulse.domain.PatternPriority;
import com.tenacy.patternpulse.domain.SourceKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

public class DatabaseProfileScorerTest {

    private final DatabaseProfileScorer scorer = new DatabaseProfileScorer(new PatternPulseProperties());

    @Test
    @DisplayName("2시간 동안 12건의 error는 CRITICAL, 시간당 6건")
    void scoreTwelveErrorsOverTwoHours() {
        // given
        ScoringInput input = input("error", "System.TimeoutException", 12, 1, 2.0);

        // when
        PatternScore score = scorer.score(input);

        // then
        assertThat(score.getPriority()).isEqualTo(PatternPriority.CRITICAL);
        assertThat(score.getOccurrenceRate()).isEqualTo(6.0);
        assertThat(score.getConfidence()).isCloseTo(0.98, within(1e-9));
        assertThat(score.getAffectedUsers()).isEqualTo(24);
        assertThat(score.getRevenueImpact()).isEqualTo(1200.0);
        assertThat(score.getCsatScore()).isCloseTo(4.6, within(1e-9));
        assertThat(score.getServiceLevelImpact()).isCloseTo(3.6, within(1e-9));
    }

    @ParameterizedTest(name = "{0} x {1} -> {2}")
    @CsvSource({
            "error, 15, CRITICAL",
            "error, 10, HIGH",
            "error, 11, CRITICAL",
            "fatal, 1, CRITICAL",
            "warn, 3, LOW",
            "warn, 10, LOW",
            "warn, 11, MEDIUM",
            "warn, 51, HIGH",
            "WARN, 11, MEDIUM",
            "info, 500, LOW"
    })
    @DisplayName("우선순위 경계값")
    void priorityBoundaries(String label, int count, PatternPriority expected) {
        PatternScore score = scorer.score(input(label, "X", count, 1, 1.0));

        assertThat(score.getPriority()).isEqualTo(expected);
    }

    @Test
    @DisplayName("단일 발생의 발생률은 1")
    void singleOccurrenceRate() {
        PatternScore score = scorer.score(input("error", "X", 1, 1, 0));

        assertThat(score.getOccurrenceRate()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("메시지가 제각각이면 일관성 보너스가 없다")
    void confidenceWithoutConsistencyBonus() {
        // base = min(0.9, 4/20 + 0.3) = 0.5, 4개 메시지 중 4개 고유 -> 0, 시간 범위 0 -> 0
        PatternScore score = scorer.score(input("error", "X", 4, 4, 0));

        assertThat(score.getConfidence()).isCloseTo(0.5, within(1e-9));
    }

    @Test
    @DisplayName("알 수 없는 심각도 라벨은 기본 배수를 쓴다")
    void unknownLabelUsesDefaults() {
        PatternScore score = scorer.score(input("debug", "X", 25, 1, 1.0));

        assertThat(score.getAffectedUsers()).isEqualTo(2);
        assertThat(score.getRevenueImpact()).isEqualTo(125.0);
    }

    @Test
    @DisplayName("대량 발생에서도 점수는 범위 안에 머문다")
    void scoreStaysInRange() {
        PatternScore score = scorer.score(input("fatal", "X", 100_000, 1, 0.5));

        assertThat(score.getConfidence()).isBetween(0.0, 0.98);
        assertThat(score.getCsatScore()).isEqualTo(1.0);
        assertThat(score.getServiceLevelImpact()).isEqualTo(100.0);
    }

    private static ScoringInput input(String label, String type, int count, int unique, double timespanHours) {
        return ScoringInput.builder()
                .sourceKind(SourceKind.DATABASE)
                .severityLabel(label)
                .exceptionType(type)
                .occurrenceCount(count)
                .uniqueMessageCount(unique)
                .messageLength(20)
                .timespanHours(timespanHours)
                .build();
    }
}
