package com.tenacy.patternpulse.pattern.scoring;

import com.tenacy.patternpulse.domain.ErrorPattern;
import com.tenacy.patternpulse.domain.SourceKind;
import com.tenacy.patternpulse.pattern.PatternGroup;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ScoringInput {

    SourceKind sourceKind;
    String severityLabel;
    String exceptionType;
    int occurrenceCount;
    int uniqueMessageCount;
    int messageLength;
    double timespanHours;

    public static ScoringInput of(PatternGroup group) {
        return ScoringInput.builder()
                .sourceKind(group.getSourceKind())
                .severityLabel(group.getKey().getSeverityLabel())
                .exceptionType(group.getKey().getExceptionType())
                .occurrenceCount(group.getCount())
                .uniqueMessageCount(group.getUniqueMessageCount())
                .messageLength(group.getLongestMessage().length())
                .timespanHours(group.getTimespanHours())
                .build();
    }

    public static ScoringInput of(ErrorPattern pattern) {
        return ScoringInput.builder()
                .sourceKind(pattern.getSourceKind())
                .severityLabel(pattern.getSeverityLabel())
                .exceptionType(pattern.getExceptionType())
                .occurrenceCount(pattern.getOccurrenceCount())
                .uniqueMessageCount(pattern.getUniqueMessageCount())
                .messageLength(pattern.getLongestMessageLength())
                .timespanHours(pattern.getTimespanHours())
                .build();
    }
}
