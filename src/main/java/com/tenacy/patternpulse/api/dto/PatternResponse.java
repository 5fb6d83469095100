package com.tenacy.patternpulse.api.dto;

import com.tenacy.patternpulse.domain.BusinessImpact;
import com.tenacy.patternpulse.domain.ErrorCategory;
import com.tenacy.patternpulse.domain.ErrorPattern;
import com.tenacy.patternpulse.domain.PatternPriority;
import com.tenacy.patternpulse.domain.PatternSeverity;
import com.tenacy.patternpulse.domain.PatternStatus;
import com.tenacy.patternpulse.domain.PatternType;
import com.tenacy.patternpulse.domain.SourceKind;
import com.tenacy.patternpulse.domain.TrendDirection;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PatternResponse {
    private String id;
    private String name;
    private String description;
    private String severityLabel;
    private String exceptionType;
    private String applicationName;
    private String componentName;
    private SourceKind sourceKind;
    private PatternType type;
    private ErrorCategory category;
    private double confidence;
    private PatternPriority priority;
    private PatternSeverity severity;
    private PatternStatus status;
    private LocalDateTime firstOccurrence;
    private LocalDateTime lastOccurrence;
    private int occurrenceCount;
    private double occurrenceRate;
    private int affectedUsers;
    private int uniqueMessageCount;
    private List<String> affectedServices;
    private List<String> affectedComponents;
    private List<String> tags;
    private List<String> relatedPatternIds;
    private TrendDirection trendDirection;
    private double changeRate;
    private boolean accelerating;
    private long forecastOccurrences;
    private double forecastConfidence;
    private BusinessImpact businessImpact;
    private String assignedTo;
    private String resolutionNotes;
    private LocalDateTime createdAt;
    private LocalDateTime lastAnalyzed;

    public static PatternResponse of(ErrorPattern pattern) {
        return PatternResponse.builder()
                .id(pattern.getId())
                .name(pattern.getName())
                .description(pattern.getDescription())
                .severityLabel(pattern.getSeverityLabel())
                .exceptionType(pattern.getExceptionType())
                .applicationName(pattern.getApplicationName())
                .componentName(pattern.getComponentName())
                .sourceKind(pattern.getSourceKind())
                .type(pattern.getType())
                .category(pattern.getCategory())
                .confidence(pattern.getConfidence())
                .priority(pattern.getPriority())
                .severity(pattern.getSeverity())
                .status(pattern.getStatus())
                .firstOccurrence(pattern.getFirstOccurrence())
                .lastOccurrence(pattern.getLastOccurrence())
                .occurrenceCount(pattern.getOccurrenceCount())
                .occurrenceRate(pattern.getOccurrenceRate())
                .affectedUsers(pattern.getAffectedUsers())
                .uniqueMessageCount(pattern.getUniqueMessageCount())
                .affectedServices(new ArrayList<>(pattern.getAffectedServices()))
                .affectedComponents(new ArrayList<>(pattern.getAffectedComponents()))
                .tags(new ArrayList<>(pattern.getTags()))
                .relatedPatternIds(new ArrayList<>(pattern.getRelatedPatternIds()))
                .trendDirection(pattern.getTrendDirection())
                .changeRate(pattern.getChangeRate())
                .accelerating(pattern.isAccelerating())
                .forecastOccurrences(pattern.getForecastOccurrences())
                .forecastConfidence(pattern.getForecastConfidence())
                .businessImpact(pattern.getBusinessImpact())
                .assignedTo(pattern.getAssignedTo())
                .resolutionNotes(pattern.getResolutionNotes())
                .createdAt(pattern.getCreatedAt())
                .lastAnalyzed(pattern.getLastAnalyzed())
                .build();
    }
}
