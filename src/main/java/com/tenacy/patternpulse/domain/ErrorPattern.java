package com.tenacy.patternpulse.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.LinkedHashSet;
import java.util.Set;

@Entity
@Table(name = "error_patterns",
        uniqueConstraints = @UniqueConstraint(name = "uk_patterns_signature", columnNames = "signature"),
        indexes = {
                @Index(name = "idx_patterns_status", columnList = "status"),
                @Index(name = "idx_patterns_last_occurrence", columnList = "lastOccurrence")
        })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ErrorPattern {

    @Id
    private String id;

    @Version
    private Long version;

    @Column(nullable = false, length = 64)
    private String signature;

    // 그룹핑 키
    private String severityLabel;
    private String exceptionType;
    private String applicationName;
    private String componentName;

    @Enumerated(EnumType.STRING)
    private SourceKind sourceKind;

    private String name;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Column(columnDefinition = "TEXT")
    private String sampleStackTrace;

    @Enumerated(EnumType.STRING)
    @Builder.Default
    private PatternType type = PatternType.TRANSIENT;

    @Enumerated(EnumType.STRING)
    @Builder.Default
    private ErrorCategory category = ErrorCategory.UNKNOWN;

    private double confidence;

    @Enumerated(EnumType.STRING)
    @Builder.Default
    private PatternPriority priority = PatternPriority.LOW;

    @Enumerated(EnumType.STRING)
    @Builder.Default
    private PatternSeverity severity = PatternSeverity.LOW;

    @Enumerated(EnumType.STRING)
    @Builder.Default
    private PatternStatus status = PatternStatus.ACTIVE;

    private LocalDateTime firstOccurrence;
    private LocalDateTime lastOccurrence;

    private int occurrenceCount;
    private double occurrenceRate;   // 시간당 발생 횟수
    private int affectedUsers;
    private int uniqueMessageCount;
    private int longestMessageLength;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "pattern_services", joinColumns = @JoinColumn(name = "pattern_id"))
    @Column(name = "service_name")
    @Builder.Default
    private Set<String> affectedServices = new LinkedHashSet<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "pattern_components", joinColumns = @JoinColumn(name = "pattern_id"))
    @Column(name = "component_name")
    @Builder.Default
    private Set<String> affectedComponents = new LinkedHashSet<>();

    // 고유 메시지 수 계산용 메시지 해시 (상한 있음)
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "pattern_message_hashes", joinColumns = @JoinColumn(name = "pattern_id"))
    @Column(name = "message_hash", length = 64)
    @Builder.Default
    private Set<String> messageHashes = new LinkedHashSet<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "pattern_tags", joinColumns = @JoinColumn(name = "pattern_id"))
    @Column(name = "tag")
    @Builder.Default
    private Set<String> tags = new LinkedHashSet<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "pattern_relations", joinColumns = @JoinColumn(name = "pattern_id"))
    @Column(name = "related_pattern_id")
    @Builder.Default
    private Set<String> relatedPatternIds = new LinkedHashSet<>();

    @Enumerated(EnumType.STRING)
    @Builder.Default
    private TrendDirection trendDirection = TrendDirection.STABLE;

    private double changeRate;
    private boolean accelerating;

    private long forecastOccurrences;
    private double forecastConfidence;
    private long forecastPeriodHours;

    @Embedded
    @Builder.Default
    private BusinessImpact businessImpact = new BusinessImpact();

    private String assignedTo;

    @Column(columnDefinition = "TEXT")
    private String resolutionNotes;

    private LocalDateTime createdAt;
    private LocalDateTime lastAnalyzed;

    @Transient
    public double getTimespanHours() {
        if (firstOccurrence == null || lastOccurrence == null) {
            return 0.0;
        }
        return java.time.Duration.between(firstOccurrence, lastOccurrence).toMillis() / 3_600_000.0;
    }
}
