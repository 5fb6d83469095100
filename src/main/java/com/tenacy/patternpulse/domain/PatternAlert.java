package com.tenacy.patternpulse.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "pattern_alerts",
        uniqueConstraints = @UniqueConstraint(name = "uk_alerts_open_pattern", columnNames = "open_pattern_id"),
        indexes = {
                @Index(name = "idx_alerts_pattern", columnList = "patternId"),
                @Index(name = "idx_alerts_status", columnList = "status")
        })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PatternAlert {

    @Id
    private String id;

    @Version
    private Long version;

    @Column(nullable = false)
    private String patternId;

    // 미해결 상태인 동안만 patternId 값을 가진다. 패턴당 미해결 알림 1개를 DB 수준에서 보장
    @Column(name = "open_pattern_id")
    private String openPatternId;

    private String patternName;
    private String application;
    private String title;

    @Column(columnDefinition = "TEXT")
    private String summary;

    private String dashboardUrl;

    @Enumerated(EnumType.STRING)
    private AlertSeverity severity;

    @Enumerated(EnumType.STRING)
    @Builder.Default
    private AlertStatus status = AlertStatus.ACTIVE;

    private int escalationLevel;
    private LocalDateTime lastEscalated;

    @Builder.Default
    private int triggerCount = 1;
    private LocalDateTime lastTriggered;
    private LocalDateTime createdAt;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "alert_recipients", joinColumns = @JoinColumn(name = "alert_id"))
    @Column(name = "recipient")
    @Builder.Default
    private List<String> recipients = new ArrayList<>();

    private LocalDateTime suppressedAt;
    private LocalDateTime suppressUntil;
    private String suppressedByRuleId;
    private LocalDateTime reactivatedAt;

    private LocalDateTime acknowledgedAt;
    private String acknowledgedBy;

    private LocalDateTime resolvedAt;
    private String resolvedBy;

    @Column(columnDefinition = "TEXT")
    private String resolutionNotes;

    // 알림 전송 결과. recordDelivery 쿼리로만 갱신되며 엔티티 저장은 이 컬럼들을 쓰지 않는다
    @Enumerated(EnumType.STRING)
    @Column(updatable = false)
    @Builder.Default
    private DeliveryStatus lastDeliveryStatus = DeliveryStatus.PENDING;

    @Column(updatable = false)
    private LocalDateTime lastDeliveryAt;

    @Column(updatable = false)
    private int deliveryFailures;

    @Column(updatable = false)
    private String lastDeliveryError;

    @Transient
    public boolean isUnresolved() {
        return status != AlertStatus.RESOLVED;
    }
}
