package com.tenacy.patternpulse.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "suppression_rules")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SuppressionRule {

    @Id
    private String id;

    private String name;

    @Column(columnDefinition = "TEXT")
    private String description;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "suppression_conditions", joinColumns = @JoinColumn(name = "rule_id"))
    @OrderColumn(name = "condition_order")
    @Builder.Default
    private List<SuppressionCondition> conditions = new ArrayList<>();

    @Builder.Default
    private boolean active = true;

    private String createdBy;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
    private LocalDateTime expiresAt;

    // 매칭 시 suppressUntil 계산에 쓰이는 억제 기간 (없으면 기본값)
    private Duration suppressFor;

    private int timesTriggered;

    @Transient
    public boolean isExpired(LocalDateTime now) {
        return expiresAt != null && !expiresAt.isAfter(now);
    }

    @Transient
    public boolean isEffective(LocalDateTime now) {
        return active && !isExpired(now);
    }
}
