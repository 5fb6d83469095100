package com.tenacy.patternpulse.api.dto;

import com.tenacy.patternpulse.domain.SuppressionRule;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SuppressionRuleResponse {
    private String id;
    private String name;
    private String description;
    private List<SuppressionConditionDto> conditions;
    private boolean active;
    private String createdBy;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
    private LocalDateTime expiresAt;
    private Long suppressForMinutes;
    private int timesTriggered;

    public static SuppressionRuleResponse of(SuppressionRule rule) {
        return SuppressionRuleResponse.builder()
                .id(rule.getId())
                .name(rule.getName())
                .description(rule.getDescription())
                .conditions(rule.getConditions().stream().map(SuppressionConditionDto::of).toList())
                .active(rule.isActive())
                .createdBy(rule.getCreatedBy())
                .createdAt(rule.getCreatedAt())
                .updatedAt(rule.getUpdatedAt())
                .expiresAt(rule.getExpiresAt())
                .suppressForMinutes(rule.getSuppressFor() != null ? rule.getSuppressFor().toMinutes() : null)
                .timesTriggered(rule.getTimesTriggered())
                .build();
    }
}
