package com.tenacy.patternpulse.api.dto;

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
public class SuppressionRuleRequest {
    private String name;
    private String description;
    @Builder.Default
    private List<SuppressionConditionDto> conditions = new ArrayList<>();
    private Boolean active;
    private String createdBy;
    private LocalDateTime expiresAt;
    private Long suppressForMinutes;
}
