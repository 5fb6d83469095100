package com.tenacy.patternpulse.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Embeddable
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SuppressionCondition {

    @Column(name = "condition_field")
    private String field;       // 예: application, severity, triggerCount

    @Enumerated(EnumType.STRING)
    @Column(name = "condition_operator")
    private SuppressionOperator operator;

    @Column(name = "condition_value")
    private String value;
}
