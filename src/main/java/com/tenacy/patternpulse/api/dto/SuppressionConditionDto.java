package com.tenacy.patternpulse.api.dto;

import com.tenacy.patternpulse.domain.SuppressionCondition;
import com.tenacy.patternpulse.domain.SuppressionOperator;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SuppressionConditionDto {
    private String field;
    private SuppressionOperator operator;
    private String value;

    public static SuppressionConditionDto of(SuppressionCondition condition) {
        return new SuppressionConditionDto(condition.getField(), condition.getOperator(), condition.getValue());
    }

    public SuppressionCondition toCondition() {
        return new SuppressionCondition(field, operator, value);
    }
}
