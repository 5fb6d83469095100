package com.tenacy.patternpulse.alert;

import com.tenacy.patternpulse.domain.AlertSeverity;
import com.tenacy.patternpulse.domain.PatternPriority;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AlertThresholdRule {

    private AlertSeverity severity;
    private PatternPriority minPriority;
    private double minConfidence;
    private int minOccurrences;
}
