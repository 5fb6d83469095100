package com.tenacy.patternpulse.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertStatisticsResponse {
    private int timeframeHours;
    private long totalAlerts;
    private long unresolvedAlerts;
    private Map<String, Long> byStatus;
    private Map<String, Long> bySeverity;
    private long escalatedAlerts;
    private double averageResolutionMinutes;
    private long deliveryFailures;
}
