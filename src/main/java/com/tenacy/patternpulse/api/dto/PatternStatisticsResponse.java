package com.tenacy.patternpulse.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PatternStatisticsResponse {
    private int timeframeHours;
    private long totalPatterns;
    private long totalOccurrences;
    private Map<String, Long> byStatus;
    private Map<String, Long> byPriority;
    private Map<String, Long> byType;
    private Map<String, Long> byCategory;
    private long increasingPatterns;
    private double totalRevenueImpact;
    private List<PatternResponse> topPatterns;
}
