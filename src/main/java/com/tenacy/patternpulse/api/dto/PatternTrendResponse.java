package com.tenacy.patternpulse.api.dto;

import com.tenacy.patternpulse.domain.TrendDirection;
import com.tenacy.patternpulse.pattern.trend.PatternForecast;
import com.tenacy.patternpulse.pattern.trend.TrendDataPoint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PatternTrendResponse {
    private String patternId;
    private List<TrendDataPoint> series;
    private double slope;
    private TrendDirection direction;
    private double changeRate;
    private boolean accelerating;
    private PatternForecast forecast;
}
