package com.tenacy.patternpulse.pattern.trend;

import com.tenacy.patternpulse.domain.TrendDirection;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class PatternTrend {
    List<TrendDataPoint> series;
    double slope;
    TrendDirection direction;
    double changeRate;
    boolean accelerating;
    PatternForecast forecast;
}
