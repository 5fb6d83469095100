package com.tenacy.patternpulse.pattern.trend;

import lombok.Value;

@Value
public class PatternForecast {
    long predictedOccurrences;
    double confidence;
    double periodHours;
}
