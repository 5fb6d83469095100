package com.tenacy.patternpulse.pattern.trend;

import lombok.Value;

import java.time.LocalDateTime;

@Value
public class TrendDataPoint {
    LocalDateTime bucketStart;
    int count;
}
