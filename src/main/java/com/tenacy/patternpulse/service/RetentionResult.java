package com.tenacy.patternpulse.service;

import lombok.Value;

@Value
public class RetentionResult {
    int resolvedAlerts;
    int archivedPatterns;
    int deletedBuckets;
}
