package com.tenacy.patternpulse.pattern.scoring;

import com.tenacy.patternpulse.domain.BusinessImpact;
import com.tenacy.patternpulse.domain.PatternPriority;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class PatternScore {

    double confidence;
    PatternPriority priority;
    int affectedUsers;
    double occurrenceRate;
    double revenueImpact;
    double csatScore;
    double serviceLevelImpact;

    public BusinessImpact toBusinessImpact() {
        return BusinessImpact.builder()
                .revenueImpact(revenueImpact)
                .csatScore(csatScore)
                .serviceLevelImpact(serviceLevelImpact)
                .build();
    }
}
