package com.tenacy.patternpulse.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Embeddable
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BusinessImpact {

    @Column(name = "revenue_impact")
    private double revenueImpact;

    @Column(name = "csat_score")
    private double csatScore;

    @Column(name = "service_level_impact")
    private double serviceLevelImpact;
}
