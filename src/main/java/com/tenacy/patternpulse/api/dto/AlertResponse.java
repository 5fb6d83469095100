package com.tenacy.patternpulse.api.dto;

import com.tenacy.patternpulse.domain.AlertSeverity;
import com.tenacy.patternpulse.domain.AlertStatus;
import com.tenacy.patternpulse.domain.DeliveryStatus;
import com.tenacy.patternpulse.domain.PatternAlert;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertResponse {
    private String id;
    private String patternId;
    private String patternName;
    private String application;
    private String title;
    private String summary;
    private AlertSeverity severity;
    private AlertStatus status;
    private int escalationLevel;
    private LocalDateTime lastEscalated;
    private int triggerCount;
    private LocalDateTime lastTriggered;
    private LocalDateTime createdAt;
    private List<String> recipients;
    private LocalDateTime suppressUntil;
    private String suppressedByRuleId;
    private LocalDateTime reactivatedAt;
    private LocalDateTime acknowledgedAt;
    private String acknowledgedBy;
    private LocalDateTime resolvedAt;
    private String resolvedBy;
    private String resolutionNotes;
    private String dashboardUrl;
    private DeliveryStatus lastDeliveryStatus;
    private LocalDateTime lastDeliveryAt;
    private int deliveryFailures;
    private String lastDeliveryError;

    public static AlertResponse of(PatternAlert alert) {
        return AlertResponse.builder()
                .id(alert.getId())
                .patternId(alert.getPatternId())
                .patternName(alert.getPatternName())
                .application(alert.getApplication())
                .title(alert.getTitle())
                .summary(alert.getSummary())
                .severity(alert.getSeverity())
                .status(alert.getStatus())
                .escalationLevel(alert.getEscalationLevel())
                .lastEscalated(alert.getLastEscalated())
                .triggerCount(alert.getTriggerCount())
                .lastTriggered(alert.getLastTriggered())
                .createdAt(alert.getCreatedAt())
                .recipients(new ArrayList<>(alert.getRecipients()))
                .suppressUntil(alert.getSuppressUntil())
                .suppressedByRuleId(alert.getSuppressedByRuleId())
                .reactivatedAt(alert.getReactivatedAt())
                .acknowledgedAt(alert.getAcknowledgedAt())
                .acknowledgedBy(alert.getAcknowledgedBy())
                .resolvedAt(alert.getResolvedAt())
                .resolvedBy(alert.getResolvedBy())
                .resolutionNotes(alert.getResolutionNotes())
                .dashboardUrl(alert.getDashboardUrl())
                .lastDeliveryStatus(alert.getLastDeliveryStatus())
                .lastDeliveryAt(alert.getLastDeliveryAt())
                .deliveryFailures(alert.getDeliveryFailures())
                .lastDeliveryError(alert.getLastDeliveryError())
                .build();
    }
}
