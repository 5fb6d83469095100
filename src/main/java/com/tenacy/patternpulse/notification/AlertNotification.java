package com.tenacy.patternpulse.notification;

import com.tenacy.patternpulse.domain.AlertSeverity;
import com.tenacy.patternpulse.domain.PatternAlert;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class AlertNotification {

    String alertId;
    NotificationKind kind;
    String title;
    AlertSeverity severity;
    String summary;
    List<String> recipients;
    int escalationLevel;
    String dashboardUrl;

    public static AlertNotification of(PatternAlert alert, NotificationKind kind, List<String> recipients) {
        return AlertNotification.builder()
                .alertId(alert.getId())
                .kind(kind)
                .title(alert.getTitle())
                .severity(alert.getSeverity())
                .summary(alert.getSummary())
                .recipients(List.copyOf(recipients))
                .escalationLevel(alert.getEscalationLevel())
                .dashboardUrl(alert.getDashboardUrl())
                .build();
    }
}
