package com.tenacy.patternpulse.notification;

import com.tenacy.patternpulse.config.PatternPulseProperties;
import com.tenacy.patternpulse.domain.AlertSeverity;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 심각도별 기본 수신자에 에스컬레이션 단계별 수신자를 누적해서 더한다.
 */
@Component
@RequiredArgsConstructor
public class RecipientResolver {

    private final PatternPulseProperties properties;

    public List<String> resolve(AlertSeverity severity, int escalationLevel) {
        PatternPulseProperties.Notification settings = properties.getNotification();
        Set<String> recipients = new LinkedHashSet<>(settings.getRecipients().getOrDefault(severity, List.of()));
        for (int level = 1; level <= escalationLevel; level++) {
            recipients.addAll(settings.getEscalationRecipients().getOrDefault(level, List.of()));
        }
        return new ArrayList<>(recipients);
    }
}
