package com.tenacy.patternpulse.alert;

import com.tenacy.patternpulse.config.PatternPulseProperties;
import com.tenacy.patternpulse.domain.AlertSeverity;
import com.tenacy.patternpulse.domain.ErrorPattern;
import com.tenacy.patternpulse.domain.PatternStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * 패턴이 알림을 만들 만한지 판단하고, 만든다면 어떤 심각도인지 결정한다.
 */
@Component
@RequiredArgsConstructor
public class AlertThresholdPolicy {

    private static final Set<PatternStatus> SILENT_STATUSES =
            EnumSet.of(PatternStatus.IGNORED, PatternStatus.RESOLVED, PatternStatus.ARCHIVED);

    private final PatternPulseProperties properties;

    public Optional<AlertSeverity> evaluate(ErrorPattern pattern) {
        if (pattern.getStatus() == null || SILENT_STATUSES.contains(pattern.getStatus())) {
            return Optional.empty();
        }

        for (AlertThresholdRule rule : properties.getAlerting().getThresholds()) {
            if (pattern.getPriority().isAtLeast(rule.getMinPriority())
                    && pattern.getConfidence() >= rule.getMinConfidence()
                    && pattern.getOccurrenceCount() >= rule.getMinOccurrences()) {
                return Optional.of(rule.getSeverity());
            }
        }
        return Optional.empty();
    }
}
