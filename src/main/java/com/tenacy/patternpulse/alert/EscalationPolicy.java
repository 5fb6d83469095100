package com.tenacy.patternpulse.alert;

import com.tenacy.patternpulse.config.PatternPulseProperties;
import com.tenacy.patternpulse.domain.AlertSeverity;
import com.tenacy.patternpulse.domain.PatternAlert;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDateTime;

@Component
@RequiredArgsConstructor
public class EscalationPolicy {

    private static final Duration FALLBACK_TIMEOUT = Duration.ofHours(8);

    private final PatternPulseProperties properties;

    public Duration timeout(AlertSeverity severity) {
        return properties.getEscalation().getTimeouts().getOrDefault(severity, FALLBACK_TIMEOUT);
    }

    public int maxLevel() {
        return properties.getEscalation().getMaxLevel();
    }

    /**
     * 기준 시각: max(lastEscalated 또는 createdAt, reactivatedAt)
     */
    public LocalDateTime baseline(PatternAlert alert) {
        LocalDateTime base = alert.getLastEscalated() != null ? alert.getLastEscalated() : alert.getCreatedAt();
        LocalDateTime reactivated = alert.getReactivatedAt();
        if (base == null) {
            return reactivated;
        }
        if (reactivated != null && reactivated.isAfter(base)) {
            return reactivated;
        }
        return base;
    }

    public boolean isDue(PatternAlert alert, LocalDateTime now) {
        if (!alert.getStatus().isEscalatable() || alert.getEscalationLevel() >= maxLevel()) {
            return false;
        }
        LocalDateTime base = baseline(alert);
        if (base == null) {
            return false;
        }
        return Duration.between(base, now).compareTo(timeout(alert.getSeverity())) > 0;
    }
}
