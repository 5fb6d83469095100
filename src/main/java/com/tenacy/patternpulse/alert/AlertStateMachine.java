package com.tenacy.patternpulse.alert;

import com.tenacy.patternpulse.domain.AlertSeverity;
import com.tenacy.patternpulse.domain.AlertStatus;
import com.tenacy.patternpulse.domain.PatternAlert;
import com.tenacy.patternpulse.domain.SuppressionRule;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * 알림 상태 전이 규칙. 엔티티를 직접 수정하지만 저장은 하지 않는다.
 *
 * <pre>
 * ACTIVE       -> ACKNOWLEDGED  (acknowledge)
 * ACTIVE       -> SUPPRESSED    (규칙 일치)
 * SUPPRESSED   -> ACTIVE        (억제 기간 경과 후 재발, 또는 규칙 만료/비활성/삭제)
 * ACTIVE|ACK   -> RESOLVED      (resolve, 비활성 패턴 자동 해결)
 * SUPPRESSED   -> RESOLVED      (명시적 resolve만)
 * </pre>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AlertStateMachine {

    private final EscalationPolicy escalationPolicy;

    public void acknowledge(PatternAlert alert, String actor, LocalDateTime now) {
        if (alert.getStatus() != AlertStatus.ACTIVE) {
            throw new IllegalAlertTransitionException(alert.getId(), alert.getStatus(), "acknowledge");
        }
        alert.setStatus(AlertStatus.ACKNOWLEDGED);
        alert.setAcknowledgedAt(now);
        alert.setAcknowledgedBy(actor);
    }

    public void resolve(PatternAlert alert, String actor, String notes, LocalDateTime now) {
        if (alert.getStatus() == AlertStatus.RESOLVED) {
            throw new IllegalAlertTransitionException(alert.getId(), alert.getStatus(), "resolve");
        }
        close(alert, actor, notes, now);
    }

    /**
     * 패턴 비활성으로 인한 자동 해결. SUPPRESSED 알림은 대상이 아니다.
     */
    public boolean autoResolve(PatternAlert alert, String notes, LocalDateTime now) {
        if (!alert.getStatus().isEscalatable()) {
            return false;
        }
        close(alert, "system", notes, now);
        return true;
    }

    public void suppress(PatternAlert alert, SuppressionRule rule, Duration defaultWindow, LocalDateTime now) {
        alert.setStatus(AlertStatus.SUPPRESSED);
        alert.setSuppressedAt(now);
        alert.setSuppressedByRuleId(rule.getId());
        alert.setSuppressUntil(suppressUntil(rule, defaultWindow, now));
    }

    public void retrigger(PatternAlert alert, AlertSeverity severity, LocalDateTime now) {
        alert.setTriggerCount(alert.getTriggerCount() + 1);
        alert.setLastTriggered(now);
        // 심각도는 올리기만 한다
        if (severity != null && severity.isHigherThan(alert.getSeverity())) {
            alert.setSeverity(severity);
        }
    }

    /**
     * 주기 점검 한 번. 상태별로 최대 하나의 전이만 일어난다.
     *
     * @param suppressingRule 현재 알림을 억제한 규칙의 최신 상태 (삭제되었으면 empty)
     * @param matchingRule    현재 알림/패턴에 일치하는 활성 규칙
     */
    public TickOutcome tick(PatternAlert alert,
                            Optional<SuppressionRule> suppressingRule,
                            Optional<SuppressionRule> matchingRule,
                            Duration defaultWindow,
                            LocalDateTime now) {
        switch (alert.getStatus()) {
            case SUPPRESSED:
                if (isReactivationDue(alert, suppressingRule, now)) {
                    reactivate(alert, now);
                    return TickOutcome.REACTIVATED;
                }
                log.debug("억제 중인 알림 점검 생략: {}", alert.getId());
                return TickOutcome.NONE;
            case RESOLVED:
                log.debug("해결된 알림 점검 생략: {}", alert.getId());
                return TickOutcome.NONE;
            case ACTIVE:
                if (matchingRule.isPresent()) {
                    suppress(alert, matchingRule.get(), defaultWindow, now);
                    return TickOutcome.SUPPRESSED;
                }
                break;
            default:
                break;
        }

        if (escalationPolicy.isDue(alert, now)) {
            alert.setEscalationLevel(alert.getEscalationLevel() + 1);
            alert.setLastEscalated(now);
            return TickOutcome.ESCALATED;
        }
        return TickOutcome.NONE;
    }

    boolean isReactivationDue(PatternAlert alert, Optional<SuppressionRule> suppressingRule, LocalDateTime now) {
        if (suppressingRule.isEmpty() || !suppressingRule.get().isEffective(now)) {
            return true;
        }
        LocalDateTime until = alert.getSuppressUntil();
        if (until == null || now.isBefore(until)) {
            return false;
        }
        // 재발 여부는 이벤트 시각이 아니라 재트리거된 시각으로 판단한다
        LocalDateTime suppressedAt = alert.getSuppressedAt();
        LocalDateTime lastTriggered = alert.getLastTriggered();
        return lastTriggered != null && (suppressedAt == null || lastTriggered.isAfter(suppressedAt));
    }

    private void reactivate(PatternAlert alert, LocalDateTime now) {
        alert.setStatus(AlertStatus.ACTIVE);
        alert.setReactivatedAt(now);
        alert.setSuppressUntil(null);
        alert.setSuppressedByRuleId(null);
    }

    private void close(PatternAlert alert, String actor, String notes, LocalDateTime now) {
        alert.setStatus(AlertStatus.RESOLVED);
        alert.setResolvedAt(now);
        alert.setResolvedBy(actor);
        alert.setResolutionNotes(notes);
        alert.setOpenPatternId(null);
    }

    static LocalDateTime suppressUntil(SuppressionRule rule, Duration defaultWindow, LocalDateTime now) {
        if (rule.getExpiresAt() != null) {
            return rule.getExpiresAt();
        }
        if (rule.getSuppressFor() != null) {
            return now.plus(rule.getSuppressFor());
        }
        return now.plus(defaultWindow);
    }
}
