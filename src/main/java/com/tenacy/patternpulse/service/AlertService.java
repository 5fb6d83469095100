package com.tenacy.patternpulse.service;

import com.tenacy.patternpulse.alert.AlertStateMachine;
import com.tenacy.patternpulse.alert.AlertThresholdPolicy;
import com.tenacy.patternpulse.alert.SuppressionSubject;
import com.tenacy.patternpulse.alert.TickOutcome;
import com.tenacy.patternpulse.api.dto.AlertResponse;
import com.tenacy.patternpulse.api.dto.AlertStatisticsResponse;
import com.tenacy.patternpulse.config.PatternPulseProperties;
import com.tenacy.patternpulse.domain.AlertSeverity;
import com.tenacy.patternpulse.domain.AlertStatus;
import com.tenacy.patternpulse.domain.DeliveryStatus;
import com.tenacy.patternpulse.domain.ErrorPattern;
import com.tenacy.patternpulse.domain.ErrorPatternRepository;
import com.tenacy.patternpulse.domain.PatternAlert;
import com.tenacy.patternpulse.domain.PatternAlertRepository;
import com.tenacy.patternpulse.domain.SuppressionRule;
import com.tenacy.patternpulse.exception.AlertNotFoundException;
import com.tenacy.patternpulse.exception.PatternNotFoundException;
import com.tenacy.patternpulse.notification.AlertNotification;
import com.tenacy.patternpulse.notification.NotificationKind;
import com.tenacy.patternpulse.notification.RecipientResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.TreeMap;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * 알림 생성, 중복 제거, 확인/해결, 주기 점검.
 * 상태를 바꾸는 메서드는 각각 하나의 트랜잭션이며, 보낼 알림이 있으면 돌려준다.
 * 알림 전송은 호출자가 커밋 이후에 수행한다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@Transactional(readOnly = true)
public class AlertService {

    private final PatternAlertRepository alertRepository;
    private final ErrorPatternRepository patternRepository;
    private final AlertThresholdPolicy thresholdPolicy;
    private final AlertStateMachine stateMachine;
    private final AlertSuppressionService suppressionService;
    private final RecipientResolver recipientResolver;
    private final PatternMetricsService metricsService;
    private final PatternPulseProperties properties;
    private final Clock clock;

    /**
     * 패턴의 현재 점수로 알림을 만들거나 기존 미해결 알림을 재트리거한다.
     * 동시 생성으로 유니크 제약 위반이 나면 DataIntegrityViolationException이 전파되고,
     * 호출자가 다시 호출하면 재트리거로 처리된다.
     */
    @Transactional
    public Optional<AlertNotification> evaluate(String patternId) {
        ErrorPattern pattern = patternRepository.findById(patternId)
                .orElseThrow(() -> new PatternNotFoundException(patternId));

        Optional<AlertSeverity> severity = thresholdPolicy.evaluate(pattern);
        if (severity.isEmpty()) {
            log.debug("알림 임계값 미달 - pattern: {}, priority: {}, confidence: {}",
                    pattern.getName(), pattern.getPriority(), pattern.getConfidence());
            return Optional.empty();
        }

        LocalDateTime now = LocalDateTime.now(clock);
        Optional<PatternAlert> open = alertRepository.findByOpenPatternId(patternId);
        if (open.isPresent()) {
            PatternAlert alert = open.get();
            stateMachine.retrigger(alert, severity.get(), now);
            alertRepository.save(alert);
            log.debug("기존 알림 재트리거 - alert: {}, triggerCount: {}", alert.getId(), alert.getTriggerCount());
            return Optional.empty();
        }

        PatternAlert alert = newAlert(pattern, severity.get(), now);

        Optional<SuppressionRule> rule = suppressionService.findMatchingRule(SuppressionSubject.of(alert, pattern), now);
        rule.ifPresent(r -> {
            stateMachine.suppress(alert, r, properties.getAlerting().getDefaultSuppressionWindow(), now);
            suppressionService.recordTrigger(r.getId());
        });

        alertRepository.saveAndFlush(alert);
        metricsService.recordAlertCreated(rule.isPresent());

        if (rule.isPresent()) {
            log.info("알림 생성 즉시 억제 - alert: {}, rule: {}, until: {}",
                    alert.getId(), rule.get().getName(), alert.getSuppressUntil());
            return Optional.empty();
        }

        log.info("새 알림 생성 - [{}] {}", alert.getSeverity(), alert.getTitle());
        return Optional.of(AlertNotification.of(alert, NotificationKind.CREATED, alert.getRecipients()));
    }

    /**
     * 주기 점검: 재활성화, 억제, 에스컬레이션 중 하나를 적용한다.
     */
    @Transactional
    public Optional<AlertNotification> tick(String alertId) {
        PatternAlert alert = findAlert(alertId);
        ErrorPattern pattern = patternRepository.findById(alert.getPatternId()).orElse(null);
        LocalDateTime now = LocalDateTime.now(clock);

        Optional<SuppressionRule> suppressingRule = suppressionService.findRuleById(alert.getSuppressedByRuleId());
        Optional<SuppressionRule> matchingRule = alert.getStatus() == AlertStatus.ACTIVE && pattern != null
                ? suppressionService.findMatchingRule(SuppressionSubject.of(alert, pattern), now)
                : Optional.empty();

        TickOutcome outcome = stateMachine.tick(alert, suppressingRule, matchingRule,
                properties.getAlerting().getDefaultSuppressionWindow(), now);
        if (!outcome.changed()) {
            return Optional.empty();
        }

        Optional<AlertNotification> notification = Optional.empty();
        switch (outcome) {
            case SUPPRESSED:
                suppressionService.recordTrigger(alert.getSuppressedByRuleId());
                metricsService.recordAlertSuppressed();
                log.info("알림 억제 - alert: {}, until: {}", alert.getId(), alert.getSuppressUntil());
                break;
            case REACTIVATED:
                log.info("억제된 알림 재활성화 - alert: {}", alert.getId());
                break;
            case ESCALATED:
                alert.setRecipients(recipientResolver.resolve(alert.getSeverity(), alert.getEscalationLevel()));
                metricsService.recordEscalation();
                log.warn("알림 에스컬레이션 - [{}] {} -> level {}",
                        alert.getSeverity(), alert.getTitle(), alert.getEscalationLevel());
                notification = Optional.of(AlertNotification.of(alert, NotificationKind.ESCALATED, alert.getRecipients()));
                break;
            default:
                break;
        }

        alertRepository.saveAndFlush(alert);
        return notification;
    }

    @Transactional
    public AlertResponse acknowledge(String alertId, String actor) {
        PatternAlert alert = findAlert(alertId);
        stateMachine.acknowledge(alert, actorOrSystem(actor), LocalDateTime.now(clock));
        log.info("알림 확인 - alert: {}, by: {}", alertId, alert.getAcknowledgedBy());
        return AlertResponse.of(alertRepository.saveAndFlush(alert));
    }

    @Transactional
    public AlertResponse resolve(String alertId, String actor, String notes) {
        PatternAlert alert = findAlert(alertId);
        stateMachine.resolve(alert, actorOrSystem(actor), notes, LocalDateTime.now(clock));
        log.info("알림 해결 - alert: {}, by: {}", alertId, alert.getResolvedBy());
        return AlertResponse.of(alertRepository.saveAndFlush(alert));
    }

    /**
     * 패턴 비활성으로 인한 자동 해결. 상태가 이미 바뀌었으면 false.
     */
    @Transactional
    public boolean autoResolve(String alertId, String notes) {
        PatternAlert alert = findAlert(alertId);
        boolean resolved = stateMachine.autoResolve(alert, notes, LocalDateTime.now(clock));
        if (resolved) {
            alertRepository.saveAndFlush(alert);
            log.info("비활성 패턴 알림 자동 해결 - alert: {}", alertId);
        }
        return resolved;
    }

    public List<AlertResponse> retrieveAlerts(AlertStatus status, AlertSeverity severity) {
        return alertRepository.search(status, severity).stream()
                .map(AlertResponse::of)
                .toList();
    }

    public AlertResponse retrieveAlert(String alertId) {
        return AlertResponse.of(findAlert(alertId));
    }

    public List<String> findUnresolvedAlertIds() {
        return alertRepository.findByStatusIn(AlertStatus.UNRESOLVED).stream()
                .map(PatternAlert::getId)
                .toList();
    }

    public AlertStatisticsResponse statistics(int timeframeHours) {
        LocalDateTime since = LocalDateTime.now(clock).minusHours(timeframeHours);
        List<PatternAlert> alerts = alertRepository.findByCreatedAtGreaterThanEqual(since);

        Map<String, Long> byStatus = alerts.stream()
                .collect(Collectors.groupingBy(a -> a.getStatus().name(), TreeMap::new, Collectors.counting()));
        Map<String, Long> bySeverity = alerts.stream()
                .collect(Collectors.groupingBy(a -> a.getSeverity().name(), TreeMap::new, Collectors.counting()));

        OptionalDouble averageResolution = alerts.stream()
                .filter(a -> a.getResolvedAt() != null && a.getCreatedAt() != null)
                .mapToDouble(a -> Duration.between(a.getCreatedAt(), a.getResolvedAt()).toSeconds() / 60.0)
                .average();

        return AlertStatisticsResponse.builder()
                .timeframeHours(timeframeHours)
                .totalAlerts(alerts.size())
                .unresolvedAlerts(alerts.stream().filter(PatternAlert::isUnresolved).count())
                .byStatus(byStatus)
                .bySeverity(bySeverity)
                .escalatedAlerts(alerts.stream().filter(a -> a.getEscalationLevel() > 0).count())
                .averageResolutionMinutes(averageResolution.orElse(0))
                .deliveryFailures(alerts.stream().filter(a -> a.getLastDeliveryStatus() == DeliveryStatus.FAILED).count())
                .build();
    }

    private PatternAlert newAlert(ErrorPattern pattern, AlertSeverity severity, LocalDateTime now) {
        String id = UUID.randomUUID().toString();
        return PatternAlert.builder()
                .id(id)
                .patternId(pattern.getId())
                .openPatternId(pattern.getId())
                .patternName(pattern.getName())
                .application(pattern.getApplicationName())
                .title(pattern.getName())
                .summary(summary(pattern))
                .severity(severity)
                .status(AlertStatus.ACTIVE)
                .triggerCount(1)
                .lastTriggered(now)
                .createdAt(now)
                .recipients(recipientResolver.resolve(severity, 0))
                .dashboardUrl(properties.getAlerting().getDashboardBaseUrl() + "/" + id)
                .build();
    }

    private String summary(ErrorPattern pattern) {
        return String.format("%s 패턴이 %d회 발생했습니다 (시간당 %.2f회, 우선순위 %s, 신뢰도 %.2f). 영향 사용자 약 %d명. 최근 메시지: %s",
                pattern.getName(),
                pattern.getOccurrenceCount(),
                pattern.getOccurrenceRate(),
                pattern.getPriority(),
                pattern.getConfidence(),
                pattern.getAffectedUsers(),
                pattern.getDescription());
    }

    private PatternAlert findAlert(String alertId) {
        return alertRepository.findById(alertId)
                .orElseThrow(() -> new AlertNotFoundException(alertId));
    }

    private static String actorOrSystem(String actor) {
        return actor == null || actor.isBlank() ? "system" : actor;
    }
}
