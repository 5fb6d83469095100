package com.tenacy.patternpulse.alert;

import com.tenacy.patternpulse.config.PatternPulseProperties;
import com.tenacy.patternpulse.domain.AlertSeverity;
import com.tenacy.patternpulse.domain.AlertStatus;
import com.tenacy.patternpulse.domain.ErrorPattern;
import com.tenacy.patternpulse.domain.PatternAlert;
import com.tenacy.patternpulse.domain.SuppressionRule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

public class AlertStateMachineTest {

    private static final LocalDateTime T = LocalDateTime.of(2024, 3, 1, 12, 0);
    private static final Duration WINDOW = Duration.ofHours(1);

    private AlertStateMachine stateMachine;
    private ErrorPattern pattern;

    @BeforeEach
    void setUp() {
        stateMachine = new AlertStateMachine(new EscalationPolicy(new PatternPulseProperties()));
        pattern = ErrorPattern.builder()
                .id("pattern-1")
                .lastOccurrence(T)
                .build();
    }

    @Test
    @DisplayName("CRITICAL 알림은 16분 뒤 점검에서 레벨 1로 에스컬레이션된다")
    void tickEscalatesAfterTimeout() {
        // given
        PatternAlert alert = alert(AlertStatus.ACTIVE, AlertSeverity.CRITICAL);

        // when
        TickOutcome early = stateMachine.tick(alert, Optional.empty(), Optional.empty(), WINDOW, T.plusMinutes(15));
        TickOutcome outcome = stateMachine.tick(alert, Optional.empty(), Optional.empty(), WINDOW, T.plusMinutes(16));

        // then
        assertThat(early).isEqualTo(TickOutcome.NONE);
        assertThat(outcome).isEqualTo(TickOutcome.ESCALATED);
        assertThat(alert.getEscalationLevel()).isEqualTo(1);
        assertThat(alert.getLastEscalated()).isEqualTo(T.plusMinutes(16));
    }

    @Test
    @DisplayName("에스컬레이션 레벨은 최대 3을 넘지 않는다")
    void tickStopsAtMaxLevel() {
        PatternAlert alert = alert(AlertStatus.ACKNOWLEDGED, AlertSeverity.EMERGENCY);

        LocalDateTime now = T;
        for (int i = 0; i < 10; i++) {
            now = now.plusMinutes(6);
            stateMachine.tick(alert, Optional.empty(), Optional.empty(), WINDOW, now);
        }

        assertThat(alert.getEscalationLevel()).isEqualTo(3);
    }

    @Test
    @DisplayName("억제 기간이 남은 알림은 점검해도 바뀌지 않는다")
    void tickLeavesSuppressedAlertUntilExpiry() {
        SuppressionRule rule = rule(null);
        PatternAlert alert = alert(AlertStatus.SUPPRESSED, AlertSeverity.CRITICAL);
        alert.setSuppressedAt(T);
        alert.setSuppressUntil(T.plusHours(1));
        alert.setSuppressedByRuleId(rule.getId());
        alert.setLastTriggered(T.plusMinutes(30));

        TickOutcome outcome = stateMachine.tick(alert, Optional.of(rule), Optional.of(rule), WINDOW, T.plusMinutes(40));

        assertThat(outcome).isEqualTo(TickOutcome.NONE);
        assertThat(alert.getStatus()).isEqualTo(AlertStatus.SUPPRESSED);
        assertThat(alert.getEscalationLevel()).isZero();
    }

    @Test
    @DisplayName("억제 기간이 지나고 패턴이 재발했으면 다시 ACTIVE가 된다")
    void tickReactivatesAfterRecurrence() {
        SuppressionRule rule = rule(null);
        PatternAlert alert = alert(AlertStatus.SUPPRESSED, AlertSeverity.CRITICAL);
        alert.setSuppressedAt(T);
        alert.setSuppressUntil(T.plusHours(1));
        alert.setSuppressedByRuleId(rule.getId());
        alert.setLastTriggered(T.plusMinutes(70));

        TickOutcome outcome = stateMachine.tick(alert, Optional.of(rule), Optional.of(rule), WINDOW, T.plusMinutes(75));

        assertThat(outcome).isEqualTo(TickOutcome.REACTIVATED);
        assertThat(alert.getStatus()).isEqualTo(AlertStatus.ACTIVE);
        assertThat(alert.getReactivatedAt()).isEqualTo(T.plusMinutes(75));
        assertThat(alert.getSuppressUntil()).isNull();
        assertThat(alert.getSuppressedByRuleId()).isNull();
    }

    @Test
    @DisplayName("억제 기간이 지났어도 재발이 없으면 억제를 유지한다")
    void tickKeepsSuppressionWithoutRecurrence() {
        SuppressionRule rule = rule(null);
        PatternAlert alert = alert(AlertStatus.SUPPRESSED, AlertSeverity.CRITICAL);
        alert.setSuppressedAt(T);
        alert.setSuppressUntil(T.plusHours(1));
        alert.setLastTriggered(T.minusMinutes(5));

        TickOutcome outcome = stateMachine.tick(alert, Optional.of(rule), Optional.of(rule), WINDOW, T.plusHours(3));

        assertThat(outcome).isEqualTo(TickOutcome.NONE);
        assertThat(alert.getStatus()).isEqualTo(AlertStatus.SUPPRESSED);
    }

    @Test
    @DisplayName("발생 시각이 늦게 들어온 재발도 억제 이후 재트리거되었으면 재활성화한다")
    void tickReactivatesOnRetriggerDuringSuppression() {
        // given
        SuppressionRule rule = rule(null);
        PatternAlert alert = alert(AlertStatus.SUPPRESSED, AlertSeverity.CRITICAL);
        alert.setSuppressedAt(T);
        alert.setSuppressUntil(T.plusHours(1));
        alert.setSuppressedByRuleId(rule.getId());
        // 지연된 가져오기로 억제 이전 시각의 팩트가 억제 중에 들어와 재트리거됨
        stateMachine.retrigger(alert, AlertSeverity.CRITICAL, T.plusMinutes(50));

        // when
        TickOutcome outcome = stateMachine.tick(alert, Optional.of(rule), Optional.of(rule), WINDOW, T.plusMinutes(65));

        // then
        assertEquals(TickOutcome.REACTIVATED, outcome);
        assertEquals(AlertStatus.ACTIVE, alert.getStatus());
        assertEquals(2, alert.getTriggerCount());
    }

    @Test
    @DisplayName("억제 규칙이 삭제되거나 비활성화되면 즉시 재활성화한다")
    void tickReactivatesWhenRuleGone() {
        PatternAlert deleted = alert(AlertStatus.SUPPRESSED, AlertSeverity.WARNING);
        deleted.setSuppressedAt(T);
        deleted.setSuppressUntil(T.plusHours(1));
        SuppressionRule inactive = rule(null);
        inactive.setActive(false);
        PatternAlert disabled = alert(AlertStatus.SUPPRESSED, AlertSeverity.WARNING);
        disabled.setSuppressedAt(T);
        disabled.setSuppressUntil(T.plusHours(1));

        assertThat(stateMachine.tick(deleted, Optional.empty(), Optional.empty(), WINDOW, T.plusMinutes(1)))
                .isEqualTo(TickOutcome.REACTIVATED);
        assertThat(stateMachine.tick(disabled, Optional.of(inactive), Optional.empty(), WINDOW, T.plusMinutes(1)))
                .isEqualTo(TickOutcome.REACTIVATED);
    }

    @Test
    @DisplayName("재활성화 후 에스컬레이션 기준 시각은 재활성화 시각이다")
    void escalationBaselineAfterReactivation() {
        PatternAlert alert = alert(AlertStatus.SUPPRESSED, AlertSeverity.CRITICAL);
        alert.setSuppressedAt(T);
        alert.setSuppressUntil(T.plusHours(1));

        stateMachine.tick(alert, Optional.empty(), Optional.empty(), WINDOW, T.plusHours(2));
        TickOutcome soon = stateMachine.tick(alert, Optional.empty(), Optional.empty(), WINDOW, T.plusHours(2).plusMinutes(10));
        TickOutcome later = stateMachine.tick(alert, Optional.empty(), Optional.empty(), WINDOW, T.plusHours(2).plusMinutes(16));

        assertThat(soon).isEqualTo(TickOutcome.NONE);
        assertThat(later).isEqualTo(TickOutcome.ESCALATED);
    }

    @Test
    @DisplayName("일치하는 규칙이 있는 ACTIVE 알림은 억제된다")
    void tickSuppressesActiveAlert() {
        SuppressionRule rule = rule(Duration.ofMinutes(30));
        PatternAlert alert = alert(AlertStatus.ACTIVE, AlertSeverity.CRITICAL);

        TickOutcome outcome = stateMachine.tick(alert, Optional.empty(), Optional.of(rule), WINDOW, T.plusMinutes(20));

        assertThat(outcome).isEqualTo(TickOutcome.SUPPRESSED);
        assertThat(alert.getStatus()).isEqualTo(AlertStatus.SUPPRESSED);
        assertThat(alert.getSuppressedAt()).isEqualTo(T.plusMinutes(20));
        assertThat(alert.getSuppressUntil()).isEqualTo(T.plusMinutes(50));
        assertThat(alert.getEscalationLevel()).isZero();
    }

    @Test
    @DisplayName("억제 종료 시각은 규칙 만료, 규칙 기간, 기본 기간 순으로 정한다")
    void suppressUntilPrecedence() {
        SuppressionRule expiring = rule(Duration.ofMinutes(30));
        expiring.setExpiresAt(T.plusDays(1));

        assertThat(AlertStateMachine.suppressUntil(expiring, WINDOW, T)).isEqualTo(T.plusDays(1));
        assertThat(AlertStateMachine.suppressUntil(rule(Duration.ofMinutes(30)), WINDOW, T)).isEqualTo(T.plusMinutes(30));
        assertThat(AlertStateMachine.suppressUntil(rule(null), WINDOW, T)).isEqualTo(T.plusHours(1));
    }

    @Test
    @DisplayName("ACTIVE 알림만 확인 처리할 수 있다")
    void acknowledge() {
        PatternAlert alert = alert(AlertStatus.ACTIVE, AlertSeverity.INFO);

        stateMachine.acknowledge(alert, "oncall", T);

        assertThat(alert.getStatus()).isEqualTo(AlertStatus.ACKNOWLEDGED);
        assertThat(alert.getAcknowledgedBy()).isEqualTo("oncall");
        assertThatThrownBy(() -> stateMachine.acknowledge(alert, "oncall", T))
                .isInstanceOf(IllegalAlertTransitionException.class);
    }

    @Test
    @DisplayName("해결하면 미해결 슬롯을 비우고 다시 해결할 수 없다")
    void resolve() {
        PatternAlert alert = alert(AlertStatus.SUPPRESSED, AlertSeverity.INFO);

        stateMachine.resolve(alert, "oncall", "배포 롤백", T);

        assertThat(alert.getStatus()).isEqualTo(AlertStatus.RESOLVED);
        assertThat(alert.getOpenPatternId()).isNull();
        assertThat(alert.getResolutionNotes()).isEqualTo("배포 롤백");
        assertThatThrownBy(() -> stateMachine.resolve(alert, "oncall", null, T))
                .isInstanceOf(IllegalAlertTransitionException.class);
    }

    @Test
    @DisplayName("자동 해결은 억제된 알림을 건드리지 않는다")
    void autoResolveSkipsSuppressed() {
        PatternAlert suppressed = alert(AlertStatus.SUPPRESSED, AlertSeverity.INFO);
        PatternAlert acknowledged = alert(AlertStatus.ACKNOWLEDGED, AlertSeverity.INFO);

        assertThat(stateMachine.autoResolve(suppressed, "비활성", T)).isFalse();
        assertThat(stateMachine.autoResolve(acknowledged, "비활성", T)).isTrue();
        assertThat(suppressed.getStatus()).isEqualTo(AlertStatus.SUPPRESSED);
        assertThat(acknowledged.getResolvedBy()).isEqualTo("system");
    }

    @Test
    @DisplayName("재발 시 심각도는 올라가기만 한다")
    void retriggerOnlyRaisesSeverity() {
        PatternAlert alert = alert(AlertStatus.ACTIVE, AlertSeverity.CRITICAL);

        stateMachine.retrigger(alert, AlertSeverity.WARNING, T.plusMinutes(1));
        assertThat(alert.getSeverity()).isEqualTo(AlertSeverity.CRITICAL);

        stateMachine.retrigger(alert, AlertSeverity.EMERGENCY, T.plusMinutes(2));
        assertThat(alert.getSeverity()).isEqualTo(AlertSeverity.EMERGENCY);
        assertThat(alert.getTriggerCount()).isEqualTo(3);
        assertThat(alert.getLastTriggered()).isEqualTo(T.plusMinutes(2));
    }

    private PatternAlert alert(AlertStatus status, AlertSeverity severity) {
        return PatternAlert.builder()
                .id("alert-1")
                .patternId(pattern.getId())
                .openPatternId(pattern.getId())
                .severity(severity)
                .status(status)
                .createdAt(T)
                .lastTriggered(T)
                .build();
    }

    private static SuppressionRule rule(Duration suppressFor) {
        return SuppressionRule.builder()
                .id("rule-1")
                .name("주문 서비스 점검")
                .suppressFor(suppressFor)
                .build();
    }
}
