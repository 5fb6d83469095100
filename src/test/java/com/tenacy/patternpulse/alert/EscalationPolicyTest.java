package com.tenacy.patternpulse.alert;

import com.tenacy.patternpulse.config.PatternPulseProperties;
import com.tenacy.patternpulse.domain.AlertSeverity;
import com.tenacy.patternpulse.domain.AlertStatus;
import com.tenacy.patternpulse.domain.PatternAlert;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;

public class EscalationPolicyTest {

    private static final LocalDateTime T = LocalDateTime.of(2024, 3, 1, 12, 0);

    private final EscalationPolicy policy = new EscalationPolicy(new PatternPulseProperties());

    @Test
    @DisplayName("심각도별 타임아웃")
    void timeouts() {
        assertThat(policy.timeout(AlertSeverity.EMERGENCY)).isEqualTo(Duration.ofMinutes(5));
        assertThat(policy.timeout(AlertSeverity.CRITICAL)).isEqualTo(Duration.ofMinutes(15));
        assertThat(policy.timeout(AlertSeverity.WARNING)).isEqualTo(Duration.ofHours(2));
        assertThat(policy.timeout(AlertSeverity.INFO)).isEqualTo(Duration.ofHours(8));
    }

    @Test
    @DisplayName("타임아웃을 정확히 채운 시점에는 아직 에스컬레이션하지 않는다")
    void isDueStrictlyAfterTimeout() {
        PatternAlert alert = alert(AlertStatus.ACTIVE, 0);

        assertThat(policy.isDue(alert, T.plusMinutes(15))).isFalse();
        assertThat(policy.isDue(alert, T.plusMinutes(15).plusSeconds(1))).isTrue();
    }

    @Test
    @DisplayName("억제, 해결 상태나 최대 레벨이면 대상이 아니다")
    void isDueRequiresEscalatableState() {
        assertThat(policy.isDue(alert(AlertStatus.SUPPRESSED, 0), T.plusDays(1))).isFalse();
        assertThat(policy.isDue(alert(AlertStatus.RESOLVED, 0), T.plusDays(1))).isFalse();
        assertThat(policy.isDue(alert(AlertStatus.ACKNOWLEDGED, 3), T.plusDays(1))).isFalse();
        assertThat(policy.isDue(alert(AlertStatus.ACKNOWLEDGED, 2), T.plusDays(1))).isTrue();
    }

    @Test
    @DisplayName("기준 시각은 마지막 에스컬레이션과 재활성화 중 늦은 쪽")
    void baseline() {
        PatternAlert alert = alert(AlertStatus.ACTIVE, 1);
        alert.setLastEscalated(T.plusMinutes(20));
        assertThat(policy.baseline(alert)).isEqualTo(T.plusMinutes(20));

        alert.setReactivatedAt(T.plusMinutes(50));
        assertThat(policy.baseline(alert)).isEqualTo(T.plusMinutes(50));
    }

    private static PatternAlert alert(AlertStatus status, int level) {
        return PatternAlert.builder()
                .id("alert-1")
                .severity(AlertSeverity.CRITICAL)
                .status(status)
                .escalationLevel(level)
                .createdAt(T)
                .build();
    }
}
