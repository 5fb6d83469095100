package com.tenacy.patternpulse.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.test.context.ActiveProfiles;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

@DataJpaTest
@ActiveProfiles("test")
public class PatternAlertRepositoryTest {

    private static final LocalDateTime T = LocalDateTime.of(2024, 3, 1, 10, 0);

    @Autowired
    private PatternAlertRepository alertRepository;

    @Autowired
    private TestEntityManager entityManager;

    @Test
    @DisplayName("같은 패턴에 미해결 알림을 두 개 만들 수 없다")
    void openAlertIsUniquePerPattern() {
        // given
        alertRepository.saveAndFlush(alert("alert-1", "pattern-1", "pattern-1", AlertStatus.ACTIVE));

        // when & then
        assertThatThrownBy(() -> alertRepository.saveAndFlush(
                alert("alert-2", "pattern-1", "pattern-1", AlertStatus.ACTIVE)))
                .isInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    @DisplayName("해결된 알림은 같은 패턴에 여러 개 있을 수 있다")
    void resolvedAlertsDoNotCollide() {
        // given
        alertRepository.saveAndFlush(alert("alert-1", "pattern-1", null, AlertStatus.RESOLVED));
        alertRepository.saveAndFlush(alert("alert-2", "pattern-1", null, AlertStatus.RESOLVED));
        alertRepository.saveAndFlush(alert("alert-3", "pattern-1", "pattern-1", AlertStatus.ACTIVE));

        // when
        List<PatternAlert> alerts = alertRepository.findByPatternIdOrderByCreatedAtDesc("pattern-1");

        // then
        assertThat(alerts).hasSize(3);
        assertThat(alertRepository.findByOpenPatternId("pattern-1"))
                .map(PatternAlert::getId)
                .hasValue("alert-3");
    }

    @Test
    @DisplayName("오래된 버전으로 저장하면 낙관적 잠금 예외가 발생한다")
    void staleVersionIsRejected() {
        // given
        alertRepository.saveAndFlush(alert("alert-1", "pattern-1", "pattern-1", AlertStatus.ACTIVE));
        entityManager.clear();
        PatternAlert first = alertRepository.findById("alert-1").orElseThrow();
        entityManager.clear();
        PatternAlert stale = alertRepository.findById("alert-1").orElseThrow();
        entityManager.clear();

        first.setStatus(AlertStatus.ACKNOWLEDGED);
        alertRepository.saveAndFlush(first);
        entityManager.clear();

        // when & then
        stale.setStatus(AlertStatus.RESOLVED);
        assertThatThrownBy(() -> alertRepository.saveAndFlush(stale))
                .isInstanceOf(OptimisticLockingFailureException.class);
    }

    @Test
    @DisplayName("전송 결과 기록은 버전을 올리지 않는다")
    void recordDeliveryKeepsVersion() {
        // given
        PatternAlert saved = alertRepository.saveAndFlush(
                alert("alert-1", "pattern-1", "pattern-1", AlertStatus.ACTIVE));
        Long version = saved.getVersion();
        entityManager.clear();

        // when
        int updated = alertRepository.recordDelivery("alert-1", DeliveryStatus.FAILED, T.plusMinutes(1), 1, "email");
        entityManager.clear();

        // then
        PatternAlert reloaded = alertRepository.findById("alert-1").orElseThrow();
        assertThat(updated).isEqualTo(1);
        assertThat(reloaded.getLastDeliveryStatus()).isEqualTo(DeliveryStatus.FAILED);
        assertThat(reloaded.getDeliveryFailures()).isEqualTo(1);
        assertThat(reloaded.getLastDeliveryError()).isEqualTo("email");
        assertThat(reloaded.getVersion()).isEqualTo(version);
    }

    @Test
    @DisplayName("전송 결과 기록 전에 읽은 알림을 저장해도 기록된 전송 실패가 남는다")
    void staleSaveKeepsDeliveryOutcome() {
        // given
        alertRepository.saveAndFlush(alert("alert-1", "pattern-1", "pattern-1", AlertStatus.ACTIVE));
        entityManager.clear();
        PatternAlert readBeforeDelivery = alertRepository.findById("alert-1").orElseThrow();

        alertRepository.recordDelivery("alert-1", DeliveryStatus.FAILED, T.plusMinutes(1), 1, "email");

        // when
        readBeforeDelivery.setEscalationLevel(1);
        readBeforeDelivery.setLastEscalated(T.plusMinutes(16));
        alertRepository.saveAndFlush(readBeforeDelivery);
        entityManager.clear();

        // then
        PatternAlert reloaded = alertRepository.findById("alert-1").orElseThrow();
        assertEquals(1, reloaded.getEscalationLevel());
        assertEquals(DeliveryStatus.FAILED, reloaded.getLastDeliveryStatus());
        assertEquals(1, reloaded.getDeliveryFailures());
        assertEquals("email", reloaded.getLastDeliveryError());
    }

    @Test
    @DisplayName("분리된 오래된 사본을 병합해도 전송 결과를 덮어쓰지 않는다")
    void detachedMergeKeepsDeliveryOutcome() {
        // given
        alertRepository.saveAndFlush(alert("alert-1", "pattern-1", "pattern-1", AlertStatus.ACTIVE));
        entityManager.clear();
        PatternAlert detached = alertRepository.findById("alert-1").orElseThrow();
        entityManager.clear();

        alertRepository.recordDelivery("alert-1", DeliveryStatus.DELIVERED, T.plusMinutes(1), 0, null);
        entityManager.clear();

        // when
        detached.setStatus(AlertStatus.ACKNOWLEDGED);
        alertRepository.saveAndFlush(detached);
        entityManager.clear();

        // then
        PatternAlert reloaded = alertRepository.findById("alert-1").orElseThrow();
        assertEquals(AlertStatus.ACKNOWLEDGED, reloaded.getStatus());
        assertEquals(DeliveryStatus.DELIVERED, reloaded.getLastDeliveryStatus());
        assertEquals(T.plusMinutes(1), reloaded.getLastDeliveryAt());
    }

    @Test
    @DisplayName("검색 조건이 비어 있으면 모든 알림을 최신순으로 반환한다")
    void searchWithOptionalFilters() {
        // given
        PatternAlert older = alert("alert-1", "pattern-1", "pattern-1", AlertStatus.ACTIVE);
        PatternAlert newer = alert("alert-2", "pattern-2", null, AlertStatus.RESOLVED);
        newer.setCreatedAt(T.plusHours(1));
        newer.setSeverity(AlertSeverity.WARNING);
        alertRepository.saveAndFlush(older);
        alertRepository.saveAndFlush(newer);

        // when
        List<PatternAlert> all = alertRepository.search(null, null);
        List<PatternAlert> active = alertRepository.search(AlertStatus.ACTIVE, null);
        List<PatternAlert> warnings = alertRepository.search(null, AlertSeverity.WARNING);

        // then
        assertThat(all).extracting(PatternAlert::getId).containsExactly("alert-2", "alert-1");
        assertThat(active).extracting(PatternAlert::getId).containsExactly("alert-1");
        assertThat(warnings).extracting(PatternAlert::getId).containsExactly("alert-2");
    }

    private PatternAlert alert(String id, String patternId, String openPatternId, AlertStatus status) {
        return PatternAlert.builder()
                .id(id)
                .patternId(patternId)
                .openPatternId(openPatternId)
                .patternName("TimeoutException in Orders")
                .title("Pattern Alert: TimeoutException in Orders")
                .severity(AlertSeverity.CRITICAL)
                .status(status)
                .createdAt(T)
                .lastTriggered(T)
                .build();
    }
}
