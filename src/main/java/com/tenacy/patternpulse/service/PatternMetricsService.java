package com.tenacy.patternpulse.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Service;

@Service
public class PatternMetricsService {

    private final Counter importsCounter;
    private final Counter importedFactsCounter;
    private final Counter patternsCreatedCounter;
    private final Counter alertsCreatedCounter;
    private final Counter alertsSuppressedCounter;
    private final Counter alertsEscalatedCounter;
    private final Counter alertEvaluationFailuresCounter;
    private final Counter notificationsDeliveredCounter;
    private final Counter notificationsFailedCounter;

    public PatternMetricsService(MeterRegistry registry) {
        this.importsCounter = Counter.builder("patternpulse.imports.completed")
                .description("완료된 가져오기 배치 수")
                .register(registry);
        this.importedFactsCounter = Counter.builder("patternpulse.imports.facts")
                .description("가져온 에러 팩트 수")
                .register(registry);
        this.patternsCreatedCounter = Counter.builder("patternpulse.patterns.created")
                .description("새로 생성된 패턴 수")
                .register(registry);
        this.alertsCreatedCounter = Counter.builder("patternpulse.alerts.created")
                .description("생성된 알림 수")
                .register(registry);
        this.alertsSuppressedCounter = Counter.builder("patternpulse.alerts.suppressed")
                .description("억제된 알림 수")
                .register(registry);
        this.alertsEscalatedCounter = Counter.builder("patternpulse.alerts.escalated")
                .description("에스컬레이션 횟수")
                .register(registry);
        this.alertEvaluationFailuresCounter = Counter.builder("patternpulse.alerts.evaluation.failed")
                .description("가져오기 후 알림 평가 실패 수")
                .register(registry);
        this.notificationsDeliveredCounter = Counter.builder("patternpulse.notifications.delivered")
                .description("전송 성공한 알림 수")
                .register(registry);
        this.notificationsFailedCounter = Counter.builder("patternpulse.notifications.failed")
                .description("채널 전송 실패 수")
                .register(registry);
    }

    public void recordImport(int factCount, int createdPatterns) {
        importsCounter.increment();
        importedFactsCounter.increment(factCount);
        patternsCreatedCounter.increment(createdPatterns);
    }

    public void recordAlertCreated(boolean suppressed) {
        alertsCreatedCounter.increment();
        if (suppressed) {
            alertsSuppressedCounter.increment();
        }
    }

    public void recordAlertSuppressed() {
        alertsSuppressedCounter.increment();
    }

    public void recordEscalation() {
        alertsEscalatedCounter.increment();
    }

    public void recordAlertEvaluationFailure() {
        alertEvaluationFailuresCounter.increment();
    }

    public void recordDelivery(boolean success) {
        if (success) {
            notificationsDeliveredCounter.increment();
        } else {
            notificationsFailedCounter.increment();
        }
    }
}
