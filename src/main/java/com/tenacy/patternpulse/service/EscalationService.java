package com.tenacy.patternpulse.service;

import com.tenacy.patternpulse.notification.AlertNotification;
import com.tenacy.patternpulse.notification.NotificationDispatcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * 미해결 알림을 주기적으로 점검한다. 반복 실행해도 시간이 흐르지 않았다면 변화가 없다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EscalationService {

    private final AlertService alertService;
    private final NotificationDispatcher notificationDispatcher;

    @Scheduled(fixedDelayString = "${patternpulse.escalation.check-interval-ms:300000}",
            initialDelayString = "${patternpulse.escalation.check-interval-ms:300000}")
    public void scheduledCheck() {
        try {
            checkAlerts();
        } catch (Exception e) {
            log.error("에스컬레이션 점검 실패: {}", e.getMessage(), e);
        }
    }

    /**
     * @return 이번 주기에 발송 요청된 에스컬레이션 알림 수
     */
    public int checkAlerts() {
        List<String> alertIds = alertService.findUnresolvedAlertIds();
        log.debug("에스컬레이션 점검 대상: {}개", alertIds.size());

        int escalated = 0;
        for (String alertId : alertIds) {
            try {
                Optional<AlertNotification> notification = alertService.tick(alertId);
                if (notification.isPresent()) {
                    notificationDispatcher.dispatchAsync(notification.get());
                    escalated++;
                }
            } catch (OptimisticLockingFailureException e) {
                log.debug("동시 수정으로 이번 주기에서 제외: {}", alertId);
            } catch (Exception e) {
                log.error("알림 점검 실패 - {}: {}", alertId, e.getMessage(), e);
            }
        }

        if (escalated > 0) {
            log.info("에스컬레이션 점검 완료 - {}건 에스컬레이션", escalated);
        }
        return escalated;
    }
}
