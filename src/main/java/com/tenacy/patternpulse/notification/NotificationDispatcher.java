package com.tenacy.patternpulse.notification;

import com.tenacy.patternpulse.domain.DeliveryStatus;
import com.tenacy.patternpulse.domain.PatternAlertRepository;
import com.tenacy.patternpulse.service.PatternMetricsService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 커밋이 끝난 상태 변경에 대해 활성화된 모든 채널로 알림을 보낸다.
 * 결과는 버전을 건드리지 않는 업데이트로 알림에 기록되며 재시도하지 않는다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NotificationDispatcher {

    private static final int MAX_ERROR_LENGTH = 500;

    private final List<NotificationChannel> channels;
    private final PatternAlertRepository alertRepository;
    private final PatternMetricsService metricsService;
    private final Clock clock;

    @Async("notificationTaskExecutor")
    public void dispatchAsync(AlertNotification notification) {
        dispatch(notification);
    }

    public DeliveryStatus dispatch(AlertNotification notification) {
        List<String> failedChannels = new ArrayList<>();
        int attempted = 0;

        for (NotificationChannel channel : channels) {
            if (!channel.isEnabled()) {
                continue;
            }
            attempted++;

            boolean delivered;
            try {
                delivered = channel.send(notification);
            } catch (RuntimeException e) {
                log.error("{} 채널 전송 중 예상치 못한 오류 - alertId: {}", channel.name(), notification.getAlertId(), e);
                delivered = false;
            }

            metricsService.recordDelivery(delivered);
            if (!delivered) {
                failedChannels.add(channel.name());
            }
        }

        if (attempted == 0) {
            log.debug("활성화된 알림 채널이 없습니다 - alertId: {}", notification.getAlertId());
            return DeliveryStatus.PENDING;
        }

        LocalDateTime now = LocalDateTime.now(clock);
        if (failedChannels.isEmpty()) {
            alertRepository.recordDelivery(notification.getAlertId(), DeliveryStatus.DELIVERED, now, 0, null);
            log.info("알림 전송 완료 - alertId: {}, kind: {}", notification.getAlertId(), notification.getKind());
            return DeliveryStatus.DELIVERED;
        }

        String error = truncate("전송 실패 채널: " + String.join(", ", failedChannels));
        alertRepository.recordDelivery(notification.getAlertId(), DeliveryStatus.FAILED, now, 1, error);
        log.warn("알림 전송 실패 - alertId: {}, {}", notification.getAlertId(), error);
        return DeliveryStatus.FAILED;
    }

    private static String truncate(String value) {
        return value.length() > MAX_ERROR_LENGTH ? value.substring(0, MAX_ERROR_LENGTH) : value;
    }
}
