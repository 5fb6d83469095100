package com.tenacy.patternpulse.notification;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tenacy.patternpulse.config.PatternPulseProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 알림 이벤트를 Kafka 토픽으로 발행한다. 채팅/온콜 연동은 이 토픽을 구독한다.
 */
@Component
@Slf4j
public class KafkaNotificationChannel implements NotificationChannel {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final PatternPulseProperties properties;

    @Value("${patternpulse.kafka.topics.alert-notifications}")
    private String notificationTopic;

    @Value("${patternpulse.kafka.send-timeout-ms:10000}")
    private long sendTimeoutMs;

    public KafkaNotificationChannel(KafkaTemplate<String, String> kafkaTemplate,
                                    ObjectMapper objectMapper,
                                    PatternPulseProperties properties) {
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @Override
    public String name() {
        return "kafka";
    }

    @Override
    public boolean isEnabled() {
        return properties.getNotification().isKafkaEnabled();
    }

    @Override
    public boolean send(AlertNotification notification) {
        try {
            String payload = objectMapper.writeValueAsString(notification);
            kafkaTemplate.send(notificationTopic, notification.getAlertId(), payload)
                    .get(sendTimeoutMs, TimeUnit.MILLISECONDS);
            log.debug("Kafka 알림 발행 완료: {}", notification.getAlertId());
            return true;
        } catch (JsonProcessingException e) {
            log.error("알림 직렬화 실패: {}", notification.getAlertId(), e);
            return false;
        } catch (ExecutionException | TimeoutException e) {
            log.warn("Kafka 알림 발행 실패 - alertId: {}, 원인: {}", notification.getAlertId(), e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Kafka 알림 발행 중 인터럽트 - alertId: {}", notification.getAlertId());
            return false;
        }
    }
}
