package com.tenacy.patternpulse.notification;

import com.tenacy.patternpulse.domain.AlertSeverity;
import com.tenacy.patternpulse.domain.DeliveryStatus;
import com.tenacy.patternpulse.domain.PatternAlertRepository;
import com.tenacy.patternpulse.service.PatternMetricsService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.context.ActiveProfiles;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ActiveProfiles("test")
@ExtendWith(MockitoExtension.class)
public class NotificationDispatcherTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-01T12:00:00Z"), ZoneOffset.UTC);
    private static final LocalDateTime NOW = LocalDateTime.of(2024, 3, 1, 12, 0);

    @Mock
    private NotificationChannel emailChannel;

    @Mock
    private NotificationChannel kafkaChannel;

    @Mock
    private PatternAlertRepository alertRepository;

    private SimpleMeterRegistry meterRegistry;
    private NotificationDispatcher dispatcher;
    private AlertNotification notification;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        dispatcher = new NotificationDispatcher(List.of(emailChannel, kafkaChannel), alertRepository,
                new PatternMetricsService(meterRegistry), CLOCK);
        notification = AlertNotification.builder()
                .alertId("alert-1")
                .kind(NotificationKind.CREATED)
                .title("System.TimeoutException in Orders")
                .severity(AlertSeverity.CRITICAL)
                .summary("12건 발생")
                .recipients(List.of("oncall@example.com"))
                .build();
    }

    @Test
    @DisplayName("모든 채널이 성공하면 DELIVERED로 기록한다")
    void dispatchDelivered() {
        // given
        when(emailChannel.isEnabled()).thenReturn(true);
        when(kafkaChannel.isEnabled()).thenReturn(true);
        when(emailChannel.send(notification)).thenReturn(true);
        when(kafkaChannel.send(notification)).thenReturn(true);

        // when
        DeliveryStatus status = dispatcher.dispatch(notification);

        // then
        assertThat(status).isEqualTo(DeliveryStatus.DELIVERED);
        verify(alertRepository).recordDelivery("alert-1", DeliveryStatus.DELIVERED, NOW, 0, null);
        assertThat(meterRegistry.get("patternpulse.notifications.delivered").counter().count()).isEqualTo(2.0);
    }

    @Test
    @DisplayName("한 채널이라도 실패하면 FAILED와 실패 채널을 기록한다")
    void dispatchFailed() {
        // given
        when(emailChannel.isEnabled()).thenReturn(true);
        when(emailChannel.name()).thenReturn("email");
        when(emailChannel.send(notification)).thenReturn(false);
        when(kafkaChannel.isEnabled()).thenReturn(true);
        when(kafkaChannel.send(notification)).thenReturn(true);

        // when
        DeliveryStatus status = dispatcher.dispatch(notification);

        // then
        assertThat(status).isEqualTo(DeliveryStatus.FAILED);
        verify(alertRepository).recordDelivery(eq("alert-1"), eq(DeliveryStatus.FAILED), eq(NOW), eq(1), contains("email"));
        assertThat(meterRegistry.get("patternpulse.notifications.failed").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("채널이 예외를 던져도 실패로 기록하고 전파하지 않는다")
    void dispatchChannelException() {
        when(emailChannel.isEnabled()).thenReturn(true);
        when(emailChannel.name()).thenReturn("email");
        when(emailChannel.send(notification)).thenThrow(new IllegalStateException("smtp down"));
        when(kafkaChannel.isEnabled()).thenReturn(false);

        DeliveryStatus status = dispatcher.dispatch(notification);

        assertThat(status).isEqualTo(DeliveryStatus.FAILED);
        verify(alertRepository).recordDelivery(eq("alert-1"), eq(DeliveryStatus.FAILED), eq(NOW), eq(1), any());
    }

    @Test
    @DisplayName("활성화된 채널이 없으면 PENDING으로 두고 아무것도 기록하지 않는다")
    void dispatchWithoutChannels() {
        when(emailChannel.isEnabled()).thenReturn(false);
        when(kafkaChannel.isEnabled()).thenReturn(false);

        DeliveryStatus status = dispatcher.dispatch(notification);

        assertThat(status).isEqualTo(DeliveryStatus.PENDING);
        verify(alertRepository, never()).recordDelivery(any(), any(), any(), anyInt(), any());
    }
}
