package com.tenacy.patternpulse.notification;

import com.tenacy.patternpulse.config.PatternPulseProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.mail.MailException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

@Component
@RequiredArgsConstructor
@Slf4j
public class EmailNotificationChannel implements NotificationChannel {

    private final JavaMailSender mailSender;
    private final PatternPulseProperties properties;

    @Override
    public String name() {
        return "email";
    }

    @Override
    public boolean isEnabled() {
        PatternPulseProperties.Notification settings = properties.getNotification();
        return settings.isEmailEnabled() && StringUtils.hasText(settings.getSender());
    }

    @Override
    public boolean send(AlertNotification notification) {
        if (notification.getRecipients().isEmpty()) {
            log.debug("수신자가 없어 이메일 알림을 건너뜀: {}", notification.getAlertId());
            return true;
        }

        try {
            SimpleMailMessage mailMessage = new SimpleMailMessage();
            mailMessage.setFrom(properties.getNotification().getSender());
            mailMessage.setTo(notification.getRecipients().toArray(new String[0]));
            mailMessage.setSubject(subject(notification));
            mailMessage.setText(body(notification));

            mailSender.send(mailMessage);
            log.info("알림 이메일이 성공적으로 전송되었습니다: {}", notification.getTitle());
            return true;
        } catch (MailException e) {
            log.warn("알림 이메일 전송 실패 - alertId: {}, 원인: {}", notification.getAlertId(), e.getMessage());
            return false;
        }
    }

    private String subject(AlertNotification notification) {
        String prefix = notification.getKind() == NotificationKind.ESCALATED
                ? "[PatternPulse 에스컬레이션 L" + notification.getEscalationLevel() + "] "
                : "[PatternPulse 알림] ";
        return prefix + "[" + notification.getSeverity() + "] " + notification.getTitle();
    }

    private String body(AlertNotification notification) {
        StringBuilder body = new StringBuilder();
        body.append(notification.getSummary()).append("\n\n");
        body.append("심각도: ").append(notification.getSeverity()).append('\n');
        body.append("에스컬레이션 단계: ").append(notification.getEscalationLevel()).append('\n');
        if (StringUtils.hasText(notification.getDashboardUrl())) {
            body.append("대시보드: ").append(notification.getDashboardUrl()).append('\n');
        }
        return body.toString();
    }
}
