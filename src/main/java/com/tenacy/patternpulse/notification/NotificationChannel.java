package com.tenacy.patternpulse.notification;

/**
 * 알림 전송 채널. 실패는 예외 대신 false로 돌려준다.
 */
public interface NotificationChannel {

    String name();

    boolean isEnabled();

    boolean send(AlertNotification notification);
}
