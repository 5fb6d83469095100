package com.tenacy.patternpulse.notification;

public enum NotificationKind {
    CREATED,
    ESCALATED
}
