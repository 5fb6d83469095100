package com.tenacy.patternpulse.domain;

public enum DeliveryStatus {
    PENDING,
    DELIVERED,
    FAILED
}
