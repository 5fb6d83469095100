package com.tenacy.patternpulse.alert;

import com.tenacy.patternpulse.domain.AlertStatus;

public class IllegalAlertTransitionException extends RuntimeException {

    public IllegalAlertTransitionException(String alertId, AlertStatus current, String action) {
        super(String.format("알림 %s는 %s 상태에서 %s 할 수 없습니다", alertId, current, action));
    }
}
