package com.campussecurity.dispatch.exception;

public class AlertNotFoundException extends DispatchException {

    public AlertNotFoundException(Long alertId) {
        super("ALERT_NOT_FOUND", "Guard alert not found: " + alertId);
    }
}
