package com.campussecurity.dispatch.exception;

/**
 * Push delivery to a guard failed. Logged and audited by the caller; never rolls back the
 * alert or assignment that triggered it.
 */
public class NotificationDeliveryException extends DispatchException {

    public NotificationDeliveryException(Long guardId, Throwable cause) {
        super("NOTIFICATION_DELIVERY_FAILURE", "Failed to notify guard " + guardId, cause);
    }
}
