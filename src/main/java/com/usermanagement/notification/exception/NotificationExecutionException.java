package com.usermanagement.notification.exception;

import com.usermanagement.notification.event.EventType;

/**
 * A single render-and-send attempt failed. The task runner decides whether to retry.
 */
public class NotificationExecutionException extends RuntimeException {

    private final EventType eventType;

    public NotificationExecutionException(EventType eventType, String message, Throwable cause) {
        super(message, cause);
        this.eventType = eventType;
    }

    public EventType getEventType() {
        return eventType;
    }

    /**
     * Whether the transport reported the failure as likely to clear up. Failures that did not
     * come from the transport count as retryable.
     */
    public boolean isRetryable() {
        return !(getCause() instanceof NotificationSendException)
                || ((NotificationSendException) getCause()).isRetryable();
    }
}
