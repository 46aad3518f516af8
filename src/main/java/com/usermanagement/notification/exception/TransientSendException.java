package com.usermanagement.notification.exception;

/**
 * The SMTP server could not be reached or asked the client to try again later.
 */
public class TransientSendException extends NotificationSendException {

    public TransientSendException(String message) {
        super(message, true);
    }

    public TransientSendException(String message, Throwable cause) {
        super(message, cause, true);
    }
}
