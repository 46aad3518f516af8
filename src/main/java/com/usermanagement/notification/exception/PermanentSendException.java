package com.usermanagement.notification.exception;

/**
 * The SMTP server rejected the email in a way another attempt will not fix: bad credentials,
 * an invalid recipient or a message that could not be built.
 */
public class PermanentSendException extends NotificationSendException {

    public PermanentSendException(String message) {
        super(message, false);
    }

    public PermanentSendException(String message, Throwable cause) {
        super(message, cause, false);
    }
}
