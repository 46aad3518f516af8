package com.usermanagement.notification.exception;

import com.usermanagement.notification.event.EventType;

public class InvalidPayloadException extends RuntimeException {

    private final EventType eventType;

    public InvalidPayloadException(EventType eventType, String message) {
        super(message);
        this.eventType = eventType;
    }

    public EventType getEventType() {
        return eventType;
    }
}
