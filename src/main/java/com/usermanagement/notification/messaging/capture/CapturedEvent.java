package com.usermanagement.notification.messaging.capture;

import com.usermanagement.notification.event.EventType;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

@Value
public class CapturedEvent {

    EventType eventType;

    /**
     * Payload as handed to the sink. Captured payloads carry no {@code timestamp} field.
     */
    Map<String, Object> payload;

    Instant capturedAt;

    public String getTopic() {
        return eventType.getTopicName();
    }
}
