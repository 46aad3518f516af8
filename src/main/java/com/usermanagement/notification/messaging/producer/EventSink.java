package com.usermanagement.notification.messaging.producer;

import com.usermanagement.notification.event.EventType;

import java.util.Map;

public interface EventSink {

    /**
     * Publishes an event. Implementations never throw: every failure is reported in the result.
     *
     * @param eventType the event type, which also names the topic
     * @param payload   the event payload; it is not modified
     * @return the outcome of the publish attempt
     */
    PublishResult publish(EventType eventType, Map<String, Object> payload);
}
