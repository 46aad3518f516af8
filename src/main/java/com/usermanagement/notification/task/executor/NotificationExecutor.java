package com.usermanagement.notification.task.executor;

import com.usermanagement.notification.event.EventType;
import com.usermanagement.notification.task.ExecutionResult;

import java.util.Map;

public interface NotificationExecutor {

    /**
     * Returns the event type this executor handles.
     */
    EventType getSupportedType();

    /**
     * Maps an event payload to the values its template references.
     *
     * @param payload the event payload
     * @return the rendering context
     */
    Map<String, Object> buildContext(Map<String, Object> payload);

    /**
     * Renders the notification and sends it to the payload's email address.
     *
     * @param payload the event payload
     * @return a success result
     * @throws com.usermanagement.notification.exception.NotificationExecutionException if
     *         rendering or sending fails
     */
    ExecutionResult execute(Map<String, Object> payload);
}
