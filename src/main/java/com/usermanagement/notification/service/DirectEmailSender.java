package com.usermanagement.notification.service;

import com.usermanagement.notification.event.EventType;
import com.usermanagement.notification.exception.NotificationExecutionException;
import com.usermanagement.notification.task.ExecutionResult;
import com.usermanagement.notification.task.NotificationExecutorRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Sends a notification synchronously on the caller's thread, bypassing the broker.
 * Uses the same executor as the background workers, so the email is identical.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DirectEmailSender {

    private final NotificationExecutorRegistry executorRegistry;

    public ExecutionResult send(EventType eventType, Map<String, Object> payload) {
        ExecutionResult result = executorRegistry.getExecutor(eventType)
                .orElseThrow(() -> new NotificationExecutionException(eventType,
                        "No executor available for type: " + eventType, null))
                .execute(payload);

        log.info("Fallback direct email sent: type={}, recipient={}, providerId={}",
                eventType, payload.get("email"), result.getProviderId());
        return result;
    }
}
