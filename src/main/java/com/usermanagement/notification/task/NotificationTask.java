package com.usermanagement.notification.task;

import com.usermanagement.notification.entity.TaskStatus;
import com.usermanagement.notification.event.EventPayloads;
import com.usermanagement.notification.event.EventType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.util.Map;
import java.util.UUID;

/**
 * One event being turned into an email. Attempts run one after another, never in parallel.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NotificationTask {

    @Builder.Default
    private UUID taskId = UUID.randomUUID();

    private EventType eventType;

    private Map<String, Object> payload;

    /**
     * Zero-based index of the current attempt.
     */
    @Builder.Default
    private int attempt = 0;

    private int maxAttempts;

    private Duration retryDelay;

    @Builder.Default
    private TaskStatus status = TaskStatus.PENDING;

    private String lastError;

    public boolean hasAttemptsLeft() {
        return attempt + 1 < maxAttempts;
    }

    public String getRecipientEmail() {
        return payload != null ? EventPayloads.getString(payload, EventPayloads.EMAIL) : null;
    }
}
