package com.usermanagement.notification.sender;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Outcome of handing one email to the mail server. {@code providerId} carries the
 * {@code X-Notification-Id} header value stamped on the outgoing message.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SendResult {

    private boolean success;
    private String providerId;
    private String errorMessage;
    private boolean retryable;
    private LocalDateTime sentAt;

    public static SendResult success(String providerId, LocalDateTime sentAt) {
        return new SendResult(true, providerId, null, false, sentAt);
    }

    public static SendResult failure(String errorMessage, boolean retryable) {
        return new SendResult(false, null, errorMessage, retryable, null);
    }
}
