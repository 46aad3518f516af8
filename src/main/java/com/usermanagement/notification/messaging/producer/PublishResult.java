package com.usermanagement.notification.messaging.producer;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PublishResult {

    /**
     * Indicates if the event was accepted, by the broker or by the capture buffer.
     */
    private boolean success;

    /**
     * Indicates the event was captured in memory instead of reaching the broker.
     */
    private boolean captured;

    /**
     * Topic the event was meant for.
     */
    private String topic;

    /**
     * Error message if publishing failed.
     */
    private String errorMessage;

    /**
     * Timestamp injected into the payload on the broker path.
     */
    private Instant publishedAt;

    public static PublishResult published(String topic, Instant publishedAt) {
        return PublishResult.builder()
                .success(true)
                .topic(topic)
                .publishedAt(publishedAt)
                .build();
    }

    public static PublishResult captured(String topic) {
        return PublishResult.builder()
                .success(true)
                .captured(true)
                .topic(topic)
                .build();
    }

    public static PublishResult failure(String topic, String errorMessage) {
        return PublishResult.builder()
                .success(false)
                .topic(topic)
                .errorMessage(errorMessage)
                .build();
    }
}
