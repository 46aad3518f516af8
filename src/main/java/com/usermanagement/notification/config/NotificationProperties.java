package com.usermanagement.notification.config;

import com.usermanagement.notification.event.EventType;
import com.usermanagement.notification.service.FallbackPolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

@Data
@ConfigurationProperties(prefix = "notification")
public class NotificationProperties {

    /**
     * Base URL of the user-facing server, used to build verification links.
     */
    private String serverBaseUrl = "http://localhost:8000";

    private String supportEmail = "support@example.com";

    private Retry retry = new Retry();

    private Kafka kafka = new Kafka();

    private Worker worker = new Worker();

    /**
     * Per event type fallback when publishing fails. Types not listed fall back to LOG_ONLY.
     */
    private Map<EventType, FallbackPolicy> fallback = defaultFallbacks();

    public FallbackPolicy fallbackFor(EventType eventType) {
        return fallback.getOrDefault(eventType, FallbackPolicy.LOG_ONLY);
    }

    private static Map<EventType, FallbackPolicy> defaultFallbacks() {
        Map<EventType, FallbackPolicy> defaults = new EnumMap<>(EventType.class);
        defaults.put(EventType.EMAIL_VERIFICATION, FallbackPolicy.DIRECT_SEND);
        defaults.put(EventType.ACCOUNT_LOCKED, FallbackPolicy.DIRECT_SEND);
        defaults.put(EventType.ACCOUNT_UNLOCKED, FallbackPolicy.LOG_ONLY);
        defaults.put(EventType.ROLE_UPGRADE, FallbackPolicy.LOG_ONLY);
        defaults.put(EventType.PROFESSIONAL_STATUS_UPGRADE, FallbackPolicy.LOG_ONLY);
        return defaults;
    }

    @Data
    public static class Retry {

        /**
         * Delay before a failed task becomes eligible for another attempt.
         */
        private Duration delay = Duration.ofSeconds(60);

        /**
         * Total executions per task, the first attempt included.
         */
        private int maxAttempts = 4;
    }

    @Data
    public static class Kafka {

        private Duration publishTimeout = Duration.ofSeconds(10);

        private String dlqTopic = "notification.email.dlq";

        private String taskEventsTopic = "notification.task-events";

        private int partitions = 2;

        private String consumerGroup = "notification-email-workers";
    }

    @Data
    public static class Worker {

        private int poolSize = 4;
    }
}
