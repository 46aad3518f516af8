package com.usermanagement.notification.messaging.producer;

import com.usermanagement.notification.config.NotificationProperties;
import com.usermanagement.notification.event.EventType;
import com.usermanagement.notification.exception.InvalidPayloadException;
import com.usermanagement.notification.validator.EventPayloadValidator;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.BeansException;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Publishes events to their Kafka topic and waits for the acknowledgment.
 * <p>
 * The producer is resolved on first use. If it cannot be obtained the sink stays degraded and
 * fails every publish until the process restarts.
 */
@Slf4j
@Component
public class KafkaEventSink implements EventSink {

    static final String TIMESTAMP_FIELD = "timestamp";

    private final ObjectProvider<KafkaTemplate<String, Map<String, Object>>> templateProvider;
    private final EventPayloadValidator payloadValidator;
    private final Duration publishTimeout;
    private final Clock clock;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private volatile KafkaTemplate<String, Map<String, Object>> kafkaTemplate;
    private volatile boolean degraded;

    @Autowired
    public KafkaEventSink(ObjectProvider<KafkaTemplate<String, Map<String, Object>>> templateProvider,
                          EventPayloadValidator payloadValidator,
                          NotificationProperties properties) {
        this(templateProvider, payloadValidator, properties.getKafka().getPublishTimeout(), Clock.systemUTC());
    }

    public KafkaEventSink(ObjectProvider<KafkaTemplate<String, Map<String, Object>>> templateProvider,
                          EventPayloadValidator payloadValidator,
                          Duration publishTimeout,
                          Clock clock) {
        this.templateProvider = templateProvider;
        this.payloadValidator = payloadValidator;
        this.publishTimeout = publishTimeout;
        this.clock = clock;
    }

    @Override
    public PublishResult publish(EventType eventType, Map<String, Object> payload) {
        String topic = eventType.getTopicName();
        KafkaTemplate<String, Map<String, Object>> template = resolveTemplate();

        if (template == null) {
            log.error("Cannot publish event to {}: Kafka producer not initialized", topic);
            return PublishResult.failure(topic, "Kafka producer not initialized");
        }

        try {
            payloadValidator.validate(eventType, payload);

            // send() may itself block up to max.block.ms, so both waits share one deadline
            long deadline = System.nanoTime() + publishTimeout.toNanos();
            Instant publishedAt = Instant.now(clock);
            Map<String, Object> record = new LinkedHashMap<>(payload);
            record.put(TIMESTAMP_FIELD, publishedAt.toString());
            String key = String.valueOf(payload.get("id"));

            CompletableFuture<SendResult<String, Map<String, Object>>> future = template.send(topic, key, record);
            SendResult<String, Map<String, Object>> result =
                    future.get(Math.max(0L, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);

            if (result != null && result.getRecordMetadata() != null) {
                log.info("Event published to topic={}, partition={}, offset={}, key={}",
                        topic,
                        result.getRecordMetadata().partition(),
                        result.getRecordMetadata().offset(),
                        key);
            } else {
                log.info("Event published to topic={}, key={}", topic, key);
            }
            return PublishResult.published(topic, publishedAt);

        } catch (InvalidPayloadException e) {
            log.error("Rejected event for topic {}: {}, payload={}", topic, e.getMessage(), payload);
            return PublishResult.failure(topic, e.getMessage());
        } catch (TimeoutException e) {
            log.error("Timed out after {}ms publishing event to topic {}, payload={}",
                    publishTimeout.toMillis(), topic, payload);
            return PublishResult.failure(topic, "Timed out waiting for broker acknowledgment");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("Failed to publish event to topic {}: {}, payload={}", topic, cause.getMessage(), payload);
            return PublishResult.failure(topic, cause.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Interrupted while publishing event to topic {}", topic);
            return PublishResult.failure(topic, "Interrupted while waiting for broker acknowledgment");
        } catch (Exception e) {
            log.error("Failed to publish event to topic {}: {}, payload={}", topic, e.getMessage(), payload, e);
            return PublishResult.failure(topic, e.getMessage());
        }
    }

    public boolean isDegraded() {
        return degraded;
    }

    @PreDestroy
    public void flush() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        KafkaTemplate<String, Map<String, Object>> template = kafkaTemplate;
        if (template != null) {
            template.flush();
            log.info("Kafka producer flushed");
        }
    }

    private KafkaTemplate<String, Map<String, Object>> resolveTemplate() {
        KafkaTemplate<String, Map<String, Object>> template = kafkaTemplate;
        if (template != null || degraded) {
            return template;
        }

        synchronized (this) {
            if (kafkaTemplate == null && !degraded) {
                try {
                    kafkaTemplate = templateProvider.getIfAvailable();
                    if (kafkaTemplate == null) {
                        degraded = true;
                        log.error("No Kafka template available, event publishing is disabled");
                    } else {
                        log.info("Kafka producer initialized for event publishing");
                    }
                } catch (BeansException e) {
                    degraded = true;
                    log.error("Failed to initialize Kafka producer: {}", e.getMessage(), e);
                }
            }
            return kafkaTemplate;
        }
    }
}
