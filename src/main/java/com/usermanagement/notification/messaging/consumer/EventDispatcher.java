package com.usermanagement.notification.messaging.consumer;

import com.usermanagement.notification.event.EventType;
import com.usermanagement.notification.task.NotificationTask;
import com.usermanagement.notification.task.NotificationTaskRunner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.UUID;

/**
 * Consumes account lifecycle events and hands each one to the task runner as a notification task.
 * <p>
 * A record is acknowledged once its task is stored, since the runner resumes stored tasks after a
 * restart. If the task cannot be stored the record is nacked for redelivery. Records that cannot
 * become a task (unknown topic, unreadable value) are acknowledged and dropped.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EventDispatcher {

    static final Duration REDELIVERY_BACKOFF = Duration.ofSeconds(5);

    private final NotificationTaskRunner taskRunner;

    @KafkaListener(
        topics = "#{T(com.usermanagement.notification.event.EventType).topicNames()}",
        groupId = "${notification.kafka.consumer-group}"
    )
    public void consumeEvent(ConsumerRecord<String, Map<String, Object>> record, Acknowledgment ack) {
        log.info("Received event from topic: {}, key: {}, partition: {}, offset: {}",
            record.topic(), record.key(), record.partition(), record.offset());

        EventType eventType;
        try {
            eventType = EventType.fromTopic(record.topic());
        } catch (IllegalArgumentException e) {
            log.error("Dropping record from unexpected topic {}: {}", record.topic(), e.getMessage());
            ack.acknowledge();
            return;
        }

        Map<String, Object> payload = record.value();
        if (payload == null) {
            log.error("Dropping unreadable record from topic {}, key: {}", record.topic(), record.key());
            ack.acknowledge();
            return;
        }

        try {
            UUID taskId = dispatch(eventType, payload);
            log.info("Dispatched {} event as task {}", eventType, taskId);
            ack.acknowledge();
        } catch (Exception e) {
            log.error("Failed to dispatch event from topic {}, key: {}: {}",
                record.topic(), record.key(), e.getMessage(), e);
            ack.nack(REDELIVERY_BACKOFF);
        }
    }

    /**
     * Submits a notification task for the event.
     *
     * @param eventType the event type
     * @param payload   the event payload
     * @return the id of the queued task
     */
    public UUID dispatch(EventType eventType, Map<String, Object> payload) {
        NotificationTask task = taskRunner.newTask(eventType, payload);
        return taskRunner.submit(task);
    }
}
