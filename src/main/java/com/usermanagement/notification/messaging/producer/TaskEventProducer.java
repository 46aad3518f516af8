package com.usermanagement.notification.messaging.producer;

import com.usermanagement.notification.messaging.dto.TaskEvent;
import com.usermanagement.notification.task.NotificationTask;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Publishes task lifecycle events for monitoring and exhausted tasks to the dead-letter topic.
 * Sends are asynchronous; failures are logged.
 */
@Slf4j
@Component
public class TaskEventProducer {

    static final String DLQ_REASON_HEADER = "X-DLQ-Reason";
    static final String TASK_ID_HEADER = "X-Task-Id";
    static final String EVENT_TYPE_HEADER = "X-Event-Type";
    static final String ATTEMPTS_HEADER = "X-Attempts";

    private final KafkaTemplate<String, TaskEvent> taskEventKafkaTemplate;
    private final KafkaTemplate<String, Map<String, Object>> eventKafkaTemplate;

    @Value("${notification.kafka.task-events-topic}")
    private String taskEventsTopic;

    @Value("${notification.kafka.dlq-topic}")
    private String dlqTopic;

    public TaskEventProducer(KafkaTemplate<String, TaskEvent> taskEventKafkaTemplate,
                             KafkaTemplate<String, Map<String, Object>> eventKafkaTemplate) {
        this.taskEventKafkaTemplate = taskEventKafkaTemplate;
        this.eventKafkaTemplate = eventKafkaTemplate;
    }

    public void publishEvent(TaskEvent event) {
        String key = event.getTaskId().toString();

        try {
            taskEventKafkaTemplate.send(taskEventsTopic, key, event)
                .whenComplete((result, ex) -> {
                    if (ex == null) {
                        log.debug("Task event published: type={}, taskId={}", event.getEventType(), event.getTaskId());
                    } else {
                        log.error("Failed to publish task event: type={}, taskId={}, error={}",
                            event.getEventType(), event.getTaskId(), ex.getMessage());
                    }
                });
        } catch (Exception e) {
            log.error("Failed to publish task event: type={}, taskId={}, error={}",
                event.getEventType(), event.getTaskId(), e.getMessage());
        }
    }

    public void publishSucceeded(NotificationTask task, String providerId) {
        Map<String, Object> details = new HashMap<>();
        details.put("attempts", task.getAttempt() + 1);
        details.put("providerId", providerId);

        publishEvent(buildEvent(task, TaskEvent.Type.SUCCEEDED, details));
    }

    public void publishRetried(NotificationTask task, Instant nextAttemptAt) {
        Map<String, Object> details = new HashMap<>();
        details.put("attempt", task.getAttempt());
        details.put("nextAttemptAt", nextAttemptAt.toString());
        details.put("errorMessage", task.getLastError());

        publishEvent(buildEvent(task, TaskEvent.Type.RETRIED, details));
    }

    public void publishFailed(NotificationTask task, String errorMessage) {
        Map<String, Object> details = new HashMap<>();
        details.put("attempts", task.getAttempt() + 1);
        details.put("errorMessage", errorMessage);

        publishEvent(buildEvent(task, TaskEvent.Type.FAILED, details));
    }

    public void publishToDlq(NotificationTask task, String reason) {
        String key = task.getTaskId().toString();
        ProducerRecord<String, Map<String, Object>> record = new ProducerRecord<>(
            dlqTopic,
            key,
            task.getPayload()
        );

        record.headers().add(TASK_ID_HEADER, key.getBytes(StandardCharsets.UTF_8));
        record.headers().add(EVENT_TYPE_HEADER, task.getEventType().getTopicName().getBytes(StandardCharsets.UTF_8));
        record.headers().add(ATTEMPTS_HEADER, String.valueOf(task.getAttempt() + 1).getBytes(StandardCharsets.UTF_8));
        record.headers().add(DLQ_REASON_HEADER, String.valueOf(reason).getBytes(StandardCharsets.UTF_8));

        try {
            eventKafkaTemplate.send(record)
                .whenComplete((result, ex) -> {
                    if (ex != null) {
                        log.error("Failed to send task to DLQ: taskId={}, error={}", key, ex.getMessage());
                    }
                });
        } catch (Exception e) {
            log.error("Failed to send task to DLQ: taskId={}, error={}", key, e.getMessage());
        }
        log.error("Notification task sent to DLQ: taskId={}, type={}, reason={}", key, task.getEventType(), reason);
    }

    private TaskEvent buildEvent(NotificationTask task, TaskEvent.Type type, Map<String, Object> details) {
        return TaskEvent.builder()
            .taskId(task.getTaskId())
            .notificationType(task.getEventType())
            .eventType(type)
            .details(details)
            .build();
    }
}
