package com.usermanagement.notification.task;

import com.usermanagement.notification.config.NotificationProperties;
import com.usermanagement.notification.entity.TaskRecord;
import com.usermanagement.notification.entity.TaskStatus;
import com.usermanagement.notification.event.EventType;
import com.usermanagement.notification.exception.NotificationExecutionException;
import com.usermanagement.notification.messaging.producer.TaskEventProducer;
import com.usermanagement.notification.repository.TaskRecordRepository;
import com.usermanagement.notification.task.executor.NotificationExecutor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Runs notification tasks on the worker pool with a fixed-delay, bounded retry.
 * <p>
 * A failed attempt is rescheduled {@code retryDelay} later until {@code maxAttempts} executions
 * have been made; the task then ends FAILED and goes to the dead-letter topic.
 * <p>
 * Every task is stored with its payload before it is accepted. Tasks still PENDING, EXECUTING or
 * RETRYING when the process stops are resumed on the next startup, so one worker process owns
 * the task store.
 */
@Slf4j
@Component
public class NotificationTaskRunner {

    private static final EnumSet<TaskStatus> RESUMABLE =
            EnumSet.of(TaskStatus.PENDING, TaskStatus.EXECUTING, TaskStatus.RETRYING);

    private final NotificationExecutorRegistry executorRegistry;
    private final TaskRecordRepository taskRecordRepository;
    private final TaskEventProducer taskEventProducer;
    private final TaskScheduler taskScheduler;
    private final NotificationProperties properties;
    private final Clock clock;

    @Autowired
    public NotificationTaskRunner(NotificationExecutorRegistry executorRegistry,
                                  TaskRecordRepository taskRecordRepository,
                                  TaskEventProducer taskEventProducer,
                                  @Qualifier("notificationTaskScheduler") TaskScheduler taskScheduler,
                                  NotificationProperties properties) {
        this(executorRegistry, taskRecordRepository, taskEventProducer, taskScheduler, properties, Clock.systemUTC());
    }

    public NotificationTaskRunner(NotificationExecutorRegistry executorRegistry,
                                  TaskRecordRepository taskRecordRepository,
                                  TaskEventProducer taskEventProducer,
                                  TaskScheduler taskScheduler,
                                  NotificationProperties properties,
                                  Clock clock) {
        this.executorRegistry = executorRegistry;
        this.taskRecordRepository = taskRecordRepository;
        this.taskEventProducer = taskEventProducer;
        this.taskScheduler = taskScheduler;
        this.properties = properties;
        this.clock = clock;
    }

    public NotificationTask newTask(EventType eventType, Map<String, Object> payload) {
        return NotificationTask.builder()
                .eventType(eventType)
                .payload(new LinkedHashMap<>(payload))
                .maxAttempts(Math.max(1, properties.getRetry().getMaxAttempts()))
                .retryDelay(properties.getRetry().getDelay())
                .build();
    }

    /**
     * Stores the task as PENDING and queues its first attempt.
     *
     * @param task the task to run
     * @return the task id, usable to look up the task status
     * @throws DataAccessException if the task could not be stored; the task is then not queued
     */
    public UUID submit(NotificationTask task) {
        task.setStatus(TaskStatus.PENDING);
        taskRecordRepository.save(newRecord(task));

        try {
            taskScheduler.schedule(() -> execute(task), Instant.now(clock));
        } catch (TaskRejectedException e) {
            log.warn("Worker pool rejected notification task taskId={}, it stays PENDING until resumed: {}",
                    task.getTaskId(), e.getMessage());
            return task.getTaskId();
        }
        log.info("Queued notification task: taskId={}, type={}, maxAttempts={}",
                task.getTaskId(), task.getEventType(), task.getMaxAttempts());
        return task.getTaskId();
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        resumeUnfinished();
    }

    /**
     * Queues every stored task that has not reached a terminal state.
     *
     * @return the number of tasks queued again
     */
    public int resumeUnfinished() {
        List<TaskRecord> unfinished;
        try {
            unfinished = taskRecordRepository.findByStatusInOrderByCreatedAtAsc(RESUMABLE);
        } catch (DataAccessException e) {
            log.error("Could not load unfinished notification tasks: {}", e.getMessage(), e);
            return 0;
        }

        int resumed = 0;
        for (TaskRecord record : unfinished) {
            if (record.getPayload() == null) {
                log.warn("Cannot resume notification task taskId={}: no stored payload", record.getTaskId());
                continue;
            }
            NotificationTask task = resumedTask(record);
            taskScheduler.schedule(() -> execute(task), Instant.now(clock));
            resumed++;
            log.info("Resumed notification task: taskId={}, type={}, status={}, attempt={}/{}",
                    task.getTaskId(), task.getEventType(), record.getStatus(),
                    task.getAttempt() + 1, task.getMaxAttempts());
        }
        return resumed;
    }

    void execute(NotificationTask task) {
        task.setStatus(TaskStatus.EXECUTING);
        recordStatus(task, null, null);

        Optional<NotificationExecutor> executorOpt = executorRegistry.getExecutor(task.getEventType());
        if (executorOpt.isEmpty()) {
            handleExhausted(task, "No executor available for type: " + task.getEventType());
            return;
        }

        log.info("Executing notification task: taskId={}, type={}, attempt={}/{}",
                task.getTaskId(), task.getEventType(), task.getAttempt() + 1, task.getMaxAttempts());

        ExecutionResult result;
        try {
            result = executorOpt.get().execute(task.getPayload());
        } catch (NotificationExecutionException e) {
            handleFailure(task, errorMessage(e), e.isRetryable());
            return;
        } catch (Exception e) {
            handleFailure(task, errorMessage(e), true);
            return;
        }
        handleSuccess(task, result);
    }

    private void handleSuccess(NotificationTask task, ExecutionResult result) {
        task.setStatus(TaskStatus.SUCCEEDED);
        task.setLastError(null);
        recordStatus(task, result.getMessage(), result.getProviderId());

        taskEventProducer.publishSucceeded(task, result.getProviderId());

        log.info("Notification task succeeded: taskId={}, attempts={}, message={}",
                task.getTaskId(), task.getAttempt() + 1, result.getMessage());
    }

    private void handleFailure(NotificationTask task, String errorMessage, boolean transientFailure) {
        task.setLastError(errorMessage);
        if (!transientFailure) {
            log.warn("Permanent send failure for notification task taskId={}: {}", task.getTaskId(), errorMessage);
        }

        if (!task.hasAttemptsLeft()) {
            log.error("Max attempts reached for notification task taskId={}, marking as FAILED", task.getTaskId());
            handleExhausted(task, "Max attempts exceeded: " + errorMessage);
            return;
        }

        task.setAttempt(task.getAttempt() + 1);
        task.setStatus(TaskStatus.RETRYING);
        recordStatus(task, null, null);

        Instant nextAttemptAt = Instant.now(clock).plus(task.getRetryDelay());
        try {
            taskScheduler.schedule(() -> execute(task), nextAttemptAt);
        } catch (TaskRejectedException e) {
            log.warn("Worker pool rejected retry of notification task taskId={}, it stays RETRYING until resumed: {}",
                    task.getTaskId(), e.getMessage());
            return;
        }
        taskEventProducer.publishRetried(task, nextAttemptAt);

        log.warn("Scheduled retry for notification task taskId={}, attempt={}/{}, delayMs={}: {}",
                task.getTaskId(), task.getAttempt() + 1, task.getMaxAttempts(),
                task.getRetryDelay().toMillis(), errorMessage);
    }

    private void handleExhausted(NotificationTask task, String errorMessage) {
        task.setStatus(TaskStatus.FAILED);
        task.setLastError(errorMessage);
        recordStatus(task, null, null);

        taskEventProducer.publishToDlq(task, errorMessage);
        taskEventProducer.publishFailed(task, errorMessage);

        log.error("Notification task failed permanently: taskId={}, type={}, recipient={}, error={}",
                task.getTaskId(), task.getEventType(), task.getRecipientEmail(), errorMessage);
    }

    private static String errorMessage(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private void recordStatus(NotificationTask task, String resultMessage, String providerId) {
        try {
            TaskRecord record = taskRecordRepository.findByTaskId(task.getTaskId())
                    .orElseGet(() -> newRecord(task));

            record.setStatus(task.getStatus());
            record.setAttempts(executionsSoFar(task));
            record.setLastError(task.getLastError());
            if (resultMessage != null) {
                record.setResultMessage(resultMessage);
            }
            if (providerId != null) {
                record.setProviderId(providerId);
            }
            if (task.getStatus().isTerminal()) {
                record.setCompletedAt(LocalDateTime.now(clock));
            }

            taskRecordRepository.save(record);
        } catch (DataAccessException e) {
            log.error("Failed to record status {} for notification task taskId={}: {}",
                    task.getStatus(), task.getTaskId(), e.getMessage());
        }
    }

    private TaskRecord newRecord(NotificationTask task) {
        return TaskRecord.builder()
                .taskId(task.getTaskId())
                .eventType(task.getEventType())
                .recipientEmail(task.getRecipientEmail())
                .status(task.getStatus())
                .attempts(executionsSoFar(task))
                .maxAttempts(task.getMaxAttempts())
                .payload(task.getPayload())
                .build();
    }

    // RETRYING has already advanced attempt to the next, not yet started, execution.
    private static int executionsSoFar(NotificationTask task) {
        if (task.getStatus() == TaskStatus.PENDING) {
            return 0;
        }
        if (task.getStatus() == TaskStatus.RETRYING) {
            return task.getAttempt();
        }
        return task.getAttempt() + 1;
    }

    private NotificationTask resumedTask(TaskRecord record) {
        int maxAttempts = record.getMaxAttempts() != null
                ? record.getMaxAttempts()
                : Math.max(1, properties.getRetry().getMaxAttempts());
        int executions = record.getAttempts() != null ? record.getAttempts() : 0;

        // an EXECUTING row was interrupted mid-attempt, so that attempt runs again
        int attempt = record.getStatus() == TaskStatus.EXECUTING ? executions - 1 : executions;
        attempt = Math.min(Math.max(0, attempt), maxAttempts - 1);

        return NotificationTask.builder()
                .taskId(record.getTaskId())
                .eventType(record.getEventType())
                .payload(new LinkedHashMap<>(record.getPayload()))
                .attempt(attempt)
                .maxAttempts(maxAttempts)
                .retryDelay(properties.getRetry().getDelay())
                .status(record.getStatus())
                .lastError(record.getLastError())
                .build();
    }
}
