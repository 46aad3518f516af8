package com.usermanagement.notification.service;

import com.usermanagement.notification.dto.TaskResponse;
import com.usermanagement.notification.entity.TaskRecord;
import com.usermanagement.notification.entity.TaskStatus;
import com.usermanagement.notification.event.EventType;
import com.usermanagement.notification.exception.ResourceNotFoundException;
import com.usermanagement.notification.repository.TaskRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Read side of the notification task store.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class TaskQueryService {

    private final TaskRecordRepository taskRecordRepository;

    public TaskResponse getTask(UUID taskId) {
        log.debug("Fetching notification task: {}", taskId);
        TaskRecord record = taskRecordRepository.findByTaskId(taskId)
                .orElseThrow(() -> new ResourceNotFoundException("Notification task", "taskId", taskId));
        return TaskResponse.from(record);
    }

    /**
     * Lists tasks matching the given filters, each of which may be null.
     * A recipient filter takes precedence over status and type.
     */
    public List<TaskResponse> findTasks(TaskStatus status, EventType eventType, String recipientEmail) {
        List<TaskRecord> records;
        if (recipientEmail != null) {
            records = taskRecordRepository.findByRecipientEmailOrderByCreatedAtDesc(recipientEmail);
        } else if (status != null && eventType != null) {
            records = taskRecordRepository.findByEventTypeAndStatus(eventType, status);
        } else if (status != null) {
            records = taskRecordRepository.findByStatusOrderByUpdatedAtDesc(status);
        } else if (eventType != null) {
            records = taskRecordRepository.findByEventTypeOrderByCreatedAtDesc(eventType);
        } else {
            records = taskRecordRepository.findAll(Sort.by(Sort.Direction.DESC, "createdAt"));
        }
        return records.stream().map(TaskResponse::from).collect(Collectors.toList());
    }

    public List<TaskResponse> findFailedSince(LocalDateTime since) {
        return taskRecordRepository.findFailedSince(since).stream()
                .map(TaskResponse::from)
                .collect(Collectors.toList());
    }

    public Map<TaskStatus, Long> countByStatus() {
        Map<TaskStatus, Long> counts = new EnumMap<>(TaskStatus.class);
        for (TaskStatus status : TaskStatus.values()) {
            counts.put(status, taskRecordRepository.countByStatus(status));
        }
        return counts;
    }
}
