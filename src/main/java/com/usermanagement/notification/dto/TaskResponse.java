package com.usermanagement.notification.dto;

import com.usermanagement.notification.entity.TaskRecord;
import com.usermanagement.notification.entity.TaskStatus;
import com.usermanagement.notification.event.EventType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import org.springframework.hateoas.RepresentationModel;

import java.time.LocalDateTime;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(callSuper = false)
public class TaskResponse extends RepresentationModel<TaskResponse> {

    private UUID taskId;
    private EventType eventType;
    private String recipientEmail;
    private TaskStatus status;
    private Integer attempts;
    private Integer maxAttempts;
    private String lastError;
    private String resultMessage;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
    private LocalDateTime completedAt;

    public static TaskResponse from(TaskRecord record) {
        return TaskResponse.builder()
                .taskId(record.getTaskId())
                .eventType(record.getEventType())
                .recipientEmail(record.getRecipientEmail())
                .status(record.getStatus())
                .attempts(record.getAttempts())
                .maxAttempts(record.getMaxAttempts())
                .lastError(record.getLastError())
                .resultMessage(record.getResultMessage())
                .createdAt(record.getCreatedAt())
                .updatedAt(record.getUpdatedAt())
                .completedAt(record.getCompletedAt())
                .build();
    }
}
