package com.usermanagement.notification.entity;

import com.usermanagement.notification.event.EventType;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.UUID;

/**
 * Status of one notification task, kept so operators can see delivered and failed emails
 * and so tasks interrupted by a shutdown can be resumed.
 */
@Entity
@Table(name = "notification_tasks")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.AUTO)
    private Long id;

    @Column(name = "task_id", nullable = false, unique = true)
    private UUID taskId;

    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", nullable = false)
    private EventType eventType;

    @Column(name = "recipient_email")
    private String recipientEmail;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private TaskStatus status;

    @Column(name = "attempts")
    @Builder.Default
    private Integer attempts = 0;

    @Column(name = "max_attempts")
    private Integer maxAttempts;

    /**
     * Event payload, read back when an unfinished task is resumed after a restart.
     */
    @Convert(converter = PayloadJsonConverter.class)
    @Column(name = "payload", length = 4000)
    private Map<String, Object> payload;

    @Column(name = "last_error", length = 2000)
    private String lastError;

    @Column(name = "result_message", length = 1000)
    private String resultMessage;

    @Column(name = "provider_id")
    private String providerId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        updatedAt = createdAt;
        if (status == null) {
            status = TaskStatus.PENDING;
        }
        if (taskId == null) {
            taskId = UUID.randomUUID();
        }
        if (attempts == null) {
            attempts = 0;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }
}
