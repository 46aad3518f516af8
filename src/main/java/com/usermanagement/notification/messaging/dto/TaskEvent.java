package com.usermanagement.notification.messaging.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.usermanagement.notification.event.EventType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskEvent {

    @JsonProperty("taskId")
    private UUID taskId;

    @JsonProperty("notificationType")
    private EventType notificationType;

    @JsonProperty("eventType")
    private Type eventType;

    @JsonProperty("details")
    private Map<String, Object> details;

    @JsonProperty("timestamp")
    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    @Builder.Default
    private LocalDateTime timestamp = LocalDateTime.now();

    public enum Type {
        SUCCEEDED,
        RETRIED,
        FAILED
    }
}
