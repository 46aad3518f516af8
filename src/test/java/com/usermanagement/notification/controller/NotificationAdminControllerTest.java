package com.usermanagement.notification.controller;

import com.usermanagement.notification.dto.TaskResponse;
import com.usermanagement.notification.entity.TaskStatus;
import com.usermanagement.notification.event.EventType;
import com.usermanagement.notification.exception.ResourceNotFoundException;
import com.usermanagement.notification.messaging.availability.AvailabilityGate;
import com.usermanagement.notification.messaging.capture.CaptureBuffer;
import com.usermanagement.notification.messaging.capture.CapturedEvent;
import com.usermanagement.notification.messaging.producer.KafkaEventSink;
import com.usermanagement.notification.service.TaskQueryService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(NotificationAdminController.class)
@DisplayName("NotificationAdminController Web Tests")
class NotificationAdminControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private AvailabilityGate availabilityGate;

    @MockBean
    private CaptureBuffer captureBuffer;

    @MockBean
    private KafkaEventSink kafkaEventSink;

    @MockBean
    private TaskQueryService taskQueryService;

    private TaskResponse taskResponse;

    @BeforeEach
    void setUp() {
        taskResponse = TaskResponse.builder()
                .taskId(UUID.randomUUID())
                .eventType(EventType.EMAIL_VERIFICATION)
                .recipientEmail("jane@example.com")
                .status(TaskStatus.RETRYING)
                .attempts(2)
                .maxAttempts(4)
                .lastError("Connection timeout")
                .createdAt(LocalDateTime.now())
                .build();
    }

    @Test
    @DisplayName("PUT /broker/availability should toggle the override and report the gate state")
    void testSetAvailability() throws Exception {
        when(availabilityGate.isForcedUnavailable()).thenReturn(true);
        when(availabilityGate.isBypassActive()).thenReturn(true);
        when(captureBuffer.size()).thenReturn(3);

        mockMvc.perform(put("/api/v1/notifications/broker/availability").param("unavailable", "true"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success", is(true)))
                .andExpect(jsonPath("$.data.forcedUnavailable", is(true)))
                .andExpect(jsonPath("$.data.bypassActive", is(true)))
                .andExpect(jsonPath("$.data.capturedCount", is(3)));

        verify(availabilityGate).setUnavailable(true);
    }

    @Test
    @DisplayName("GET /broker/availability should include test mode and producer health")
    void testGetAvailability() throws Exception {
        when(availabilityGate.isTestModeActive()).thenReturn(true);
        when(availabilityGate.isBypassActive()).thenReturn(true);
        when(kafkaEventSink.isDegraded()).thenReturn(true);

        mockMvc.perform(get("/api/v1/notifications/broker/availability"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.testMode", is(true)))
                .andExpect(jsonPath("$.data.forcedUnavailable", is(false)))
                .andExpect(jsonPath("$.data.producerDegraded", is(true)));
    }

    @Test
    @DisplayName("GET /tasks/{taskId} should return the task status")
    void testGetTask() throws Exception {
        when(taskQueryService.getTask(taskResponse.getTaskId())).thenReturn(taskResponse);

        mockMvc.perform(get("/api/v1/notifications/tasks/{taskId}", taskResponse.getTaskId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.taskId", is(taskResponse.getTaskId().toString())))
                .andExpect(jsonPath("$.data.status", is("RETRYING")))
                .andExpect(jsonPath("$.data.attempts", is(2)));
    }

    @Test
    @DisplayName("GET /tasks/{taskId} should return 404 for an unknown task")
    void testGetTaskNotFound() throws Exception {
        UUID taskId = UUID.randomUUID();
        when(taskQueryService.getTask(taskId))
                .thenThrow(new ResourceNotFoundException("Notification task", "taskId", taskId));

        mockMvc.perform(get("/api/v1/notifications/tasks/{taskId}", taskId))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.success", is(false)))
                .andExpect(jsonPath("$.errorCode", is("NOT_FOUND")));
    }

    @Test
    @DisplayName("GET /tasks should filter by status")
    void testGetTasksByStatus() throws Exception {
        when(taskQueryService.findTasks(TaskStatus.RETRYING, null, null)).thenReturn(List.of(taskResponse));

        mockMvc.perform(get("/api/v1/notifications/tasks").param("status", "RETRYING"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data", hasSize(1)))
                .andExpect(jsonPath("$.data[0].recipientEmail", is("jane@example.com")));
    }

    @Test
    @DisplayName("GET /tasks should reject an unknown status")
    void testGetTasksInvalidStatus() throws Exception {
        mockMvc.perform(get("/api/v1/notifications/tasks").param("status", "LOST"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode", is("BAD_REQUEST")));
    }

    @Test
    @DisplayName("GET /tasks should reject a malformed recipient address")
    void testGetTasksInvalidRecipient() throws Exception {
        mockMvc.perform(get("/api/v1/notifications/tasks").param("recipient", "not-an-email"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode", is("VALIDATION_FAILED")));

        verify(taskQueryService, never()).findTasks(any(), any(), any());
    }

    @Test
    @DisplayName("GET /tasks/failed should list failures since the given time")
    void testGetFailedTasks() throws Exception {
        LocalDateTime since = LocalDateTime.of(2024, 5, 1, 10, 0);
        when(taskQueryService.findFailedSince(since)).thenReturn(List.of(taskResponse));

        mockMvc.perform(get("/api/v1/notifications/tasks/failed").param("since", "2024-05-01T10:00:00"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data", hasSize(1)));
    }

    @Test
    @DisplayName("GET /tasks/failed should reject a time in the future")
    void testGetFailedTasksFutureSince() throws Exception {
        mockMvc.perform(get("/api/v1/notifications/tasks/failed").param("since", "2999-01-01T00:00:00"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode", is("VALIDATION_FAILED")));

        verify(taskQueryService, never()).findFailedSince(any());
    }

    @Test
    @DisplayName("GET /tasks/summary should count tasks per status")
    void testGetTaskSummary() throws Exception {
        Map<TaskStatus, Long> counts = new EnumMap<>(TaskStatus.class);
        counts.put(TaskStatus.SUCCEEDED, 5L);
        counts.put(TaskStatus.FAILED, 1L);
        when(taskQueryService.countByStatus()).thenReturn(counts);

        mockMvc.perform(get("/api/v1/notifications/tasks/summary"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.SUCCEEDED", is(5)))
                .andExpect(jsonPath("$.data.FAILED", is(1)));
    }

    @Test
    @DisplayName("GET /captured should list captured events in order")
    void testGetCapturedEvents() throws Exception {
        when(captureBuffer.all()).thenReturn(List.of(
                new CapturedEvent(EventType.ACCOUNT_LOCKED, Map.of("id", "u1"), Instant.now()),
                new CapturedEvent(EventType.ROLE_UPGRADE, Map.of("id", "u2"), Instant.now())));

        mockMvc.perform(get("/api/v1/notifications/captured"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data", hasSize(2)))
                .andExpect(jsonPath("$.data[0].topic", is("account_locked")))
                .andExpect(jsonPath("$.data[1].payload.id", is("u2")));
    }

    @Test
    @DisplayName("DELETE /captured should clear the buffer")
    void testClearCapturedEvents() throws Exception {
        when(captureBuffer.size()).thenReturn(2);

        mockMvc.perform(delete("/api/v1/notifications/captured"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message", is("Cleared 2 captured events")));

        verify(captureBuffer).clear();
    }
}
