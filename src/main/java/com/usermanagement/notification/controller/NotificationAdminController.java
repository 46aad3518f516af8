package com.usermanagement.notification.controller;

import com.usermanagement.notification.dto.ApiResponse;
import com.usermanagement.notification.dto.AvailabilityResponse;
import com.usermanagement.notification.dto.CapturedEventResponse;
import com.usermanagement.notification.dto.TaskResponse;
import com.usermanagement.notification.entity.TaskStatus;
import com.usermanagement.notification.event.EventType;
import com.usermanagement.notification.messaging.availability.AvailabilityGate;
import com.usermanagement.notification.messaging.capture.CaptureBuffer;
import com.usermanagement.notification.messaging.producer.KafkaEventSink;
import com.usermanagement.notification.service.TaskQueryService;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.PastOrPresent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

import static org.springframework.hateoas.server.mvc.WebMvcLinkBuilder.linkTo;
import static org.springframework.hateoas.server.mvc.WebMvcLinkBuilder.methodOn;

@RestController
@Validated
@RequestMapping("/api/v1/notifications")
@RequiredArgsConstructor
@Slf4j
public class NotificationAdminController {

    private final AvailabilityGate availabilityGate;
    private final CaptureBuffer captureBuffer;
    private final KafkaEventSink kafkaEventSink;
    private final TaskQueryService taskQueryService;

    @GetMapping("/broker/availability")
    public ResponseEntity<ApiResponse<AvailabilityResponse>> getAvailability() {
        return ResponseEntity.ok(ApiResponse.success(currentAvailability()));
    }

    @PutMapping("/broker/availability")
    public ResponseEntity<ApiResponse<AvailabilityResponse>> setAvailability(@RequestParam boolean unavailable) {
        log.info("REST request to set broker forced-unavailable to {}", unavailable);
        availabilityGate.setUnavailable(unavailable);
        return ResponseEntity.ok(ApiResponse.success(currentAvailability(),
                unavailable ? "Broker marked unavailable, events will be captured" : "Broker override cleared"));
    }

    @GetMapping("/tasks/{taskId}")
    public ResponseEntity<ApiResponse<TaskResponse>> getTask(@PathVariable UUID taskId) {
        log.info("REST request to get notification task: {}", taskId);
        TaskResponse response = taskQueryService.getTask(taskId);
        addSelfLink(response);
        return ResponseEntity.ok(ApiResponse.success(response));
    }

    @GetMapping("/tasks")
    public ResponseEntity<ApiResponse<List<TaskResponse>>> getTasks(
            @RequestParam(required = false) TaskStatus status,
            @RequestParam(required = false) EventType type,
            @RequestParam(required = false) @Email String recipient) {
        log.info("REST request to list notification tasks: status={}, type={}, recipient={}", status, type, recipient);
        List<TaskResponse> tasks = taskQueryService.findTasks(status, type, recipient);
        tasks.forEach(this::addSelfLink);
        return ResponseEntity.ok(ApiResponse.success(tasks));
    }

    @GetMapping("/tasks/failed")
    public ResponseEntity<ApiResponse<List<TaskResponse>>> getFailedTasks(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) @PastOrPresent LocalDateTime since) {
        log.info("REST request to list notification tasks failed since {}", since);
        List<TaskResponse> tasks = taskQueryService.findFailedSince(since);
        tasks.forEach(this::addSelfLink);
        return ResponseEntity.ok(ApiResponse.success(tasks));
    }

    @GetMapping("/tasks/summary")
    public ResponseEntity<ApiResponse<Map<TaskStatus, Long>>> getTaskSummary() {
        return ResponseEntity.ok(ApiResponse.success(taskQueryService.countByStatus()));
    }

    @GetMapping("/captured")
    public ResponseEntity<ApiResponse<List<CapturedEventResponse>>> getCapturedEvents() {
        List<CapturedEventResponse> events = captureBuffer.all().stream()
                .map(CapturedEventResponse::from)
                .collect(Collectors.toList());
        return ResponseEntity.ok(ApiResponse.success(events));
    }

    @DeleteMapping("/captured")
    public ResponseEntity<ApiResponse<Void>> clearCapturedEvents() {
        int cleared = captureBuffer.size();
        captureBuffer.clear();
        log.info("REST request cleared {} captured events", cleared);
        return ResponseEntity.ok(ApiResponse.success(null, "Cleared " + cleared + " captured events"));
    }

    private AvailabilityResponse currentAvailability() {
        return AvailabilityResponse.of(availabilityGate, kafkaEventSink.isDegraded(), captureBuffer.size());
    }

    private void addSelfLink(TaskResponse response) {
        response.add(linkTo(methodOn(NotificationAdminController.class)
                .getTask(response.getTaskId())).withSelfRel());
    }
}
