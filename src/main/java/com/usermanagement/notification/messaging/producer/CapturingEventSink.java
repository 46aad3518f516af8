package com.usermanagement.notification.messaging.producer;

import com.usermanagement.notification.event.EventType;
import com.usermanagement.notification.messaging.capture.CaptureBuffer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Records events in the {@link CaptureBuffer} instead of sending them anywhere.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CapturingEventSink implements EventSink {

    private final CaptureBuffer captureBuffer;

    @Override
    public PublishResult publish(EventType eventType, Map<String, Object> payload) {
        String topic = eventType.getTopicName();
        try {
            captureBuffer.append(eventType, payload);
            log.info("Event captured for topic {} while broker is bypassed", topic);
            return PublishResult.captured(topic);
        } catch (Exception e) {
            log.error("Failed to capture event for topic {}: {}", topic, e.getMessage(), e);
            return PublishResult.failure(topic, e.getMessage());
        }
    }
}
