package com.usermanagement.notification.messaging.producer;

import com.usermanagement.notification.event.EventType;
import com.usermanagement.notification.messaging.availability.AvailabilityGate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Routes each publish to the broker or, while the gate reports bypass, to the capture buffer.
 */
@Slf4j
@Primary
@Component
@RequiredArgsConstructor
public class GatedEventSink implements EventSink {

    private final AvailabilityGate availabilityGate;
    private final KafkaEventSink kafkaEventSink;
    private final CapturingEventSink capturingEventSink;

    @Override
    public PublishResult publish(EventType eventType, Map<String, Object> payload) {
        if (availabilityGate.isBypassActive()) {
            log.debug("Broker bypass active (forcedUnavailable={}, testMode={}), capturing {}",
                    availabilityGate.isForcedUnavailable(), availabilityGate.isTestModeActive(), eventType);
            return capturingEventSink.publish(eventType, payload);
        }
        return kafkaEventSink.publish(eventType, payload);
    }
}
