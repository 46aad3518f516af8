package com.usermanagement.notification.messaging.producer;

import com.usermanagement.notification.event.EventType;
import com.usermanagement.notification.messaging.availability.AvailabilityGate;
import com.usermanagement.notification.messaging.capture.CaptureBuffer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("GatedEventSink Unit Tests")
class GatedEventSinkTest {

    @Mock
    private KafkaEventSink kafkaEventSink;

    private AtomicBoolean testMode;
    private AvailabilityGate availabilityGate;
    private CaptureBuffer captureBuffer;
    private GatedEventSink gatedEventSink;

    private final Map<String, Object> payload = Map.of(
            "id", "u1", "email", "jane@example.com", "first_name", "Jane");

    @BeforeEach
    void setUp() {
        testMode = new AtomicBoolean(false);
        availabilityGate = new AvailabilityGate(testMode::get);
        captureBuffer = new CaptureBuffer();
        gatedEventSink = new GatedEventSink(availabilityGate, kafkaEventSink, new CapturingEventSink(captureBuffer));
    }

    @Test
    @DisplayName("Should publish to Kafka when no bypass is active")
    void testRoutesToKafka() {
        // Arrange
        when(kafkaEventSink.publish(EventType.ACCOUNT_LOCKED, payload))
                .thenReturn(PublishResult.published("account_locked", Instant.now()));

        // Act
        PublishResult result = gatedEventSink.publish(EventType.ACCOUNT_LOCKED, payload);

        // Assert
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.isCaptured()).isFalse();
        assertThat(captureBuffer.size()).isZero();
    }

    @Test
    @DisplayName("Should capture exactly one entry per publish while forced unavailable")
    void testCapturesWhenForcedUnavailable() {
        // Arrange
        availabilityGate.setUnavailable(true);

        // Act
        PublishResult result = gatedEventSink.publish(EventType.ACCOUNT_LOCKED, payload);

        // Assert
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.isCaptured()).isTrue();
        assertThat(captureBuffer.size()).isEqualTo(1);
        assertThat(captureBuffer.last()).get()
                .satisfies(event -> {
                    assertThat(event.getTopic()).isEqualTo("account_locked");
                    assertThat(event.getPayload()).isEqualTo(payload);
                });
        verify(kafkaEventSink, never()).publish(any(), any());
    }

    @Test
    @DisplayName("Should capture while test mode is on and resume publishing when it is switched off")
    void testFollowsTestModeAtRuntime() {
        // Arrange
        when(kafkaEventSink.publish(EventType.ROLE_UPGRADE, payload))
                .thenReturn(PublishResult.published("role_upgrade", Instant.now()));

        // Act
        testMode.set(true);
        gatedEventSink.publish(EventType.ROLE_UPGRADE, payload);
        testMode.set(false);
        PublishResult result = gatedEventSink.publish(EventType.ROLE_UPGRADE, payload);

        // Assert
        assertThat(captureBuffer.size()).isEqualTo(1);
        assertThat(result.isCaptured()).isFalse();
        verify(kafkaEventSink).publish(EventType.ROLE_UPGRADE, payload);
    }
}
