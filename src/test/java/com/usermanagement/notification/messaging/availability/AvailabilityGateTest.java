package com.usermanagement.notification.messaging.availability;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("AvailabilityGate Unit Tests")
class AvailabilityGateTest {

    @Test
    @DisplayName("Should not bypass when neither override nor test mode is set")
    void testBypassInactiveByDefault() {
        AvailabilityGate gate = new AvailabilityGate(() -> false);

        assertThat(gate.isForcedUnavailable()).isFalse();
        assertThat(gate.isTestModeActive()).isFalse();
        assertThat(gate.isBypassActive()).isFalse();
    }

    @Test
    @DisplayName("Should bypass while forced unavailable and stop once cleared")
    void testForcedUnavailableToggles() {
        AvailabilityGate gate = new AvailabilityGate(() -> false);

        gate.setUnavailable(true);
        assertThat(gate.isBypassActive()).isTrue();

        gate.setUnavailable(true);
        assertThat(gate.isForcedUnavailable()).isTrue();

        gate.setUnavailable(false);
        assertThat(gate.isBypassActive()).isFalse();
    }

    @Test
    @DisplayName("Should read test mode on every call")
    void testTestModeIsLive() {
        // Arrange
        AtomicBoolean testMode = new AtomicBoolean(false);
        AvailabilityGate gate = new AvailabilityGate(testMode::get);

        // Act & Assert
        assertThat(gate.isBypassActive()).isFalse();
        testMode.set(true);
        assertThat(gate.isBypassActive()).isTrue();
        assertThat(gate.isForcedUnavailable()).isFalse();
        testMode.set(false);
        assertThat(gate.isBypassActive()).isFalse();
    }
}
