package com.usermanagement.notification.messaging.availability;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;

/**
 * Decides whether publishing goes to the broker or is captured in memory.
 * <p>
 * Bypass is active when an operator forced the broker unavailable or when test mode is on.
 * Test mode is read from the supplier on every call so it can change at runtime.
 */
@Slf4j
public class AvailabilityGate {

    private final AtomicBoolean forcedUnavailable = new AtomicBoolean(false);
    private final BooleanSupplier testMode;

    public AvailabilityGate(BooleanSupplier testMode) {
        this.testMode = testMode;
    }

    public void setUnavailable(boolean unavailable) {
        boolean previous = forcedUnavailable.getAndSet(unavailable);
        if (previous != unavailable) {
            log.warn("Broker availability override changed: forcedUnavailable={}", unavailable);
        }
    }

    public boolean isForcedUnavailable() {
        return forcedUnavailable.get();
    }

    public boolean isTestModeActive() {
        return testMode.getAsBoolean();
    }

    public boolean isBypassActive() {
        return forcedUnavailable.get() || testMode.getAsBoolean();
    }
}
