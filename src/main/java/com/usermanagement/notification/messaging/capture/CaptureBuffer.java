package com.usermanagement.notification.messaging.capture;

import com.usermanagement.notification.event.EventType;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory, insertion-ordered log of events that bypassed the broker.
 * <p>
 * Entries keep the payload exactly as it was handed to the sink: no {@code timestamp} field is
 * injected, the capture time is kept on the entry instead. Nothing here survives a restart and
 * the log is unbounded until {@link #clear()} is called.
 */
@Slf4j
public class CaptureBuffer {

    private final List<CapturedEvent> events = new ArrayList<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final Clock clock;

    public CaptureBuffer() {
        this(Clock.systemUTC());
    }

    public CaptureBuffer(Clock clock) {
        this.clock = clock;
    }

    public CapturedEvent append(EventType eventType, Map<String, Object> payload) {
        CapturedEvent event = new CapturedEvent(
                eventType,
                Collections.unmodifiableMap(new LinkedHashMap<>(payload)),
                Instant.now(clock)
        );

        lock.lock();
        try {
            events.add(event);
        } finally {
            lock.unlock();
        }

        log.debug("Captured event for topic '{}': {}", eventType.getTopicName(), payload);
        return event;
    }

    public List<CapturedEvent> all() {
        lock.lock();
        try {
            return List.copyOf(events);
        } finally {
            lock.unlock();
        }
    }

    public Optional<CapturedEvent> last() {
        lock.lock();
        try {
            return events.isEmpty() ? Optional.empty() : Optional.of(events.get(events.size() - 1));
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return events.size();
        } finally {
            lock.unlock();
        }
    }

    public void clear() {
        lock.lock();
        try {
            events.clear();
        } finally {
            lock.unlock();
        }
        log.debug("Cleared captured events");
    }
}
