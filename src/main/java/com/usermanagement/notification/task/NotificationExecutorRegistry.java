package com.usermanagement.notification.task;

import com.usermanagement.notification.event.EventType;
import com.usermanagement.notification.task.executor.NotificationExecutor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Slf4j
@Component
public class NotificationExecutorRegistry {

    private final Map<EventType, NotificationExecutor> executorMap = new EnumMap<>(EventType.class);

    public NotificationExecutorRegistry(List<NotificationExecutor> executors) {
        for (NotificationExecutor executor : executors) {
            NotificationExecutor existing = executorMap.putIfAbsent(executor.getSupportedType(), executor);
            if (existing != null) {
                throw new IllegalStateException("Duplicate executors for " + executor.getSupportedType() + ": "
                        + existing.getClass().getSimpleName() + ", " + executor.getClass().getSimpleName());
            }
        }

        log.info("Initialized NotificationExecutorRegistry with {} executors: {}",
                executorMap.size(), executorMap.keySet());
    }

    /**
     * Gets the executor for the given event type.
     *
     * @param eventType the event type
     * @return Optional containing the executor if one is registered
     */
    public Optional<NotificationExecutor> getExecutor(EventType eventType) {
        NotificationExecutor executor = executorMap.get(eventType);

        if (executor == null) {
            log.warn("No executor found for event type: {}", eventType);
            return Optional.empty();
        }

        return Optional.of(executor);
    }

    public boolean hasExecutor(EventType eventType) {
        return executorMap.containsKey(eventType);
    }
}
