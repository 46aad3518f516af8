package com.usermanagement.notification.validator;

import com.usermanagement.notification.event.EventType;
import com.usermanagement.notification.exception.InvalidPayloadException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.validator.routines.EmailValidator;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
@Component
public class EventPayloadValidator {

    private final EmailValidator emailValidator = EmailValidator.getInstance();

    /**
     * Validates an event payload against the fields its type requires.
     *
     * @param eventType the event type
     * @param payload   the payload to publish
     * @throws InvalidPayloadException if validation fails
     */
    public void validate(EventType eventType, Map<String, Object> payload) {
        if (eventType == null) {
            throw new InvalidPayloadException(null, "Event type is required");
        }
        if (payload == null) {
            throw new InvalidPayloadException(eventType, "Payload is required for " + eventType);
        }

        List<String> missing = eventType.getRequiredFields().stream()
                .filter(field -> payload.get(field) == null)
                .collect(Collectors.toList());

        if (!missing.isEmpty()) {
            throw new InvalidPayloadException(eventType,
                    "Missing required fields for " + eventType + ": " + missing);
        }

        Object email = payload.get("email");
        if (!(email instanceof String) || !emailValidator.isValid((String) email)) {
            throw new InvalidPayloadException(eventType, "Invalid email address: " + email);
        }

        if (eventType == EventType.PROFESSIONAL_STATUS_UPGRADE
                && !(payload.get("is_professional") instanceof Boolean)) {
            throw new InvalidPayloadException(eventType, "is_professional must be a boolean");
        }

        log.debug("Payload validated for {}: {}", eventType, payload.get("email"));
    }
}
