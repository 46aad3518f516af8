package com.usermanagement.notification.event;

import com.usermanagement.notification.domain.UserAccount;
import com.usermanagement.notification.domain.UserRole;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Payload field names and builders shared by producers and executors.
 */
public final class EventPayloads {

    public static final String ID = "id";
    public static final String EMAIL = "email";
    public static final String FIRST_NAME = "first_name";
    public static final String VERIFICATION_TOKEN = "verification_token";
    public static final String NEW_ROLE = "new_role";
    public static final String IS_PROFESSIONAL = "is_professional";
    public static final String TIMESTAMP = "timestamp";

    private EventPayloads() {
        // Private constructor to prevent instantiation
    }

    public static Map<String, Object> emailVerification(UserAccount user) {
        Map<String, Object> payload = userFields(user);
        payload.put(VERIFICATION_TOKEN, user.getVerificationToken());
        return payload;
    }

    public static Map<String, Object> accountLocked(UserAccount user) {
        return userFields(user);
    }

    public static Map<String, Object> accountUnlocked(UserAccount user) {
        return userFields(user);
    }

    public static Map<String, Object> roleUpgrade(UserAccount user, UserRole newRole) {
        Map<String, Object> payload = userFields(user);
        payload.put(NEW_ROLE, newRole.name());
        return payload;
    }

    public static Map<String, Object> professionalStatus(UserAccount user) {
        Map<String, Object> payload = userFields(user);
        payload.put(IS_PROFESSIONAL, user.isProfessional());
        return payload;
    }

    public static String getString(Map<String, Object> payload, String field) {
        Object value = payload.get(field);
        return value != null ? String.valueOf(value) : null;
    }

    public static String getString(Map<String, Object> payload, String field, String defaultValue) {
        String value = getString(payload, field);
        return value != null ? value : defaultValue;
    }

    /**
     * Reads a flag that may arrive as a Boolean or, after a JSON round trip through other
     * producers, as a string.
     */
    public static boolean getBoolean(Map<String, Object> payload, String field) {
        Object value = payload.get(field);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return value != null && Boolean.parseBoolean(String.valueOf(value));
    }

    private static Map<String, Object> userFields(UserAccount user) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(ID, String.valueOf(user.getId()));
        payload.put(EMAIL, user.getEmail());
        payload.put(FIRST_NAME, user.getFirstName());
        return payload;
    }
}
