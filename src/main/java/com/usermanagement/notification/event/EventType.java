package com.usermanagement.notification.event;

import java.util.Arrays;
import java.util.List;

/**
 * Account lifecycle events that trigger a notification email.
 * <p>
 * The topic name doubles as the template name, so adding a kind means adding a constant here,
 * a template under {@code templates/email/} and an executor bean.
 */
public enum EventType {

    EMAIL_VERIFICATION(
            "email_verification",
            "Email verification notification",
            "Verify Your Account",
            List.of("id", "email", "first_name", "verification_token")),

    ACCOUNT_LOCKED(
            "account_locked",
            "Account locking notification",
            "Account Locked Notification",
            List.of("id", "email", "first_name")),

    ACCOUNT_UNLOCKED(
            "account_unlocked",
            "Account unlocking notification",
            "Account Unlocked Notification",
            List.of("id", "email", "first_name")),

    ROLE_UPGRADE(
            "role_upgrade",
            "Role upgrade notification",
            "Role Update Notification",
            List.of("id", "email", "first_name", "new_role")),

    PROFESSIONAL_STATUS_UPGRADE(
            "professional_status_upgrade",
            "Professional status upgrade notification",
            "Professional Status Update",
            List.of("id", "email", "first_name", "is_professional"));

    private final String topicName;
    private final String description;
    private final String subject;
    private final List<String> requiredFields;

    EventType(String topicName, String description, String subject, List<String> requiredFields) {
        this.topicName = topicName;
        this.description = description;
        this.subject = subject;
        this.requiredFields = requiredFields;
    }

    public String getTopicName() {
        return topicName;
    }

    public String getTemplateName() {
        return topicName;
    }

    public String getDescription() {
        return description;
    }

    public String getSubject() {
        return subject;
    }

    public List<String> getRequiredFields() {
        return requiredFields;
    }

    /**
     * Resolves the event type published on the given topic.
     *
     * @param topicName the Kafka topic
     * @return the matching event type
     * @throws IllegalArgumentException if no event type uses the topic
     */
    public static EventType fromTopic(String topicName) {
        return Arrays.stream(values())
                .filter(type -> type.topicName.equals(topicName))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown event topic: " + topicName));
    }

    public static String[] topicNames() {
        return Arrays.stream(values())
                .map(EventType::getTopicName)
                .toArray(String[]::new);
    }
}
