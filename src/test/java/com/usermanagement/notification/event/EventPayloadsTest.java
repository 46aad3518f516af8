package com.usermanagement.notification.event;

import com.usermanagement.notification.domain.UserAccount;
import com.usermanagement.notification.domain.UserRole;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Event catalog and payload builders")
class EventPayloadsTest {

    private UserAccount user;

    @BeforeEach
    void setUp() {
        user = UserAccount.builder()
                .id(UUID.fromString("00000000-0000-0000-0000-000000000001"))
                .email("jane@example.com")
                .firstName("Jane")
                .verificationToken("tok")
                .professional(true)
                .build();
    }

    @Test
    @DisplayName("Should carry every field the event type requires")
    void testPayloadsCoverRequiredFields() {
        assertThat(EventPayloads.emailVerification(user)).containsKeys(
                EventType.EMAIL_VERIFICATION.getRequiredFields().toArray(new String[0]));
        assertThat(EventPayloads.accountLocked(user)).containsOnlyKeys(
                EventType.ACCOUNT_LOCKED.getRequiredFields().toArray(new String[0]));
        assertThat(EventPayloads.roleUpgrade(user, UserRole.ADMIN)).containsEntry("new_role", "ADMIN");
        assertThat(EventPayloads.professionalStatus(user)).containsEntry("is_professional", true);
    }

    @Test
    @DisplayName("Should send the user id as a string")
    void testIdAsString() {
        assertThat(EventPayloads.accountUnlocked(user))
                .containsEntry("id", "00000000-0000-0000-0000-000000000001");
    }

    @Test
    @DisplayName("Should read flags sent as strings")
    void testGetBoolean() {
        assertThat(EventPayloads.getBoolean(Map.of("is_professional", "true"), "is_professional")).isTrue();
        assertThat(EventPayloads.getBoolean(Map.of(), "is_professional")).isFalse();
    }

    @Test
    @DisplayName("Should resolve event types from their topic")
    void testFromTopic() {
        assertThat(EventType.fromTopic("professional_status_upgrade")).isEqualTo(EventType.PROFESSIONAL_STATUS_UPGRADE);
        assertThat(EventType.topicNames()).hasSize(5).contains("email_verification", "account_unlocked");
        assertThatThrownBy(() -> EventType.fromTopic("password_reset")).isInstanceOf(IllegalArgumentException.class);
    }
}
