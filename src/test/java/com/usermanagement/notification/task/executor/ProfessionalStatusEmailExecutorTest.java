package com.usermanagement.notification.task.executor;

import com.usermanagement.notification.sender.email.EmailSender;
import com.usermanagement.notification.template.TemplateRenderer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@ExtendWith(MockitoExtension.class)
@DisplayName("ProfessionalStatusEmailExecutor Unit Tests")
class ProfessionalStatusEmailExecutorTest {

    @Mock
    private TemplateRenderer templateRenderer;

    @Mock
    private EmailSender emailSender;

    private ProfessionalStatusEmailExecutor executor;
    private Map<String, Object> payload;

    @BeforeEach
    void setUp() {
        executor = new ProfessionalStatusEmailExecutor(templateRenderer, emailSender);
        payload = new HashMap<>();
        payload.put("email", "jane@example.com");
        payload.put("first_name", "Jane");
    }

    @Test
    @DisplayName("Should say upgraded when the user became professional")
    void testUpgraded() {
        payload.put("is_professional", true);

        assertThat(executor.buildContext(payload))
                .containsEntry("is_professional", true)
                .containsEntry("status_text", "upgraded to professional status");
    }

    @Test
    @DisplayName("Should say changed when the status was revoked")
    void testRevoked() {
        payload.put("is_professional", false);

        assertThat(executor.buildContext(payload))
                .containsEntry("is_professional", false)
                .containsEntry("status_text", "changed from professional status");
    }

    @Test
    @DisplayName("Should treat a missing flag as not professional")
    void testMissingFlag() {
        assertThat(executor.buildContext(payload)).containsEntry("status_text", ProfessionalStatusEmailExecutor.REVOKED_TEXT);
    }
}
