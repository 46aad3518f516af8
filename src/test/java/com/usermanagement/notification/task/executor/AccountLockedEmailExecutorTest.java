package com.usermanagement.notification.task.executor;

import com.usermanagement.notification.config.NotificationProperties;
import com.usermanagement.notification.sender.email.EmailSender;
import com.usermanagement.notification.template.TemplateRenderer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@ExtendWith(MockitoExtension.class)
class AccountLockedEmailExecutorTest {

    @Mock
    private TemplateRenderer templateRenderer;

    @Mock
    private EmailSender emailSender;

    @Test
    @DisplayName("Should point locked users to the configured support address")
    void testSupportEmail() {
        NotificationProperties properties = new NotificationProperties();
        AccountLockedEmailExecutor executor = new AccountLockedEmailExecutor(templateRenderer, emailSender, properties);

        Map<String, Object> context = executor.buildContext(Map.of("email", "jane@example.com"));

        assertThat(context)
                .containsEntry("name", "User")
                .containsEntry("support_email", "support@example.com");
    }
}
