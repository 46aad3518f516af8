package com.usermanagement.notification.task.executor;

import com.usermanagement.notification.sender.email.EmailSender;
import com.usermanagement.notification.template.TemplateRenderer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@ExtendWith(MockitoExtension.class)
@DisplayName("RoleUpgradeEmailExecutor Unit Tests")
class RoleUpgradeEmailExecutorTest {

    @Mock
    private TemplateRenderer templateRenderer;

    @Mock
    private EmailSender emailSender;

    private RoleUpgradeEmailExecutor executor;

    @BeforeEach
    void setUp() {
        executor = new RoleUpgradeEmailExecutor(templateRenderer, emailSender);
    }

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
            "AUTHENTICATED, regular authenticated user",
            "MANAGER, manager with additional privileges",
            "ADMIN, administrator with full system access",
            "ANONYMOUS, user with updated permissions",
            "SUPERUSER, user with updated permissions"
    })
    @DisplayName("Should describe the new role")
    void testRoleDescription(String role, String description) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("email", "jane@example.com");
        payload.put("first_name", "Jane");
        payload.put("new_role", role);

        Map<String, Object> context = executor.buildContext(payload);

        assertThat(context)
                .containsEntry("name", "Jane")
                .containsEntry("new_role", role)
                .containsEntry("role_description", description);
    }

    @Test
    @DisplayName("Should fall back to the generic description when no role is given")
    void testMissingRole() {
        assertThat(RoleUpgradeEmailExecutor.describeRole(null))
                .isEqualTo(RoleUpgradeEmailExecutor.GENERIC_ROLE_DESCRIPTION);
    }
}
