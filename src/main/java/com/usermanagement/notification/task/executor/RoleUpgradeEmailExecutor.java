package com.usermanagement.notification.task.executor;

import com.usermanagement.notification.domain.UserRole;
import com.usermanagement.notification.event.EventPayloads;
import com.usermanagement.notification.event.EventType;
import com.usermanagement.notification.sender.email.EmailSender;
import com.usermanagement.notification.template.TemplateRenderer;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
public class RoleUpgradeEmailExecutor extends AbstractEmailExecutor {

    static final String GENERIC_ROLE_DESCRIPTION = "user with updated permissions";

    private static final Map<String, String> ROLE_DESCRIPTIONS = Map.of(
            UserRole.AUTHENTICATED.name(), "regular authenticated user",
            UserRole.MANAGER.name(), "manager with additional privileges",
            UserRole.ADMIN.name(), "administrator with full system access"
    );

    public RoleUpgradeEmailExecutor(TemplateRenderer templateRenderer, EmailSender emailSender) {
        super(templateRenderer, emailSender);
    }

    @Override
    public EventType getSupportedType() {
        return EventType.ROLE_UPGRADE;
    }

    @Override
    public Map<String, Object> buildContext(Map<String, Object> payload) {
        String newRole = EventPayloads.getString(payload, EventPayloads.NEW_ROLE);

        Map<String, Object> context = baseContext(payload);
        context.put("new_role", newRole);
        context.put("role_description", describeRole(newRole));
        return context;
    }

    static String describeRole(String roleName) {
        if (roleName == null) {
            return GENERIC_ROLE_DESCRIPTION;
        }
        return ROLE_DESCRIPTIONS.getOrDefault(roleName, GENERIC_ROLE_DESCRIPTION);
    }
}
