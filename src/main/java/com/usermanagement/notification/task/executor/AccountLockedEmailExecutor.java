package com.usermanagement.notification.task.executor;

import com.usermanagement.notification.config.NotificationProperties;
import com.usermanagement.notification.event.EventType;
import com.usermanagement.notification.sender.email.EmailSender;
import com.usermanagement.notification.template.TemplateRenderer;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
public class AccountLockedEmailExecutor extends AbstractEmailExecutor {

    private final NotificationProperties properties;

    public AccountLockedEmailExecutor(TemplateRenderer templateRenderer,
                                      EmailSender emailSender,
                                      NotificationProperties properties) {
        super(templateRenderer, emailSender);
        this.properties = properties;
    }

    @Override
    public EventType getSupportedType() {
        return EventType.ACCOUNT_LOCKED;
    }

    @Override
    public Map<String, Object> buildContext(Map<String, Object> payload) {
        Map<String, Object> context = baseContext(payload);
        context.put("support_email", properties.getSupportEmail());
        return context;
    }
}
