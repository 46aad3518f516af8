package com.usermanagement.notification.task.executor;

import com.usermanagement.notification.event.EventType;
import com.usermanagement.notification.sender.email.EmailSender;
import com.usermanagement.notification.template.TemplateRenderer;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
public class AccountUnlockedEmailExecutor extends AbstractEmailExecutor {

    public AccountUnlockedEmailExecutor(TemplateRenderer templateRenderer, EmailSender emailSender) {
        super(templateRenderer, emailSender);
    }

    @Override
    public EventType getSupportedType() {
        return EventType.ACCOUNT_UNLOCKED;
    }

    @Override
    public Map<String, Object> buildContext(Map<String, Object> payload) {
        return baseContext(payload);
    }
}
