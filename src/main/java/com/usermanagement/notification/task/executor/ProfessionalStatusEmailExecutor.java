package com.usermanagement.notification.task.executor;

import com.usermanagement.notification.event.EventPayloads;
import com.usermanagement.notification.event.EventType;
import com.usermanagement.notification.sender.email.EmailSender;
import com.usermanagement.notification.template.TemplateRenderer;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
public class ProfessionalStatusEmailExecutor extends AbstractEmailExecutor {

    static final String UPGRADED_TEXT = "upgraded to professional status";
    static final String REVOKED_TEXT = "changed from professional status";

    public ProfessionalStatusEmailExecutor(TemplateRenderer templateRenderer, EmailSender emailSender) {
        super(templateRenderer, emailSender);
    }

    @Override
    public EventType getSupportedType() {
        return EventType.PROFESSIONAL_STATUS_UPGRADE;
    }

    @Override
    public Map<String, Object> buildContext(Map<String, Object> payload) {
        boolean professional = EventPayloads.getBoolean(payload, EventPayloads.IS_PROFESSIONAL);

        Map<String, Object> context = baseContext(payload);
        context.put("is_professional", professional);
        context.put("status_text", professional ? UPGRADED_TEXT : REVOKED_TEXT);
        return context;
    }
}
