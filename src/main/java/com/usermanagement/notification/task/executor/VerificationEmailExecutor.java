package com.usermanagement.notification.task.executor;

import com.usermanagement.notification.config.NotificationProperties;
import com.usermanagement.notification.event.EventPayloads;
import com.usermanagement.notification.event.EventType;
import com.usermanagement.notification.sender.email.EmailSender;
import com.usermanagement.notification.template.TemplateRenderer;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
public class VerificationEmailExecutor extends AbstractEmailExecutor {

    private final NotificationProperties properties;

    public VerificationEmailExecutor(TemplateRenderer templateRenderer,
                                     EmailSender emailSender,
                                     NotificationProperties properties) {
        super(templateRenderer, emailSender);
        this.properties = properties;
    }

    @Override
    public EventType getSupportedType() {
        return EventType.EMAIL_VERIFICATION;
    }

    @Override
    public Map<String, Object> buildContext(Map<String, Object> payload) {
        Map<String, Object> context = baseContext(payload);
        context.put("verification_url", verificationUrl(payload));
        return context;
    }

    String verificationUrl(Map<String, Object> payload) {
        return String.format("%s/verify-email/%s/%s",
                properties.getServerBaseUrl(),
                EventPayloads.getString(payload, EventPayloads.ID),
                EventPayloads.getString(payload, EventPayloads.VERIFICATION_TOKEN));
    }
}
