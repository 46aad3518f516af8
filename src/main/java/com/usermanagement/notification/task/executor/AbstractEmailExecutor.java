package com.usermanagement.notification.task.executor;

import com.usermanagement.notification.event.EventPayloads;
import com.usermanagement.notification.event.EventType;
import com.usermanagement.notification.exception.NotificationExecutionException;
import com.usermanagement.notification.sender.SendResult;
import com.usermanagement.notification.sender.email.EmailSender;
import com.usermanagement.notification.task.ExecutionResult;
import com.usermanagement.notification.template.TemplateRenderer;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Render-then-send flow shared by all email executors. Subclasses only supply the context.
 */
@Slf4j
public abstract class AbstractEmailExecutor implements NotificationExecutor {

    static final String DEFAULT_NAME = "User";

    private final TemplateRenderer templateRenderer;
    private final EmailSender emailSender;

    protected AbstractEmailExecutor(TemplateRenderer templateRenderer, EmailSender emailSender) {
        this.templateRenderer = templateRenderer;
        this.emailSender = emailSender;
    }

    @Override
    public ExecutionResult execute(Map<String, Object> payload) {
        EventType eventType = getSupportedType();
        String email = EventPayloads.getString(payload, EventPayloads.EMAIL);
        log.info("Processing {} for {}", eventType.getDescription(), email);

        try {
            Map<String, Object> context = buildContext(payload);
            String html = templateRenderer.render(eventType.getTemplateName(), context);
            SendResult result = emailSender.send(eventType.getSubject(), html, email);

            if (result == null || !result.isSuccess()) {
                String error = result != null ? result.getErrorMessage() : "no result from email sender";
                throw new NotificationExecutionException(eventType, "Email was not sent: " + error, null);
            }

            String message = String.format("%s sent to %s", eventType.getDescription(), email);
            log.info(message);
            return ExecutionResult.success(message, result.getProviderId());

        } catch (NotificationExecutionException e) {
            log.error("Failed to send {} to {}: {}", eventType.getDescription(), email, e.getMessage());
            throw e;
        } catch (Exception e) {
            log.error("Failed to send {} to {}: {}", eventType.getDescription(), email, e.getMessage());
            throw new NotificationExecutionException(eventType, e.getMessage(), e);
        }
    }

    /**
     * Context entries every template can use: {@code name} and {@code email}.
     */
    protected Map<String, Object> baseContext(Map<String, Object> payload) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("name", EventPayloads.getString(payload, EventPayloads.FIRST_NAME, DEFAULT_NAME));
        context.put("email", EventPayloads.getString(payload, EventPayloads.EMAIL));
        return context;
    }
}
