package com.usermanagement.notification.exception;

public class TemplateRenderException extends RuntimeException {

    private final String templateName;

    public TemplateRenderException(String templateName, String message) {
        super(message);
        this.templateName = templateName;
    }

    public TemplateRenderException(String templateName, String message, Throwable cause) {
        super(message, cause);
        this.templateName = templateName;
    }

    public String getTemplateName() {
        return templateName;
    }
}
