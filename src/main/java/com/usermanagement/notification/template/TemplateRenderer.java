package com.usermanagement.notification.template;

import java.util.Map;

public interface TemplateRenderer {

    /**
     * Renders a named email template.
     *
     * @param templateName the template name, one of the event type template names
     * @param context      values for the placeholders the template references
     * @return the rendered HTML
     * @throws com.usermanagement.notification.exception.TemplateRenderException if the template
     *         does not exist or references a key missing from the context
     */
    String render(String templateName, Map<String, Object> context);
}
