package com.usermanagement.notification.template;

import com.usermanagement.notification.exception.TemplateRenderException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;
import org.springframework.util.PropertyPlaceholderHelper;
import org.springframework.util.StreamUtils;
import org.springframework.web.util.HtmlUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Renders {@code classpath:templates/email/<name>.html} between the shared header and footer.
 * <p>
 * Placeholders are written {@code {{key}}}. Values are HTML-escaped; an unresolved placeholder
 * fails the render.
 */
@Slf4j
@Component
public class ClasspathTemplateRenderer implements TemplateRenderer {

    static final String TEMPLATE_LOCATION = "classpath:templates/email/";
    static final String HEADER = "header";
    static final String FOOTER = "footer";

    private static final Pattern TEMPLATE_NAME = Pattern.compile("[a-z][a-z_]*");

    private final ResourceLoader resourceLoader;
    private final PropertyPlaceholderHelper placeholderHelper =
            new PropertyPlaceholderHelper("{{", "}}", null, false);
    private final Map<String, String> templateCache = new ConcurrentHashMap<>();

    public ClasspathTemplateRenderer(ResourceLoader resourceLoader) {
        this.resourceLoader = resourceLoader;
    }

    @Override
    public String render(String templateName, Map<String, Object> context) {
        if (templateName == null || !TEMPLATE_NAME.matcher(templateName).matches()) {
            throw new TemplateRenderException(templateName, "Invalid template name: " + templateName);
        }

        String source = loadTemplate(HEADER) + loadTemplate(templateName) + loadTemplate(FOOTER);

        try {
            String html = placeholderHelper.replacePlaceholders(source, key -> resolve(context, key));
            log.debug("Rendered template '{}' ({} chars)", templateName, html.length());
            return html;
        } catch (IllegalArgumentException e) {
            throw new TemplateRenderException(templateName,
                    "Failed to render template '" + templateName + "': " + e.getMessage(), e);
        }
    }

    private String resolve(Map<String, Object> context, String key) {
        Object value = context.get(key.trim());
        if (value == null) {
            return null;
        }
        // braces are escaped too so values are never parsed as placeholders
        return HtmlUtils.htmlEscape(String.valueOf(value))
                .replace("{", "&#123;")
                .replace("}", "&#125;");
    }

    private String loadTemplate(String name) {
        return templateCache.computeIfAbsent(name, this::readTemplate);
    }

    private String readTemplate(String name) {
        Resource resource = resourceLoader.getResource(TEMPLATE_LOCATION + name + ".html");
        if (!resource.exists()) {
            throw new TemplateRenderException(name, "Unknown email template: " + name);
        }
        try (InputStream in = resource.getInputStream()) {
            return StreamUtils.copyToString(in, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new TemplateRenderException(name, "Failed to read email template: " + name, e);
        }
    }
}
