package com.usermanagement.notification.sender.email;

import com.usermanagement.notification.exception.NotificationSendException;
import com.usermanagement.notification.exception.PermanentSendException;
import com.usermanagement.notification.exception.TransientSendException;
import com.usermanagement.notification.sender.SendResult;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.mail.MailAuthenticationException;
import org.springframework.mail.MailException;
import org.springframework.mail.MailSendException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Component;

import java.io.UnsupportedEncodingException;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Delivers rendered notifications through the SMTP server configured under {@code spring.mail.*}.
 * Failures are classified as transient or permanent from the mail exception.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SmtpEmailSender implements EmailSender {

    static final String NOTIFICATION_ID_HEADER = "X-Notification-Id";

    private static final List<String> TRANSIENT_MARKERS =
            List.of("timeout", "timed out", "connection", "network", "temporarily", "try again", "421", "450", "451");

    private final JavaMailSender mailSender;

    @Value("${notification.email.default-from-email}")
    private String defaultFromEmail;

    @Value("${notification.email.default-from-name}")
    private String defaultFromName;

    @Value("${notification.email.enabled:true}")
    private boolean enabled;

    @Override
    public SendResult send(String subject, String htmlBody, String recipientEmail) {
        if (!isAvailable()) {
            log.error("SMTP email sender is disabled, cannot send '{}'", subject);
            throw new PermanentSendException("Email sender is not properly configured");
        }
        if (recipientEmail == null || recipientEmail.isBlank()) {
            log.error("Recipient email is missing for '{}'", subject);
            throw new PermanentSendException("Recipient email is required");
        }

        EmailContent content = buildEmailContent(subject, htmlBody, recipientEmail);
        content.setFrom(defaultFromEmail);
        content.setFromName(defaultFromName);

        try {
            String messageId = deliver(content);
            log.info("Email '{}' sent via SMTP to {}, messageId={}", subject, recipientEmail, messageId);
            return SendResult.success(messageId, LocalDateTime.now());
        } catch (MailException e) {
            log.error("SMTP delivery of '{}' to {} failed: {}", subject, recipientEmail, e.getMessage());
            throw classify(e);
        } catch (MessagingException | UnsupportedEncodingException e) {
            log.error("Could not build message '{}' for {}: {}", subject, recipientEmail, e.getMessage());
            throw new PermanentSendException("Failed to create email message: " + e.getMessage(), e);
        }
    }

    @Override
    public boolean isAvailable() {
        return enabled && mailSender != null;
    }

    private String deliver(EmailContent content) throws MessagingException, UnsupportedEncodingException {
        MimeMessage message = mailSender.createMimeMessage();
        MimeMessageHelper helper = new MimeMessageHelper(message, true, "UTF-8");

        helper.setFrom(content.getFrom(), content.getFromName());
        helper.setTo(content.getTo());
        helper.setSubject(content.getSubject());
        helper.setText(content.getPlainTextContent(), content.getHtmlContent());

        String messageId = UUID.randomUUID().toString();
        message.setHeader(NOTIFICATION_ID_HEADER, messageId);

        mailSender.send(message);
        return messageId;
    }

    private NotificationSendException classify(MailException e) {
        if (e instanceof MailAuthenticationException) {
            return new PermanentSendException("Email authentication failed. Check SMTP credentials.", e);
        }
        if (e instanceof MailSendException && !looksTransient(e)) {
            return new PermanentSendException("Email sending failed: " + e.getMessage(), e);
        }
        return new TransientSendException("Temporary email sending failure: " + e.getMessage(), e);
    }

    private static boolean looksTransient(MailException e) {
        String message = e.getMessage() != null ? e.getMessage().toLowerCase(Locale.ROOT) : "";
        return TRANSIENT_MARKERS.stream().anyMatch(message::contains);
    }
}
