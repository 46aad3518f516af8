package com.usermanagement.notification.sender.email;

import com.usermanagement.notification.sender.SendResult;

public interface EmailSender {

    /**
     * Sends an HTML email.
     *
     * @param subject        the subject line
     * @param htmlBody       the rendered HTML body
     * @param recipientEmail the recipient address
     * @return SendResult describing the delivery
     * @throws com.usermanagement.notification.exception.NotificationSendException if the mail
     *         server rejects the message or cannot be reached
     */
    SendResult send(String subject, String htmlBody, String recipientEmail);

    /**
     * Checks if the sender is enabled and properly configured.
     *
     * @return true if the sender is available, false otherwise
     */
    boolean isAvailable();

    /**
     * Builds the email content for a rendered notification.
     */
    default EmailContent buildEmailContent(String subject, String htmlBody, String recipientEmail) {
        return EmailContent.builder()
                .to(recipientEmail)
                .subject(subject)
                .htmlContent(htmlBody)
                .plainTextContent(toPlainText(htmlBody))
                .build();
    }

    /**
     * Strips markup so clients without HTML support still get readable text.
     */
    default String toPlainText(String htmlBody) {
        if (htmlBody == null) {
            return "";
        }
        return htmlBody
                .replaceAll("(?is)<head>.*?</head>", "")
                .replaceAll("(?i)<br\\s*/?>", "\n")
                .replaceAll("(?i)</p>", "\n\n")
                .replaceAll("<[^>]+>", "")
                .replaceAll("[ \\t]+", " ")
                .replaceAll("\\n\\s*\\n\\s*\\n+", "\n\n")
                .trim();
    }
}
