package com.usermanagement.notification.sender.email;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EmailContent {

    private String to;

    private String subject;

    /**
     * HTML content of the email (preferred).
     */
    private String htmlContent;

    /**
     * Plain text content of the email (fallback).
     */
    private String plainTextContent;

    private String from;

    private String fromName;
}
