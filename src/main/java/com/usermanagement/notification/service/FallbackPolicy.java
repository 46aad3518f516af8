package com.usermanagement.notification.service;

/**
 * What the notification service does when an event could not be published.
 */
public enum FallbackPolicy {

    /**
     * Render and send the email synchronously, bypassing the event pipeline.
     */
    DIRECT_SEND,

    /**
     * Log the failure and drop the notification.
     */
    LOG_ONLY
}
