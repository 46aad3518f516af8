package com.usermanagement.notification.service;

/**
 * What became of a notification request.
 */
public enum NotificationOutcome {
    PUBLISHED,
    CAPTURED,
    FALLBACK_SENT,
    FALLBACK_FAILED,
    DROPPED
}
