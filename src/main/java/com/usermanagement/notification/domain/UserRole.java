package com.usermanagement.notification.domain;

public enum UserRole {
    ANONYMOUS,
    AUTHENTICATED,
    MANAGER,
    ADMIN
}
