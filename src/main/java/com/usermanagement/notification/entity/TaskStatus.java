package com.usermanagement.notification.entity;

public enum TaskStatus {
    PENDING,
    EXECUTING,
    RETRYING,
    SUCCEEDED,
    FAILED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED;
    }
}
