package com.byterox.sentinel.domain.model;

public enum NotificationStatus {
    PENDING,
    SENT,
    FAILED
}
