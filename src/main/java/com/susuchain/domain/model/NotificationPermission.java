package com.susuchain.domain.model;

/**
 * Member consent for system notifications: DEFAULT until asked, then GRANTED or DENIED.
 */
public enum NotificationPermission {
    DEFAULT,
    GRANTED,
    DENIED
}
