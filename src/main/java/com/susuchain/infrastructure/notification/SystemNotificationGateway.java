package com.susuchain.infrastructure.notification;

import com.susuchain.domain.model.DeadlineNotification;
import com.susuchain.domain.model.NotificationPermission;

/**
 * Surface that shows a notification on the member's device.
 */
public interface SystemNotificationGateway {

    NotificationPermission currentPermission();

    /**
     * Prompts the member for consent. Only meaningful while the permission is DEFAULT.
     */
    NotificationPermission requestPermission();

    /**
     * Best effort; failures are logged, never thrown.
     */
    void show(DeadlineNotification notification);
}
