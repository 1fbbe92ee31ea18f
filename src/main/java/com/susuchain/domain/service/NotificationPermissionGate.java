package com.susuchain.domain.service;

import com.susuchain.domain.model.NotificationPermission;
import com.susuchain.infrastructure.notification.SystemNotificationGateway;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Asks for notification consent at most once per session.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class NotificationPermissionGate {

    private final SystemNotificationGateway gateway;
    private final AtomicBoolean requested = new AtomicBoolean();

    public boolean isGranted() {
        NotificationPermission permission = gateway.currentPermission();

        if (permission == NotificationPermission.DEFAULT && requested.compareAndSet(false, true)) {
            permission = gateway.requestPermission();
            log.info("Notification permission requested: {}", permission);
        }

        return permission == NotificationPermission.GRANTED;
    }
}
