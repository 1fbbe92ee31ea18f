package com.susuchain.domain.service;

import com.susuchain.domain.model.NotificationPermission;
import com.susuchain.infrastructure.notification.SystemNotificationGateway;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class NotificationPermissionGateTest {

    @Mock private SystemNotificationGateway gateway;

    @Test
    void isGranted_requestsConsentOnlyOnce() {
        when(gateway.currentPermission()).thenReturn(NotificationPermission.DEFAULT);
        when(gateway.requestPermission()).thenReturn(NotificationPermission.DEFAULT);
        NotificationPermissionGate gate = new NotificationPermissionGate(gateway);

        assertFalse(gate.isGranted());
        assertFalse(gate.isGranted());

        verify(gateway, times(1)).requestPermission();
    }

    @Test
    void isGranted_denied_neverPrompts() {
        when(gateway.currentPermission()).thenReturn(NotificationPermission.DENIED);
        NotificationPermissionGate gate = new NotificationPermissionGate(gateway);

        assertFalse(gate.isGranted());
        verify(gateway, never()).requestPermission();
    }

    @Test
    void isGranted_grantedOnRequest() {
        when(gateway.currentPermission()).thenReturn(NotificationPermission.DEFAULT);
        when(gateway.requestPermission()).thenReturn(NotificationPermission.GRANTED);
        NotificationPermissionGate gate = new NotificationPermissionGate(gateway);

        assertTrue(gate.isGranted());
    }
}
