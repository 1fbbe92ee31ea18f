package com.susuchain.infrastructure.notification;

import com.susuchain.config.AutomationProperties;
import com.susuchain.domain.model.DeadlineNotification;
import com.susuchain.domain.model.NotificationPermission;
import com.susuchain.domain.model.NotificationTier;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class KafkaNotificationGatewayTest {

    private static final String TOPIC = "susu.deadline.notifications";
    private static final String GROUP = "0x1111111111111111111111111111111111111111";

    @Mock private KafkaTemplate<String, DeadlineNotification> kafkaTemplate;

    private MeterRegistry meterRegistry;
    private AutomationProperties properties;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        properties = new AutomationProperties();
    }

    @Test
    void requestPermission_answersFromConfigurationOnce() {
        properties.getNotifications().setGrantPermissionOnRequest(false);
        KafkaNotificationGateway gateway = gateway();

        assertEquals(NotificationPermission.DEFAULT, gateway.currentPermission());
        assertEquals(NotificationPermission.DENIED, gateway.requestPermission());
        assertEquals(NotificationPermission.DENIED, gateway.currentPermission());
    }

    @Test
    void show_publishesKeyedByGroup() {
        KafkaNotificationGateway gateway = gateway();
        DeadlineNotification notification = notification();
        when(kafkaTemplate.send(TOPIC, GROUP, notification))
                .thenReturn(CompletableFuture.completedFuture(null));

        gateway.show(notification);

        verify(kafkaTemplate).send(TOPIC, GROUP, notification);
        assertEquals(0.0, meterRegistry.counter("deadline.notification.publish", "result", "failed").count());
    }

    @Test
    void show_publishFailure_countedNotThrown() {
        KafkaNotificationGateway gateway = gateway();
        DeadlineNotification notification = notification();
        when(kafkaTemplate.send(TOPIC, GROUP, notification))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker down")));

        assertDoesNotThrow(() -> gateway.show(notification));
        assertEquals(1.0, meterRegistry.counter("deadline.notification.publish", "result", "failed").count());
    }

    private KafkaNotificationGateway gateway() {
        KafkaNotificationGateway gateway = new KafkaNotificationGateway(kafkaTemplate, meterRegistry, properties);
        ReflectionTestUtils.setField(gateway, "notificationsTopic", TOPIC);
        return gateway;
    }

    private static DeadlineNotification notification() {
        return DeadlineNotification.builder()
                .groupAddress(GROUP)
                .groupName("Family")
                .roundNumber(2)
                .tier(NotificationTier.TIER_6H)
                .message(NotificationTier.TIER_6H.render("Family", 2))
                .build();
    }
}
