package com.susuchain.infrastructure.notification;

import com.susuchain.config.AutomationProperties;
import com.susuchain.domain.model.DeadlineNotification;
import com.susuchain.domain.model.NotificationPermission;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Hands deadline notifications to the member's push gateway through Kafka.
 *
 * Keyed by group address so all alerts of a group stay ordered on one partition.
 * The consent answer is configured (app.notifications.grant-permission-on-request)
 * because the prompt itself happens on the member's device.
 */
@Slf4j
@Component
public class KafkaNotificationGateway implements SystemNotificationGateway {

    private final KafkaTemplate<String, DeadlineNotification> kafkaTemplate;
    private final MeterRegistry meterRegistry;
    private final boolean grantOnRequest;
    private final AtomicReference<NotificationPermission> permission =
            new AtomicReference<>(NotificationPermission.DEFAULT);

    @Value("${app.kafka.topics.deadline-notifications}")
    private String notificationsTopic;

    public KafkaNotificationGateway(KafkaTemplate<String, DeadlineNotification> kafkaTemplate,
                                    MeterRegistry meterRegistry,
                                    AutomationProperties properties) {
        this.kafkaTemplate = kafkaTemplate;
        this.meterRegistry = meterRegistry;
        this.grantOnRequest = properties.getNotifications().isGrantPermissionOnRequest();
    }

    @Override
    public NotificationPermission currentPermission() {
        return permission.get();
    }

    @Override
    public NotificationPermission requestPermission() {
        NotificationPermission answer = grantOnRequest ? NotificationPermission.GRANTED : NotificationPermission.DENIED;
        permission.compareAndSet(NotificationPermission.DEFAULT, answer);
        return permission.get();
    }

    @Override
    public void show(DeadlineNotification notification) {
        try {
            kafkaTemplate.send(notificationsTopic, notification.getGroupAddress(), notification)
                    .whenComplete((result, ex) -> {
                        if (ex == null) {
                            log.debug("Published {} notification for group {} round {}",
                                    notification.getTier().getCode(), notification.getGroupAddress(),
                                    notification.getRoundNumber());
                        } else {
                            log.warn("Failed to publish notification for group {}: {}",
                                    notification.getGroupAddress(), ex.getMessage());
                            countFailure();
                        }
                    });
        } catch (Exception e) {
            log.warn("Error publishing notification for group {}: {}", notification.getGroupAddress(), e.getMessage());
            countFailure();
        }
    }

    private void countFailure() {
        Counter.builder("deadline.notification.publish")
                .tag("result", "failed")
                .register(meterRegistry)
                .increment();
    }
}
