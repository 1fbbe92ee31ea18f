package com.susuchain.domain.service;

import com.susuchain.config.AutomationProperties;
import com.susuchain.config.AutomationProperties.TierSelectionMode;
import com.susuchain.domain.model.DeadlineNotification;
import com.susuchain.domain.model.DeadlineSnapshot;
import com.susuchain.domain.model.NotificationTier;
import com.susuchain.infrastructure.notification.SystemNotificationGateway;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Tiered contribution reminders for a round's deadline.
 *
 * Per (group, round) the tiers progress 24h -> 6h -> 1h -> overdue as time runs
 * out. Each tick:
 * 1. Select a tier from the time remaining (overdue once it reaches zero)
 * 2. Suppress it if the delivery record already has it
 * 3. Show it if the member granted permission, then mark it delivered
 *
 * Delivery is recorded even without permission, so a later grant does not replay
 * stale reminders.
 *
 * Tier selection modes:
 * - WINDOW: a tier fires only while time remaining sits in the window just below
 *   its threshold. A polling interval wider than the window can skip a tier.
 * - CROSSING: the most urgent threshold already crossed fires if not yet delivered,
 *   independent of polling cadence.
 *
 * Ticks for one group must arrive in time order; a tick older than the last one
 * seen for that group is dropped.
 */
@Slf4j
@Service
public class DeadlineNotifier {

    private final NotificationDeliveryService deliveryService;
    private final NotificationPermissionGate permissionGate;
    private final SystemNotificationGateway gateway;
    private final MeterRegistry meterRegistry;
    private final TierSelectionMode selectionMode;
    private final long windowSeconds;
    private final ConcurrentMap<String, Instant> lastTickByGroup = new ConcurrentHashMap<>();

    public DeadlineNotifier(NotificationDeliveryService deliveryService,
                            NotificationPermissionGate permissionGate,
                            SystemNotificationGateway gateway,
                            MeterRegistry meterRegistry,
                            AutomationProperties properties) {
        this.deliveryService = deliveryService;
        this.permissionGate = permissionGate;
        this.gateway = gateway;
        this.meterRegistry = meterRegistry;

        AutomationProperties.NotificationConfig config = properties.getNotifications();
        this.selectionMode = config.getTierSelection();
        this.windowSeconds = config.getTierWindow().getSeconds();

        if (selectionMode == TierSelectionMode.WINDOW
                && config.getPollingInterval().getSeconds() > windowSeconds) {
            log.warn("Polling interval {} exceeds tier window {}; tiers may be skipped. "
                            + "Widen app.notifications.tier-window or use tier-selection CROSSING",
                    config.getPollingInterval(), config.getTierWindow());
        }
    }

    /**
     * Evaluates one polling tick.
     *
     * @return the notification delivered on this tick, if any
     */
    public Optional<DeadlineNotification> onTick(DeadlineSnapshot snapshot) {
        String groupKey = snapshot.getGroupAddress().toLowerCase();
        Instant previous = lastTickByGroup.get(groupKey);
        if (previous != null && snapshot.getObservedAt().isBefore(previous)) {
            log.debug("Dropping out-of-order tick for group {}: {} < {}",
                    snapshot.getGroupAddress(), snapshot.getObservedAt(), previous);
            return Optional.empty();
        }
        lastTickByGroup.put(groupKey, snapshot.getObservedAt());

        long timeRemaining = snapshot.timeRemainingSeconds();
        Set<NotificationTier> delivered =
                deliveryService.deliveredTiers(snapshot.getGroupAddress(), snapshot.getRoundNumber());

        Optional<NotificationTier> selected = selectTier(timeRemaining, delivered);
        if (selected.isEmpty()) {
            return Optional.empty();
        }

        NotificationTier tier = selected.get();
        if (delivered.contains(tier)) {
            log.debug("Suppressing duplicate {} notification for group {} round {}",
                    tier.getCode(), snapshot.getGroupAddress(), snapshot.getRoundNumber());
            record(tier, "suppressed");
            return Optional.empty();
        }

        DeadlineNotification notification = DeadlineNotification.builder()
                .groupAddress(snapshot.getGroupAddress())
                .groupName(snapshot.getGroupName())
                .roundNumber(snapshot.getRoundNumber())
                .tier(tier)
                .timeRemainingSeconds(timeRemaining)
                .message(tier.render(snapshot.getGroupName(), snapshot.getRoundNumber()))
                .requireInteraction(tier.isRequireInteraction())
                .build();

        if (permissionGate.isGranted()) {
            gateway.show(notification);
        } else {
            log.debug("Notification permission not granted; recording {} for group {} without showing it",
                    tier.getCode(), snapshot.getGroupAddress());
        }

        deliveryService.markDelivered(snapshot.getGroupAddress(), snapshot.getRoundNumber(), tier);

        log.info("Deadline notification {} for group {} round {} ({})", tier.getCode(),
                snapshot.getGroupAddress(), snapshot.getRoundNumber(), formatTimeRemaining(timeRemaining));
        record(tier, "delivered");

        return Optional.of(notification);
    }

    /**
     * Tier for the time remaining under the configured selection mode, before dedup.
     */
    public Optional<NotificationTier> selectTier(long timeRemaining, Set<NotificationTier> delivered) {
        if (timeRemaining <= 0) {
            return Optional.of(NotificationTier.OVERDUE);
        }

        for (NotificationTier tier : NotificationTier.TIMED_BY_URGENCY) {
            long threshold = tier.getThresholdSeconds();
            if (timeRemaining > threshold) {
                continue;
            }
            if (selectionMode == TierSelectionMode.CROSSING) {
                // Less urgent tiers are stale once a more urgent threshold is crossed.
                return delivered.contains(tier) ? Optional.empty() : Optional.of(tier);
            }
            if (timeRemaining > threshold - windowSeconds) {
                return Optional.of(tier);
            }
        }
        return Optional.empty();
    }

    /**
     * "Overdue", "2d 3h", "5h 12m" or "42m".
     */
    public static String formatTimeRemaining(long seconds) {
        if (seconds <= 0) {
            return "Overdue";
        }

        long days = seconds / (24 * 60 * 60);
        long hours = (seconds % (24 * 60 * 60)) / (60 * 60);
        long minutes = (seconds % (60 * 60)) / 60;

        if (days > 0) {
            return days + "d " + hours + "h";
        } else if (hours > 0) {
            return hours + "h " + minutes + "m";
        }
        return minutes + "m";
    }

    private void record(NotificationTier tier, String result) {
        Counter.builder("deadline.notification")
                .tag("tier", tier.getCode())
                .tag("result", result)
                .register(meterRegistry)
                .increment();
    }
}
