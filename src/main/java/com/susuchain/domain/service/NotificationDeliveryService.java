package com.susuchain.domain.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.susuchain.config.AutomationProperties;
import com.susuchain.domain.model.NotificationTier;
import com.susuchain.infrastructure.persistence.DeliveryRecordStorage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Delivery records for deadline notifications.
 *
 * Guarantees at most one delivery per (group, round, tier):
 * 1. Look up the record for (group, round)
 * 2. If the tier is marked, the notification is a duplicate
 * 3. Otherwise deliver, then mark the tier
 *
 * Records live under "<namespace>-notification-<groupAddress>-<roundNumber>"
 * with a JSON map of tier code to true as value. Rounds are never cleared
 * explicitly: the next round simply has no record yet.
 *
 * Storage is local to this deployment; dedup across devices is not provided.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NotificationDeliveryService {

    private static final TypeReference<LinkedHashMap<String, Boolean>> TIER_MAP = new TypeReference<>() {
    };

    private final DeliveryRecordStorage storage;
    private final ObjectMapper objectMapper;
    private final AutomationProperties properties;

    public String recordKey(String groupAddress, long roundNumber) {
        return String.format("%s-notification-%s-%d",
                properties.getNotifications().getNamespace(), groupAddress.toLowerCase(), roundNumber);
    }

    public boolean wasDelivered(String groupAddress, long roundNumber, NotificationTier tier) {
        return deliveredTiers(groupAddress, roundNumber).contains(tier);
    }

    public Set<NotificationTier> deliveredTiers(String groupAddress, long roundNumber) {
        Optional<String> stored = storage.get(recordKey(groupAddress, roundNumber));
        Set<NotificationTier> tiers = EnumSet.noneOf(NotificationTier.class);
        if (stored.isEmpty()) {
            return tiers;
        }

        parse(stored.get()).forEach((code, delivered) -> {
            if (!Boolean.TRUE.equals(delivered)) {
                return;
            }
            try {
                tiers.add(NotificationTier.fromCode(code));
            } catch (IllegalArgumentException e) {
                log.warn("Ignoring unknown tier '{}' in delivery record for group {} round {}",
                        code, groupAddress, roundNumber);
            }
        });
        return tiers;
    }

    public void markDelivered(String groupAddress, long roundNumber, NotificationTier tier) {
        String key = recordKey(groupAddress, roundNumber);

        storage.update(key, current -> {
            Map<String, Boolean> tiers = current == null ? new LinkedHashMap<>() : parse(current);
            tiers.put(tier.getCode(), Boolean.TRUE);
            return write(tiers);
        });

        log.debug("Marked {} delivered for key: {}", tier.getCode(), key);
    }

    private Map<String, Boolean> parse(String json) {
        try {
            return objectMapper.readValue(json, TIER_MAP);
        } catch (JsonProcessingException e) {
            log.warn("Discarding unreadable delivery record: {}", e.getOriginalMessage());
            return new LinkedHashMap<>();
        }
    }

    private String write(Map<String, Boolean> tiers) {
        try {
            return objectMapper.writeValueAsString(tiers);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialise delivery record", e);
        }
    }
}
