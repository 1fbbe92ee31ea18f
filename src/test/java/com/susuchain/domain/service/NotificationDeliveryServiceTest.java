package com.susuchain.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.susuchain.config.AutomationProperties;
import com.susuchain.domain.model.NotificationTier;
import com.susuchain.infrastructure.persistence.InMemoryDeliveryRecordStorage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class NotificationDeliveryServiceTest {

    private static final String GROUP = "0xAbCd000000000000000000000000000000000001";

    private InMemoryDeliveryRecordStorage storage;
    private NotificationDeliveryService deliveryService;

    @BeforeEach
    void setUp() {
        storage = new InMemoryDeliveryRecordStorage();
        deliveryService = new NotificationDeliveryService(storage, new ObjectMapper(), new AutomationProperties());
    }

    @Test
    void recordKey_lowercasesAddressUnderNamespace() {
        assertEquals("susu-notification-0xabcd000000000000000000000000000000000001-3",
                deliveryService.recordKey(GROUP, 3));
    }

    @Test
    void markDelivered_storesTierMapAsJson() {
        deliveryService.markDelivered(GROUP, 3, NotificationTier.TIER_24H);
        deliveryService.markDelivered(GROUP, 3, NotificationTier.TIER_6H);

        String stored = storage.get(deliveryService.recordKey(GROUP, 3)).orElseThrow();
        assertEquals("{\"24h\":true,\"6h\":true}", stored);
        assertEquals(Set.of(NotificationTier.TIER_24H, NotificationTier.TIER_6H),
                deliveryService.deliveredTiers(GROUP.toLowerCase(), 3));
    }

    @Test
    void deliveredTiers_scopedToRound() {
        deliveryService.markDelivered(GROUP, 3, NotificationTier.OVERDUE);

        assertTrue(deliveryService.wasDelivered(GROUP, 3, NotificationTier.OVERDUE));
        assertFalse(deliveryService.wasDelivered(GROUP, 4, NotificationTier.OVERDUE));
        assertTrue(deliveryService.deliveredTiers(GROUP, 4).isEmpty());
    }

    @Test
    void deliveredTiers_unknownTierCodeSkipped() {
        storage.update(deliveryService.recordKey(GROUP, 3), current -> "{\"12h\":true,\"6h\":true}");

        assertEquals(Set.of(NotificationTier.TIER_6H), deliveryService.deliveredTiers(GROUP, 3));
        assertTrue(deliveryService.wasDelivered(GROUP, 3, NotificationTier.TIER_6H));
    }

    @Test
    void deliveredTiers_unreadableRecordTreatedAsEmpty() {
        storage.update(deliveryService.recordKey(GROUP, 3), current -> "not json");

        assertTrue(deliveryService.deliveredTiers(GROUP, 3).isEmpty());

        deliveryService.markDelivered(GROUP, 3, NotificationTier.TIER_1H);
        assertEquals(Set.of(NotificationTier.TIER_1H), deliveryService.deliveredTiers(GROUP, 3));
    }
}
