package com.susuchain.domain.model;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class UpcomingDeadlineTest {

    @Test
    void sortByUrgency_dropsElapsedAndContributed() {
        List<UpcomingDeadline> sorted = UpcomingDeadline.sortByUrgency(List.of(
                deadline("weekly", 7200, false),
                deadline("elapsed", 0, false),
                deadline("paid", 60, true),
                deadline("daily", 600, false)));

        assertEquals(List.of("daily", "weekly"),
                sorted.stream().map(UpcomingDeadline::getGroupName).collect(Collectors.toList()));
    }

    @Test
    void notificationTier_fromCode() {
        assertEquals(NotificationTier.TIER_6H, NotificationTier.fromCode("6h"));
        assertThrows(IllegalArgumentException.class, () -> NotificationTier.fromCode("12h"));
    }

    private static UpcomingDeadline deadline(String name, long timeRemaining, boolean contributed) {
        return UpcomingDeadline.builder()
                .groupName(name)
                .timeRemaining(timeRemaining)
                .hasContributed(contributed)
                .build();
    }
}
