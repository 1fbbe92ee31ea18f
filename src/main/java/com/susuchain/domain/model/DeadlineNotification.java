package com.susuchain.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A contribution reminder for one (group, round, tier).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeadlineNotification {

    private String groupAddress;
    private String groupName;
    private long roundNumber;
    private NotificationTier tier;
    private long timeRemainingSeconds;
    private String message;
    private boolean requireInteraction;
}
