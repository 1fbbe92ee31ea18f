package com.susuchain.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;

/**
 * One polling tick's view of a group's round deadline.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeadlineSnapshot {

    private String groupAddress;
    private String groupName;
    private long roundNumber;
    private Instant deadline;
    private Instant observedAt;

    /**
     * Seconds until the deadline; zero or negative once it has passed.
     */
    public long timeRemainingSeconds() {
        return Duration.between(observedAt, deadline).getSeconds();
    }
}
