package com.susuchain.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A recurring payout check for one group, held by the automation network.
 *
 * lastExecuted and nextExecution are advisory; the group contract is authoritative.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduledDuty {

    private String dutyId;
    private String groupAddress;
    private String name;
    private String execSelector;
    private String resolverSelector;
    private boolean active;
    private Instant lastExecuted;
    private Instant nextExecution;
}
