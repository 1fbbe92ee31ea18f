package com.susuchain.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Local record of a duty this service registered with the automation network.
 *
 * The network's active task list stays authoritative; this table keeps the
 * registration history (who, when, with which selectors) and is only mutated
 * to flip the active flag or refresh the advisory execution timestamps.
 */
@Entity
@Table(name = "scheduled_duties", indexes = {
    @Index(name = "idx_duty_group_active", columnList = "groupAddress,active")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduledDutyEntity {

    @Id
    @Column(length = 100)
    private String dutyId;

    @Column(nullable = false, length = 42)
    private String groupAddress;

    @Column(nullable = false, length = 255)
    private String name;

    @Column(nullable = false, length = 10)
    private String execSelector;

    @Column(nullable = false, length = 10)
    private String resolverSelector;

    @Column(nullable = false)
    private boolean active;

    @Column(nullable = false)
    private Instant createdAt;

    @Column
    private Instant cancelledAt;

    @Column
    private Instant lastExecuted;

    @Column
    private Instant nextExecution;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (groupAddress != null) {
            groupAddress = groupAddress.toLowerCase();
        }
    }

    public void deactivate() {
        this.active = false;
        this.cancelledAt = Instant.now();
    }
}
