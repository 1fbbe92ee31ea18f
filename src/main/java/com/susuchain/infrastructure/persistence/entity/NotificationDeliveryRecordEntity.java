package com.susuchain.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Tiers already delivered for one (group, round).
 *
 * Keyed "<namespace>-notification-<groupAddress>-<roundNumber>"; the value is a
 * JSON map of tier code to true. A new round has no row, so every tier is
 * eligible again.
 */
@Entity
@Table(name = "notification_delivery_records")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NotificationDeliveryRecordEntity {

    @Id
    @Column(length = 255)
    private String recordKey;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String deliveredTiers;

    @Column(nullable = false)
    private Instant createdAt;

    @Column(nullable = false)
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        updatedAt = Instant.now();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }
}
