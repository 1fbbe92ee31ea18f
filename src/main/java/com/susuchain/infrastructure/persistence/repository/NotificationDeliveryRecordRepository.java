package com.susuchain.infrastructure.persistence.repository;

import com.susuchain.infrastructure.persistence.entity.NotificationDeliveryRecordEntity;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface NotificationDeliveryRecordRepository extends JpaRepository<NotificationDeliveryRecordEntity, String> {

    /**
     * Find record with pessimistic write lock, serialising read-modify-write
     * of the same (group, round).
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    Optional<NotificationDeliveryRecordEntity> findByRecordKey(String recordKey);
}
