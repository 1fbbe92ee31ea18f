package com.susuchain.infrastructure.persistence.repository;

import com.susuchain.infrastructure.persistence.entity.ScheduledDutyEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ScheduledDutyRepository extends JpaRepository<ScheduledDutyEntity, String> {
}
