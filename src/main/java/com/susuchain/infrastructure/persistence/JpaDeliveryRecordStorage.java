package com.susuchain.infrastructure.persistence;

import com.susuchain.infrastructure.persistence.entity.NotificationDeliveryRecordEntity;
import com.susuchain.infrastructure.persistence.repository.NotificationDeliveryRecordRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;
import java.util.function.UnaryOperator;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.notifications.store", havingValue = "jpa", matchIfMissing = true)
public class JpaDeliveryRecordStorage implements DeliveryRecordStorage {

    private final NotificationDeliveryRecordRepository repository;

    @Override
    @Transactional(readOnly = true)
    public Optional<String> get(String key) {
        return repository.findById(key).map(NotificationDeliveryRecordEntity::getDeliveredTiers);
    }

    @Override
    @Transactional
    public String update(String key, UnaryOperator<String> updater) {
        NotificationDeliveryRecordEntity record = repository.findByRecordKey(key)
                .orElseGet(() -> NotificationDeliveryRecordEntity.builder().recordKey(key).build());

        record.setDeliveredTiers(updater.apply(record.getDeliveredTiers()));
        return repository.save(record).getDeliveredTiers();
    }
}
