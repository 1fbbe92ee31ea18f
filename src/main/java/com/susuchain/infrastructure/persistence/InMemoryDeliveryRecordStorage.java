package com.susuchain.infrastructure.persistence;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.UnaryOperator;

/**
 * Process-local storage; delivery history is lost on restart.
 */
@Component
@ConditionalOnProperty(name = "app.notifications.store", havingValue = "memory")
public class InMemoryDeliveryRecordStorage implements DeliveryRecordStorage {

    private final ConcurrentMap<String, String> values = new ConcurrentHashMap<>();

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    @Override
    public String update(String key, UnaryOperator<String> updater) {
        return values.compute(key, (k, current) -> updater.apply(current));
    }
}
