package com.susuchain.infrastructure.persistence;

import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Key/value storage behind notification delivery records.
 */
public interface DeliveryRecordStorage {

    Optional<String> get(String key);

    /**
     * Atomically replaces the value under key with updater(current), where current
     * is null if absent.
     *
     * @return the stored value
     */
    String update(String key, UnaryOperator<String> updater);
}
