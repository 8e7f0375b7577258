package org.operaton.activslot.store;

import com.fasterxml.jackson.core.type.TypeReference;

import java.util.List;
import java.util.Optional;

/**
 * Narrow persistence contract for planner state.
 * Values are stored as JSON; unreadable values are reported as absent.
 */
public interface KeyValueStore {

    <T> Optional<T> get(String key, Class<T> type);

    <T> Optional<T> get(String key, TypeReference<T> type);

    void put(String key, Object value);

    void delete(String key);

    /**
     * Keys starting with the given prefix, in ascending order.
     */
    List<String> keysWithPrefix(String prefix);
}
