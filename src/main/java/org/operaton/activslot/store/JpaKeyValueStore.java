package org.operaton.activslot.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.operaton.activslot.model.entity.KeyValueEntry;
import org.operaton.activslot.repository.KeyValueEntryRepository;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * {@link KeyValueStore} backed by the {@code key_value_store} table.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JpaKeyValueStore implements KeyValueStore {

    private final KeyValueEntryRepository repository;
    private final ObjectMapper objectMapper;

    @Override
    @Transactional(readOnly = true)
    public <T> Optional<T> get(String key, Class<T> type) {
        return repository.findById(key).flatMap(entry -> {
            try {
                return Optional.ofNullable(objectMapper.readValue(entry.getJsonValue(), type));
            } catch (JsonProcessingException e) {
                log.warn("Stored value for key '{}' is not a readable {}: {}", key, type.getSimpleName(), e.getOriginalMessage());
                return Optional.empty();
            }
        });
    }

    @Override
    @Transactional(readOnly = true)
    public <T> Optional<T> get(String key, TypeReference<T> type) {
        return repository.findById(key).flatMap(entry -> {
            try {
                return Optional.ofNullable(objectMapper.readValue(entry.getJsonValue(), type));
            } catch (JsonProcessingException e) {
                log.warn("Stored value for key '{}' is not readable: {}", key, e.getOriginalMessage());
                return Optional.empty();
            }
        });
    }

    @Override
    @Transactional
    public void put(String key, Object value) {
        String json;
        try {
            json = objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Value for key '" + key + "' cannot be serialized", e);
        }

        KeyValueEntry entry = repository.findById(key)
            .orElseGet(() -> KeyValueEntry.builder().key(key).build());
        entry.setJsonValue(json);
        repository.save(entry);
        log.debug("Stored key '{}' ({} chars)", key, json.length());
    }

    @Override
    @Transactional
    public void delete(String key) {
        if (repository.existsById(key)) {
            repository.deleteById(key);
            log.debug("Deleted key '{}'", key);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<String> keysWithPrefix(String prefix) {
        return repository.findByKeyStartingWithOrderByKeyAsc(prefix).stream()
            .map(KeyValueEntry::getKey)
            .toList();
    }
}
