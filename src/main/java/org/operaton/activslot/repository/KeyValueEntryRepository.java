package org.operaton.activslot.repository;

import org.operaton.activslot.model.entity.KeyValueEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for key-value store entries.
 */
@Repository
public interface KeyValueEntryRepository extends JpaRepository<KeyValueEntry, String> {

    /**
     * Find all entries whose key starts with the given prefix.
     *
     * @param prefix the key prefix
     * @return matching entries ordered by key
     */
    List<KeyValueEntry> findByKeyStartingWithOrderByKeyAsc(String prefix);
}
