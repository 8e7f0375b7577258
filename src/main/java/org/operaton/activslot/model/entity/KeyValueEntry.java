package org.operaton.activslot.model.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;

/**
 * Entity holding one JSON encoded value of the key-value store.
 */
@Entity
@Table(name = "key_value_store")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class KeyValueEntry {

    @Id
    @Column(name = "store_key", nullable = false, length = 200)
    private String key;

    @Column(name = "json_value", nullable = false, columnDefinition = "TEXT")
    private String jsonValue;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;
}
