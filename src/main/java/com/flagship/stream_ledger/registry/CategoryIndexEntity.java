package com.flagship.stream_ledger.registry;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * One append-only entry in a category bucket. Rows are never updated or deleted.
 */
@Entity
@Table(
    name = "registry_category_index",
    uniqueConstraints = @UniqueConstraint(name = "uq_category_index", columnNames = {"category", "entry_order"})
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class CategoryIndexEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(nullable = false, updatable = false, length = 100)
    private String category;

    @Column(name = "entry_order", nullable = false, updatable = false)
    private long entryOrder;

    @Column(name = "stream_id", nullable = false, updatable = false)
    private UUID streamId;

    static CategoryIndexEntity append(String category, long entryOrder, UUID streamId) {
        return new CategoryIndexEntity(UUID.randomUUID(), category, entryOrder, streamId);
    }
}
