package com.flagship.stream_ledger.registry;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * The single stream_registry row.
 */
@Entity
@Table(name = "stream_registry")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class RegistryEntity {

    public static final int SINGLETON_ID = 1;

    @Id
    @Column(nullable = false, updatable = false)
    private Integer id;

    @Column(name = "total_streams", nullable = false)
    private long totalStreams;

    @Column(name = "active_streams", nullable = false)
    private long activeStreams;

    @Version
    @Column(nullable = false)
    private long version;

    static RegistryEntity singleton() {
        RegistryEntity entity = new RegistryEntity();
        entity.id = SINGLETON_ID;
        entity.updateFromDomain(Registry.empty());
        return entity;
    }

    public Registry toDomain() {
        return new Registry(totalStreams, activeStreams);
    }

    void updateFromDomain(Registry registry) {
        this.totalStreams = registry.getTotalStreams();
        this.activeStreams = registry.getActiveStreams();
    }
}
