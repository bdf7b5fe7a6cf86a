package com.flagship.stream_ledger.stream;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface StreamRepository extends JpaRepository<StreamEntity, UUID> {

    /**
     * Loads a stream with a write lock held until the surrounding transaction ends.
     * Every mutating entry point goes through here.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM StreamEntity s WHERE s.id = :id")
    Optional<StreamEntity> findByIdForUpdate(@Param("id") UUID id);

    long countByStatus(StreamStatus status);
}
