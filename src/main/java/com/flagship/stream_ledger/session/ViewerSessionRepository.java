package com.flagship.stream_ledger.session;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface ViewerSessionRepository extends JpaRepository<ViewerSessionEntity, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT v FROM ViewerSessionEntity v WHERE v.id = :id")
    Optional<ViewerSessionEntity> findByIdForUpdate(@Param("id") UUID id);
}
