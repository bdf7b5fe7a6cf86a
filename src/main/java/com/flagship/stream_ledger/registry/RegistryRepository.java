package com.flagship.stream_ledger.registry;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface RegistryRepository extends JpaRepository<RegistryEntity, Integer> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM RegistryEntity r WHERE r.id = :id")
    Optional<RegistryEntity> findByIdForUpdate(@Param("id") Integer id);
}
