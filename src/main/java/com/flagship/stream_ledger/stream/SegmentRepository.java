package com.flagship.stream_ledger.stream;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface SegmentRepository extends JpaRepository<SegmentEntity, UUID> {

    Optional<SegmentEntity> findByStreamIdAndSegmentNumber(UUID streamId, long segmentNumber);

    long countByStreamId(UUID streamId);
}
