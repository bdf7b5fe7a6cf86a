package com.flagship.stream_ledger.stream;

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
 * JPA entity for one row of the segment index.
 */
@Entity
@Table(
    name = "stream_segments",
    uniqueConstraints = @UniqueConstraint(name = "uq_stream_segments", columnNames = {"stream_id", "segment_number"})
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class SegmentEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "stream_id", nullable = false, updatable = false)
    private UUID streamId;

    @Column(name = "segment_number", nullable = false, updatable = false)
    private long segmentNumber;

    @Column(name = "blob_ref", nullable = false)
    private String blobRef;

    @Column(name = "stored_at", nullable = false)
    private long storedAt;

    static SegmentEntity fromDomain(Segment segment) {
        return new SegmentEntity(
            UUID.randomUUID(),
            segment.getStreamId(),
            segment.getSegmentNumber(),
            segment.getBlobRef(),
            segment.getStoredAt()
        );
    }

    public Segment toDomain() {
        return new Segment(streamId, segmentNumber, blobRef, storedAt);
    }

    /**
     * Replaces the blob reference of an existing segment number.
     */
    void overwrite(Segment segment) {
        this.blobRef = segment.getBlobRef();
        this.storedAt = segment.getStoredAt();
    }
}
