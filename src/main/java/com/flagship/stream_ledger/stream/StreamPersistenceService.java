package com.flagship.stream_ledger.stream;

import com.flagship.stream_ledger.exception.NotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Bridges the Stream domain object and its JPA entity, plus the segment index.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StreamPersistenceService {

    private final StreamRepository streamRepository;
    private final SegmentRepository segmentRepository;

    @Transactional
    public Stream save(Stream stream) {
        StreamEntity saved = streamRepository.save(StreamEntity.fromDomain(stream));
        log.debug("Saved stream {}", saved.getId());
        return saved.toDomain();
    }

    @Transactional(readOnly = true)
    public Optional<Stream> findById(UUID streamId) {
        return streamRepository.findById(streamId)
            .map(StreamEntity::toDomain);
    }

    /**
     * @throws NotFoundException if no such stream exists
     */
    @Transactional(readOnly = true)
    public Stream getById(UUID streamId) {
        return findById(streamId).orElseThrow(() -> NotFoundException.stream(streamId));
    }

    /**
     * Loads a stream and holds its row lock until the caller's transaction ends.
     *
     * @throws NotFoundException if no such stream exists
     */
    @Transactional
    public Stream lockById(UUID streamId) {
        return streamRepository.findByIdForUpdate(streamId)
            .map(StreamEntity::toDomain)
            .orElseThrow(() -> NotFoundException.stream(streamId));
    }

    /**
     * Writes the mutable state of a stream back through its managed entity.
     */
    @Transactional
    public Stream update(Stream stream) {
        StreamEntity existing = streamRepository.findById(stream.getId())
            .orElseThrow(() -> NotFoundException.stream(stream.getId()));

        existing.updateFromDomain(stream);

        StreamEntity updated = streamRepository.saveAndFlush(existing);
        log.debug("Updated stream {} (status={}, version={})",
            updated.getId(), updated.getStatus(), updated.getVersion());
        return updated.toDomain();
    }

    /**
     * Returns the streams in the order of the given ids. Unknown ids are skipped.
     */
    @Transactional(readOnly = true)
    public List<Stream> findAllInOrder(Collection<UUID> streamIds) {
        Map<UUID, Stream> byId = streamRepository.findAllById(streamIds).stream()
            .map(StreamEntity::toDomain)
            .collect(Collectors.toMap(Stream::getId, Function.identity()));
        return streamIds.stream()
            .map(byId::get)
            .filter(Objects::nonNull)
            .toList();
    }

    @Transactional(readOnly = true)
    public long countByStatus(StreamStatus status) {
        return streamRepository.countByStatus(status);
    }

    /**
     * Inserts a segment, or replaces the blob reference when the number is already indexed.
     */
    @Transactional
    public Segment saveSegment(Segment segment) {
        Optional<SegmentEntity> existing =
            segmentRepository.findByStreamIdAndSegmentNumber(segment.getStreamId(), segment.getSegmentNumber());

        SegmentEntity saved;
        if (existing.isPresent()) {
            SegmentEntity entity = existing.get();
            log.debug("Overwriting segment {} of stream {} (was {})",
                segment.getSegmentNumber(), segment.getStreamId(), entity.getBlobRef());
            entity.overwrite(segment);
            saved = segmentRepository.save(entity);
        } else {
            saved = segmentRepository.save(SegmentEntity.fromDomain(segment));
        }
        return saved.toDomain();
    }

    @Transactional(readOnly = true)
    public Optional<Segment> findSegment(UUID streamId, long segmentNumber) {
        return segmentRepository.findByStreamIdAndSegmentNumber(streamId, segmentNumber)
            .map(SegmentEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public long countSegments(UUID streamId) {
        return segmentRepository.countByStreamId(streamId);
    }
}
