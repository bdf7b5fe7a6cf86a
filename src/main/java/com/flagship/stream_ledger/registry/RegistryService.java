package com.flagship.stream_ledger.registry;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Maintains the singleton registry and the category index.
 *
 * Every mutation locks the registry row and must run inside the entry-point
 * transaction that changes the stream, after the stream itself was locked.
 * The counters therefore move together with the status they count.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RegistryService {

    private final RegistryRepository registryRepository;
    private final CategoryIndexRepository categoryIndexRepository;

    /**
     * Creates the registry row if it does not exist yet.
     *
     * @return true if the row was created by this call
     */
    @Transactional
    public boolean initialize() {
        if (registryRepository.existsById(RegistryEntity.SINGLETON_ID)) {
            return false;
        }
        registryRepository.saveAndFlush(RegistryEntity.singleton());
        log.info("Stream registry created");
        return true;
    }

    /**
     * Counts a new stream and appends it to its category bucket.
     * The bucket comes into existence with its first entry.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Registry recordStreamCreated(UUID streamId, String category) {
        RegistryEntity entity = lockRegistry();
        Registry updated = entity.toDomain().recordCreated();
        entity.updateFromDomain(updated);

        long entryOrder = categoryIndexRepository.countByCategory(category);
        categoryIndexRepository.save(CategoryIndexEntity.append(category, entryOrder, streamId));

        log.debug("Registry: stream {} added to category '{}' at position {}, total={}",
            streamId, category, entryOrder, updated.getTotalStreams());
        return updated;
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public Registry recordStreamStarted() {
        RegistryEntity entity = lockRegistry();
        Registry updated = entity.toDomain().recordStarted();
        entity.updateFromDomain(updated);
        log.debug("Registry: active streams now {}", updated.getActiveStreams());
        return updated;
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public Registry recordStreamEnded() {
        RegistryEntity entity = lockRegistry();
        Registry updated = entity.toDomain().recordEnded();
        entity.updateFromDomain(updated);
        log.debug("Registry: active streams now {}", updated.getActiveStreams());
        return updated;
    }

    @Transactional(readOnly = true)
    public Registry getRegistry() {
        return registryRepository.findById(RegistryEntity.SINGLETON_ID)
            .map(RegistryEntity::toDomain)
            .orElseThrow(RegistryService::missingRegistry);
    }

    @Transactional(readOnly = true)
    public RegistryStats getStats() {
        Registry registry = getRegistry();
        return new RegistryStats(
            registry.getTotalStreams(),
            registry.getActiveStreams(),
            categoryIndexRepository.findAllCategories()
        );
    }

    /**
     * Stream ids of a category in the order they were created. Unknown categories are empty.
     */
    @Transactional(readOnly = true)
    public List<UUID> getStreamIdsInCategory(String category) {
        return categoryIndexRepository.findByCategoryOrderByEntryOrderAsc(category)
            .stream()
            .map(CategoryIndexEntity::getStreamId)
            .toList();
    }

    private RegistryEntity lockRegistry() {
        return registryRepository.findByIdForUpdate(RegistryEntity.SINGLETON_ID)
            .orElseThrow(RegistryService::missingRegistry);
    }

    private static IllegalStateException missingRegistry() {
        return new IllegalStateException("Stream registry has not been initialized");
    }
}
