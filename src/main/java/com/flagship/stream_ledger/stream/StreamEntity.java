package com.flagship.stream_ledger.stream;

import com.flagship.stream_ledger.balance.Balance;
import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.MapKeyColumn;
import jakarta.persistence.OrderColumn;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * JPA entity for Stream persistence.
 *
 * Key design principles:
 * - No setters: state only changes through {@link #updateFromDomain(Stream)}
 * - Identity, creator and configuration columns are updatable = false
 * - The revenue balance is stored as a plain column and rebuilt into a
 *   {@link Balance} on load, so the non-negative check runs on every read
 * - Optimistic @Version on top of the pessimistic row lock taken by mutating calls
 */
@Entity
@Table(
    name = "streams",
    indexes = {
        @Index(name = "idx_streams_creator", columnList = "creator"),
        @Index(name = "idx_streams_status", columnList = "status")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class StreamEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(nullable = false, updatable = false, length = 100)
    private String creator;

    @Column(nullable = false, updatable = false)
    private String title;

    @Column(updatable = false, length = 4000)
    private String description;

    @Column(nullable = false, updatable = false, length = 100)
    private String category;

    @Column(name = "content_rating", updatable = false, length = 20)
    private String contentRating;

    @Column(name = "thumbnail_ref", updatable = false)
    private String thumbnailRef;

    @Column(name = "manifest_ref")
    private String manifestRef;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private StreamStatus status;

    @Column(name = "created_at", nullable = false, updatable = false)
    private long createdAt;

    @Column(name = "started_at", nullable = false)
    private long startedAt;

    @Column(name = "ended_at", nullable = false)
    private long endedAt;

    @Column(name = "viewer_count", nullable = false)
    private long viewerCount;

    @Column(name = "revenue_balance", nullable = false)
    private long revenueBalance;

    @Column(name = "is_monetized", nullable = false, updatable = false)
    private boolean monetized;

    @Column(name = "subscription_price", nullable = false, updatable = false)
    private long subscriptionPrice;

    @Column(name = "tip_enabled", nullable = false, updatable = false)
    private boolean tipEnabled;

    @Column(name = "moderation_score", nullable = false)
    private int moderationScore;

    @Version
    @Column(nullable = false)
    private long version;

    @ElementCollection
    @CollectionTable(name = "stream_tags", joinColumns = @JoinColumn(name = "stream_id"))
    @OrderColumn(name = "tag_order")
    @Column(name = "tag", nullable = false, length = 100)
    private List<String> tags = new ArrayList<>();

    @ElementCollection
    @CollectionTable(name = "stream_quality_levels", joinColumns = @JoinColumn(name = "stream_id"))
    @Column(name = "quality_level", nullable = false)
    private Set<Integer> qualityLevels = new HashSet<>();

    @ElementCollection
    @CollectionTable(name = "stream_revenue_splits", joinColumns = @JoinColumn(name = "stream_id"))
    @MapKeyColumn(name = "recipient", length = 100)
    @Column(name = "basis_points", nullable = false)
    private Map<String, Integer> revenueSplits = new HashMap<>();

    /**
     * The only way to create a StreamEntity.
     */
    static StreamEntity fromDomain(Stream stream) {
        StreamEntity entity = new StreamEntity();
        entity.id = stream.getId();
        entity.creator = stream.getCreator();
        entity.title = stream.getTitle();
        entity.description = stream.getDescription();
        entity.category = stream.getCategory();
        entity.contentRating = stream.getContentRating();
        entity.thumbnailRef = stream.getThumbnailRef();
        entity.monetized = stream.isMonetized();
        entity.subscriptionPrice = stream.getSubscriptionPrice();
        entity.tipEnabled = stream.isTipEnabled();
        entity.createdAt = stream.getCreatedAt();
        entity.tags.addAll(stream.getTags());
        entity.qualityLevels.addAll(stream.getQualityLevels());
        entity.revenueSplits.putAll(stream.getRevenueSplits());
        entity.updateFromDomain(stream);
        return entity;
    }

    /**
     * Must be called inside a transaction; the collections are loaded lazily.
     */
    public Stream toDomain() {
        return Stream.builder()
            .id(id)
            .creator(creator)
            .title(title)
            .description(description)
            .category(category)
            .contentRating(contentRating)
            .tags(List.copyOf(tags))
            .thumbnailRef(thumbnailRef)
            .qualityLevels(QualityLevel.requireSupported(qualityLevels))
            .monetized(monetized)
            .subscriptionPrice(subscriptionPrice)
            .tipEnabled(tipEnabled)
            .revenueSplits(Map.copyOf(revenueSplits))
            .status(status)
            .createdAt(createdAt)
            .startedAt(startedAt)
            .endedAt(endedAt)
            .viewerCount(viewerCount)
            .balance(Balance.of(revenueBalance))
            .moderationScore(moderationScore)
            .manifestRef(manifestRef == null ? "" : manifestRef)
            .build();
    }

    /**
     * Copies the mutable state of the stream. Identity and configuration never change.
     */
    void updateFromDomain(Stream stream) {
        if (this.id != null && !this.id.equals(stream.getId())) {
            throw new IllegalArgumentException(
                "Cannot update stream " + this.id + " from stream " + stream.getId());
        }
        this.status = stream.getStatus();
        this.startedAt = stream.getStartedAt();
        this.endedAt = stream.getEndedAt();
        this.viewerCount = stream.getViewerCount();
        this.revenueBalance = stream.getBalance().getValue();
        this.moderationScore = stream.getModerationScore();
        this.manifestRef = stream.getManifestRef();
    }
}
