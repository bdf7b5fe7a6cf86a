package com.flagship.stream_ledger.stream.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.stream_ledger.stream.Stream;
import com.flagship.stream_ledger.stream.StreamStatus;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Stream summary returned by every stream endpoint.
 */
@Value
@Builder
public class StreamResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("creator")
    String creator;

    @JsonProperty("title")
    String title;

    @JsonProperty("description")
    String description;

    @JsonProperty("category")
    String category;

    @JsonProperty("content_rating")
    String contentRating;

    @JsonProperty("tags")
    List<String> tags;

    @JsonProperty("thumbnail_ref")
    String thumbnailRef;

    @JsonProperty("quality_levels")
    Set<Integer> qualityLevels;

    @JsonProperty("status")
    StreamStatus status;

    @JsonProperty("is_live")
    boolean live;

    @JsonProperty("is_monetized")
    boolean monetized;

    @JsonProperty("subscription_price")
    long subscriptionPrice;

    @JsonProperty("tip_enabled")
    boolean tipEnabled;

    @JsonProperty("revenue_splits")
    Map<String, Integer> revenueSplits;

    @JsonProperty("created_at")
    long createdAt;

    @JsonProperty("started_at")
    long startedAt;

    @JsonProperty("ended_at")
    long endedAt;

    @JsonProperty("viewer_count")
    long viewerCount;

    @JsonProperty("revenue_balance")
    long revenueBalance;

    @JsonProperty("moderation_score")
    int moderationScore;

    @JsonProperty("manifest_ref")
    String manifestRef;

    public static StreamResponse from(Stream stream) {
        return StreamResponse.builder()
            .id(stream.getId())
            .creator(stream.getCreator())
            .title(stream.getTitle())
            .description(stream.getDescription())
            .category(stream.getCategory())
            .contentRating(stream.getContentRating())
            .tags(stream.getTags())
            .thumbnailRef(stream.getThumbnailRef())
            .qualityLevels(stream.getQualityLevels())
            .status(stream.getStatus())
            .live(stream.isLive())
            .monetized(stream.isMonetized())
            .subscriptionPrice(stream.getSubscriptionPrice())
            .tipEnabled(stream.isTipEnabled())
            .revenueSplits(stream.getRevenueSplits())
            .createdAt(stream.getCreatedAt())
            .startedAt(stream.getStartedAt())
            .endedAt(stream.getEndedAt())
            .viewerCount(stream.getViewerCount())
            .revenueBalance(stream.getBalance().getValue())
            .moderationScore(stream.getModerationScore())
            .manifestRef(stream.getManifestRef())
            .build();
    }
}
