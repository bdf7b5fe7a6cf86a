package com.flagship.stream_ledger.stream.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.stream_ledger.stream.StreamConfig;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.Set;

@Value
public class CreateStreamRequest {

    @NotBlank(message = "Title is required")
    @Size(max = 255, message = "Title must be at most 255 characters")
    @JsonProperty("title")
    String title;

    @Size(max = 4000, message = "Description must be at most 4000 characters")
    @JsonProperty("description")
    String description;

    @Size(max = 100, message = "Category must be at most 100 characters")
    @JsonProperty("category")
    String category;

    @Size(max = 20, message = "Content rating must be at most 20 characters")
    @JsonProperty("content_rating")
    String contentRating;

    @JsonProperty("tags")
    List<@NotBlank(message = "Tags must not be blank")
         @Size(max = 100, message = "Tag must be at most 100 characters") String> tags;

    @Size(max = 255, message = "Thumbnail reference must be at most 255 characters")
    @JsonProperty("thumbnail_ref")
    String thumbnailRef;

    @JsonProperty("quality_levels")
    Set<Integer> qualityLevels;

    @JsonProperty("is_monetized")
    boolean monetized;

    @PositiveOrZero(message = "Subscription price cannot be negative")
    @JsonProperty("subscription_price")
    long subscriptionPrice;

    @JsonProperty("tip_enabled")
    boolean tipEnabled;

    @JsonProperty("revenue_splits")
    Map<String, Integer> revenueSplits;

    public StreamConfig toConfig() {
        return StreamConfig.builder()
            .title(title)
            .description(description)
            .category(category)
            .contentRating(contentRating)
            .tags(tags)
            .thumbnailRef(thumbnailRef)
            .qualityLevels(qualityLevels)
            .monetized(monetized)
            .subscriptionPrice(subscriptionPrice)
            .tipEnabled(tipEnabled)
            .revenueSplits(revenueSplits)
            .build();
    }
}
