package com.flagship.stream_ledger.stream;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Creator-supplied settings for a new stream.
 *
 * Descriptive fields are opaque to the ledger; only quality tiers,
 * monetization settings and revenue splits are validated.
 */
@Value
@Builder(toBuilder = true)
public class StreamConfig {
    String title;
    String description;
    String category;
    String thumbnailRef;
    Set<Integer> qualityLevels;
    boolean monetized;
    long subscriptionPrice;
    boolean tipEnabled;
    String contentRating;
    List<String> tags;
    Map<String, Integer> revenueSplits;
}
