package com.flagship.stream_ledger.stream;

import com.flagship.stream_ledger.exception.InvalidQualityException;

import java.util.Collection;
import java.util.Collections;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Supported video quality tiers, identified by their integer code.
 *
 * Codes are what clients send and what is persisted; a code is valid when it
 * lies between 0 and {@link #MAX_TIER}.
 */
public enum QualityLevel {
    QUALITY_360P(0, "360p"),
    QUALITY_480P(1, "480p"),
    QUALITY_720P(2, "720p"),
    QUALITY_1080P(3, "1080p"),
    QUALITY_1440P(4, "1440p"),
    QUALITY_4K(5, "4k");

    public static final int MAX_TIER = 5;

    /**
     * Tier assigned to a new viewer session.
     */
    public static final int DEFAULT_TIER = QUALITY_720P.tier;

    private final int tier;
    private final String label;

    QualityLevel(int tier, String label) {
        this.tier = tier;
        this.label = label;
    }

    public int getTier() {
        return tier;
    }

    public String getLabel() {
        return label;
    }

    public static Optional<QualityLevel> fromTier(int tier) {
        for (QualityLevel level : values()) {
            if (level.tier == tier) {
                return Optional.of(level);
            }
        }
        return Optional.empty();
    }

    /**
     * @throws InvalidQualityException if the tier is outside the supported range
     */
    public static int requireSupported(int tier) {
        return fromTier(tier)
            .orElseThrow(() -> new InvalidQualityException(tier, MAX_TIER))
            .tier;
    }

    /**
     * Validates every requested tier and returns them as an immutable, ordered set.
     *
     * @throws InvalidQualityException on the first unsupported tier
     */
    public static Set<Integer> requireSupported(Collection<Integer> tiers) {
        if (tiers == null || tiers.isEmpty()) {
            return Collections.emptySet();
        }
        Set<Integer> validated = new TreeSet<>();
        for (Integer tier : tiers) {
            if (tier == null) {
                throw new IllegalArgumentException("Quality tier cannot be null");
            }
            validated.add(requireSupported(tier));
        }
        return Collections.unmodifiableSet(validated);
    }
}
