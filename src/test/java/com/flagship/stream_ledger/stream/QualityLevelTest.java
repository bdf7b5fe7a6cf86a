package com.flagship.stream_ledger.stream;

import com.flagship.stream_ledger.exception.ErrorCode;
import com.flagship.stream_ledger.exception.InvalidQualityException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class QualityLevelTest {

    @Test
    @DisplayName("The maximum tier should be accepted")
    void testMaxTierAccepted() {
        assertEquals(QualityLevel.MAX_TIER, QualityLevel.requireSupported(QualityLevel.MAX_TIER));
        assertEquals(QualityLevel.QUALITY_4K, QualityLevel.fromTier(QualityLevel.MAX_TIER).orElseThrow());
    }

    @Test
    @DisplayName("A tier above the maximum should be rejected with INVALID_QUALITY")
    void testAboveMaxRejected() {
        InvalidQualityException e = assertThrows(InvalidQualityException.class,
            () -> QualityLevel.requireSupported(QualityLevel.MAX_TIER + 1));

        assertEquals(ErrorCode.INVALID_QUALITY, e.getErrorCode());
    }

    @Test
    @DisplayName("Negative tiers should be rejected")
    void testNegativeRejected() {
        assertThrows(InvalidQualityException.class, () -> QualityLevel.requireSupported(-1));
        assertTrue(QualityLevel.fromTier(-1).isEmpty());
    }

    @Test
    @DisplayName("Validated tier sets should be ordered and free of duplicates")
    void testTierSet() {
        Set<Integer> tiers = QualityLevel.requireSupported(List.of(3, 2, 3));

        assertEquals(List.of(2, 3), List.copyOf(tiers));
        assertThrows(UnsupportedOperationException.class, () -> tiers.add(4));
    }

    @Test
    @DisplayName("One bad tier should reject the whole set")
    void testTierSetWithBadTier() {
        assertThrows(InvalidQualityException.class, () -> QualityLevel.requireSupported(List.of(2, 6)));
    }

    @Test
    @DisplayName("The default session tier should be 720p")
    void testDefaultTier() {
        assertEquals(2, QualityLevel.DEFAULT_TIER);
        assertEquals("720p", QualityLevel.fromTier(QualityLevel.DEFAULT_TIER).orElseThrow().getLabel());
    }
}
