package com.flagship.stream_ledger.registry;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RegistryTest {

    @Test
    @DisplayName("Counters follow create, start and end")
    void testCounters() {
        Registry registry = Registry.empty()
            .recordCreated()
            .recordCreated()
            .recordStarted()
            .recordStarted()
            .recordEnded();

        assertEquals(2L, registry.getTotalStreams());
        assertEquals(1L, registry.getActiveStreams());
    }

    @Test
    @DisplayName("Active count can never exceed the total")
    void testActiveBoundedByTotal() {
        Registry registry = Registry.empty().recordCreated().recordStarted();

        assertThrows(IllegalStateException.class, registry::recordStarted);
    }

    @Test
    @DisplayName("Active count can never go below zero")
    void testActiveNonNegative() {
        assertThrows(IllegalStateException.class, () -> Registry.empty().recordEnded());
    }
}
