package com.flagship.stream_ledger.stream;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.stream_ledger.exception.InvalidQualityException;
import com.flagship.stream_ledger.exception.InvalidStateException;
import com.flagship.stream_ledger.exception.NotAuthorizedException;
import com.flagship.stream_ledger.exception.NotFoundException;
import com.flagship.stream_ledger.outbox.OutboxEvent;
import com.flagship.stream_ledger.outbox.OutboxService;
import com.flagship.stream_ledger.registry.Registry;
import com.flagship.stream_ledger.registry.RegistryService;
import com.flagship.stream_ledger.stream.event.SegmentStoredEvent;
import com.flagship.stream_ledger.stream.event.StreamCreatedEvent;
import com.flagship.stream_ledger.stream.event.StreamEndedEvent;
import com.flagship.stream_ledger.stream.event.StreamStartedEvent;
import com.flagship.stream_ledger.support.MutableClock;
import com.flagship.stream_ledger.support.TestClockConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the creator-side stream lifecycle against a real database.
 *
 * These tests verify that:
 * - Every successful transition is persisted, counted in the registry and announced in the outbox
 * - A rejected transition changes nothing and emits nothing
 * - Segment storage overwrites an earlier reference for the same number
 */
@SpringBootTest
@Import(TestClockConfig.class)
class StreamLifecycleServiceTest {

    private static final String CREATOR = "0xcreator-lifecycle";

    @Autowired
    private StreamLifecycleService lifecycleService;

    @Autowired
    private StreamPersistenceService persistenceService;

    @Autowired
    private RegistryService registryService;

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private MutableClock clock;

    // Helper methods for test output
    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printInput(String label, Object value) {
        System.out.println("INPUT  - " + label + ": " + value);
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private void printExpectedException(String exceptionType, String reason) {
        System.out.println("⚠ EXPECTED EXCEPTION: " + exceptionType);
        System.out.println("  Reason: " + reason);
    }

    private StreamConfig.StreamConfigBuilder config() {
        return StreamConfig.builder()
            .title("Lifecycle test stream")
            .category("Music")
            .qualityLevels(Set.of(1, 2, 3))
            .monetized(true)
            .subscriptionPrice(10L)
            .tipEnabled(true);
    }

    private List<String> eventTypes(UUID streamId) {
        return outboxService.getEventsForStream(streamId).stream()
            .map(OutboxEvent::getEventType)
            .toList();
    }

    private void assertActiveMatchesLiveStreams() {
        assertEquals(persistenceService.countByStatus(StreamStatus.LIVE),
            registryService.getRegistry().getActiveStreams(),
            "Active stream count should equal the number of LIVE streams");
    }

    @Test
    @DisplayName("Creating a stream should persist it, count it and announce it")
    void testCreateStream() {
        printTestHeader("Create Stream");

        long totalBefore = registryService.getRegistry().getTotalStreams();
        StreamConfig config = config().build();
        printInput("Creator", CREATOR);
        printInput("Config", config);

        Stream stream = lifecycleService.createStream(CREATOR, config);
        printOutput("Stream ID", stream.getId());
        printOutput("Status", stream.getStatus());

        Stream reloaded = lifecycleService.getStream(stream.getId());
        assertEquals(StreamStatus.CREATED, reloaded.getStatus());
        assertEquals(CREATOR, reloaded.getCreator());
        assertEquals(Set.of(1, 2, 3), reloaded.getQualityLevels());
        assertEquals(10L, reloaded.getSubscriptionPrice());
        assertEquals(clock.millis(), reloaded.getCreatedAt());
        assertTrue(reloaded.getBalance().isZero());

        assertEquals(totalBefore + 1, registryService.getRegistry().getTotalStreams());
        List<UUID> music = registryService.getStreamIdsInCategory("Music");
        assertEquals(stream.getId(), music.get(music.size() - 1), "New stream should be appended to its category");

        assertEquals(List.of(StreamCreatedEvent.EVENT_TYPE), eventTypes(stream.getId()));
        printSuccess("Stream created, counted and announced");
    }

    @Test
    @DisplayName("A blank category should fall back to the default category")
    void testDefaultCategory() {
        Stream stream = lifecycleService.createStream(CREATOR, config().category("  ").build());

        assertEquals("General", stream.getCategory());
        assertTrue(registryService.getStreamIdsInCategory("General").contains(stream.getId()));
    }

    @Test
    @DisplayName("Tags and revenue splits should survive a reload")
    void testCollectionsPersisted() {
        Stream stream = lifecycleService.createStream(CREATOR, config()
            .tags(List.of("retro", "chill", "lofi"))
            .revenueSplits(java.util.Map.of("0xeditor", 1_500))
            .build());

        Stream reloaded = lifecycleService.getStream(stream.getId());

        assertEquals(List.of("retro", "chill", "lofi"), reloaded.getTags());
        assertEquals(1_500, reloaded.getRevenueSplits().get("0xeditor"));
    }

    @Test
    @DisplayName("Unsupported quality tier should abort creation without side effects")
    void testCreateWithInvalidQuality() {
        printTestHeader("Create Stream - Unsupported Quality Tier");

        Registry before = registryService.getRegistry();
        StreamConfig config = config().qualityLevels(Set.of(2, 6)).build();
        printInput("Quality Levels", config.getQualityLevels());
        printExpectedException("InvalidQualityException", "Tier 6 is above the supported maximum");

        assertThrows(InvalidQualityException.class, () -> lifecycleService.createStream(CREATOR, config));

        assertEquals(before, registryService.getRegistry(), "Registry should be untouched");
        printSuccess("Creation rejected and nothing was counted");
    }

    @Test
    @DisplayName("Full lifecycle should move registry counters and emit one event per transition")
    void testFullLifecycle() {
        printTestHeader("Full Lifecycle");

        Stream stream = lifecycleService.createStream(CREATOR, config().build());
        long activeBefore = registryService.getRegistry().getActiveStreams();

        clock.advance(Duration.ofSeconds(1));
        Stream live = lifecycleService.startStream(stream.getId(), CREATOR, "ipfs://manifest");
        printOutput("Started At", live.getStartedAt());
        assertEquals(StreamStatus.LIVE, live.getStatus());
        assertEquals(clock.millis(), live.getStartedAt());
        assertEquals("ipfs://manifest", live.getManifestRef());
        assertEquals(activeBefore + 1, registryService.getRegistry().getActiveStreams());
        assertActiveMatchesLiveStreams();

        clock.advance(Duration.ofMinutes(30));
        Stream ended = lifecycleService.endStream(stream.getId(), CREATOR);
        printOutput("Duration", ended.getDurationMillis());
        assertEquals(StreamStatus.ENDED, ended.getStatus());
        assertEquals(Duration.ofMinutes(30).toMillis(), ended.getDurationMillis());
        assertEquals(activeBefore, registryService.getRegistry().getActiveStreams());
        assertActiveMatchesLiveStreams();

        clock.advance(Duration.ofSeconds(1));
        Stream archived = lifecycleService.archiveStream(stream.getId(), CREATOR);
        assertEquals(StreamStatus.ARCHIVED, archived.getStatus());
        assertTrue(registryService.getStreamIdsInCategory("Music").contains(stream.getId()),
            "Archived streams stay in their category");

        assertEquals(List.of(
            StreamCreatedEvent.EVENT_TYPE,
            StreamStartedEvent.EVENT_TYPE,
            StreamEndedEvent.EVENT_TYPE
        ), eventTypes(stream.getId()));
        printSuccess("Lifecycle completed with matching events");
    }

    @Test
    @DisplayName("StreamEnded event should report duration, viewers and revenue")
    void testEndedEventPayload() throws Exception {
        Stream stream = lifecycleService.createStream(CREATOR, config().build());
        lifecycleService.startStream(stream.getId(), CREATOR, "m");
        clock.advance(Duration.ofSeconds(90));
        lifecycleService.endStream(stream.getId(), CREATOR);

        OutboxEvent ended = outboxService.getEventsForStream(stream.getId()).stream()
            .filter(e -> StreamEndedEvent.EVENT_TYPE.equals(e.getEventType()))
            .findFirst()
            .orElseThrow();
        JsonNode payload = objectMapper.readTree(ended.getPayload());
        printOutput("Payload", payload);

        assertEquals(stream.getId().toString(), payload.get("streamId").asText());
        assertEquals(90_000L, payload.get("durationMillis").asLong());
        assertEquals(0L, payload.get("viewerCount").asLong());
        assertEquals(0L, payload.get("totalRevenue").asLong());
    }

    @Test
    @DisplayName("Non-creator start should be rejected and change nothing")
    void testStartByNonCreator() {
        printTestHeader("Start Stream - Not Authorized");

        Stream stream = lifecycleService.createStream(CREATOR, config().build());
        long activeBefore = registryService.getRegistry().getActiveStreams();
        printInput("Caller", "0xintruder");
        printExpectedException("NotAuthorizedException", "Only the creator may start a stream");

        assertThrows(NotAuthorizedException.class,
            () -> lifecycleService.startStream(stream.getId(), "0xintruder", "m"));

        assertEquals(StreamStatus.CREATED, lifecycleService.getStream(stream.getId()).getStatus());
        assertEquals(activeBefore, registryService.getRegistry().getActiveStreams());
        assertEquals(List.of(StreamCreatedEvent.EVENT_TYPE), eventTypes(stream.getId()));
        printSuccess("Rejected start left no trace");
    }

    @Test
    @DisplayName("Starting a live stream again should fail with INVALID_STATE")
    void testStartTwice() {
        Stream stream = lifecycleService.createStream(CREATOR, config().build());
        lifecycleService.startStream(stream.getId(), CREATOR, "m");
        long activeBefore = registryService.getRegistry().getActiveStreams();

        assertThrows(InvalidStateException.class,
            () -> lifecycleService.startStream(stream.getId(), CREATOR, "m2"));

        assertEquals(activeBefore, registryService.getRegistry().getActiveStreams());
        assertEquals("m", lifecycleService.getStream(stream.getId()).getManifestRef());
        assertActiveMatchesLiveStreams();
    }

    @Test
    @DisplayName("Ending a stream that never started should fail")
    void testEndWithoutStart() {
        Stream stream = lifecycleService.createStream(CREATOR, config().build());

        assertThrows(InvalidStateException.class, () -> lifecycleService.endStream(stream.getId(), CREATOR));
        assertEquals(StreamStatus.CREATED, lifecycleService.getStream(stream.getId()).getStatus());
    }

    @Test
    @DisplayName("Archiving a live stream should fail")
    void testArchiveLive() {
        Stream stream = lifecycleService.createStream(CREATOR, config().build());
        lifecycleService.startStream(stream.getId(), CREATOR, "m");

        assertThrows(InvalidStateException.class, () -> lifecycleService.archiveStream(stream.getId(), CREATOR));
        assertActiveMatchesLiveStreams();
    }

    @Test
    @DisplayName("Storing the same segment number twice should keep the later reference")
    void testSegmentOverwrite() {
        printTestHeader("Store Segment - Overwrite");

        Stream stream = lifecycleService.createStream(CREATOR, config().build());
        lifecycleService.startStream(stream.getId(), CREATOR, "m");

        lifecycleService.storeSegment(stream.getId(), CREATOR, 7L, "blob://first");
        clock.advance(Duration.ofSeconds(2));
        Segment second = lifecycleService.storeSegment(stream.getId(), CREATOR, 7L, "blob://second");
        printOutput("Segment", second);

        Segment stored = lifecycleService.getSegment(stream.getId(), 7L);
        assertEquals("blob://second", stored.getBlobRef());
        assertEquals(clock.millis(), stored.getStoredAt());
        assertEquals(1L, persistenceService.countSegments(stream.getId()));
        assertEquals(2L, eventTypes(stream.getId()).stream()
            .filter(SegmentStoredEvent.EVENT_TYPE::equals)
            .count());
        printSuccess("Later segment reference replaced the earlier one");
    }

    @Test
    @DisplayName("Only the creator may store segments")
    void testSegmentByNonCreator() {
        Stream stream = lifecycleService.createStream(CREATOR, config().build());

        assertThrows(NotAuthorizedException.class,
            () -> lifecycleService.storeSegment(stream.getId(), "0xintruder", 1L, "blob://x"));
        assertEquals(0L, persistenceService.countSegments(stream.getId()));
    }

    @Test
    @DisplayName("Unknown segment and unknown stream should be NOT_FOUND")
    void testNotFound() {
        Stream stream = lifecycleService.createStream(CREATOR, config().build());

        assertThrows(NotFoundException.class, () -> lifecycleService.getSegment(stream.getId(), 99L));
        assertThrows(NotFoundException.class, () -> lifecycleService.getStream(UUID.randomUUID()));
        assertThrows(NotFoundException.class,
            () -> lifecycleService.startStream(UUID.randomUUID(), CREATOR, "m"));
    }

    @Test
    @DisplayName("Moderation score updates should be persisted and validated")
    void testModerationScore() {
        Stream stream = lifecycleService.createStream(CREATOR, config().build());

        lifecycleService.updateModerationScore(stream.getId(), 35);
        assertEquals(35, lifecycleService.getStream(stream.getId()).getModerationScore());

        assertThrows(IllegalArgumentException.class,
            () -> lifecycleService.updateModerationScore(stream.getId(), 150));
        assertEquals(35, lifecycleService.getStream(stream.getId()).getModerationScore());
    }
}
