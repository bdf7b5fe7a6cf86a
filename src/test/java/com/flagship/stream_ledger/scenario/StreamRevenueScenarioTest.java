package com.flagship.stream_ledger.scenario;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.stream_ledger.exception.InvalidStateException;
import com.flagship.stream_ledger.ledger.LedgerService;
import com.flagship.stream_ledger.ledger.RevenueLedger;
import com.flagship.stream_ledger.outbox.OutboxEvent;
import com.flagship.stream_ledger.outbox.OutboxService;
import com.flagship.stream_ledger.registry.RegistryService;
import com.flagship.stream_ledger.session.ViewerSession;
import com.flagship.stream_ledger.session.ViewerSessionService;
import com.flagship.stream_ledger.stream.RevenueDistributionService;
import com.flagship.stream_ledger.stream.Stream;
import com.flagship.stream_ledger.stream.StreamConfig;
import com.flagship.stream_ledger.stream.StreamLifecycleService;
import com.flagship.stream_ledger.stream.StreamStatus;
import com.flagship.stream_ledger.stream.event.StreamCreatedEvent;
import com.flagship.stream_ledger.stream.event.StreamEndedEvent;
import com.flagship.stream_ledger.stream.event.StreamStartedEvent;
import com.flagship.stream_ledger.stream.event.TipSentEvent;
import com.flagship.stream_ledger.stream.event.ViewerJoinedEvent;
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
 * End-to-end walk through one monetized broadcast, from creation to payout.
 */
@SpringBootTest
@Import(TestClockConfig.class)
class StreamRevenueScenarioTest {

    @Autowired
    private StreamLifecycleService lifecycleService;

    @Autowired
    private ViewerSessionService sessionService;

    @Autowired
    private RevenueDistributionService distributionService;

    @Autowired
    private RegistryService registryService;

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private RevenueLedger revenueLedger;

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private MutableClock clock;

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    @Test
    @DisplayName("Create, start, join, tip, end and distribute a monetized stream")
    void testMonetizedBroadcast() throws Exception {
        printTestHeader("Scenario - Monetized Broadcast");

        String creator = "0xcreator-" + UUID.randomUUID().toString().substring(0, 8);
        String viewer = "0xviewer-" + UUID.randomUUID().toString().substring(0, 8);
        long activeBefore = registryService.getRegistry().getActiveStreams();

        Stream stream = lifecycleService.createStream(creator, StreamConfig.builder()
            .title("Friday night speedruns")
            .category("Gaming")
            .qualityLevels(Set.of(2, 3))
            .monetized(true)
            .subscriptionPrice(10L)
            .tipEnabled(true)
            .build());
        UUID streamId = stream.getId();
        printOutput("Stream", streamId);

        clock.advance(Duration.ofSeconds(5));
        lifecycleService.startStream(streamId, creator, "ipfs://manifest");
        assertEquals(activeBefore + 1, registryService.getRegistry().getActiveStreams());

        clock.advance(Duration.ofSeconds(5));
        ViewerSession session = sessionService.join(streamId, viewer, 15L).getSession();
        assertTrue(session.isHasPaid());

        clock.advance(Duration.ofSeconds(30));
        sessionService.heartbeat(session.getId(), viewer, 3);

        clock.advance(Duration.ofSeconds(5));
        sessionService.tip(streamId, session.getId(), viewer, 5L, "gg");
        assertEquals(20L, lifecycleService.getStream(streamId).getBalance().getValue());
        assertEquals(20L, revenueLedger.getRevenuePoolBalance(streamId));

        clock.advance(Duration.ofMinutes(10));
        Stream ended = lifecycleService.endStream(streamId, creator);
        assertEquals(StreamStatus.ENDED, ended.getStatus());
        assertEquals(activeBefore, registryService.getRegistry().getActiveStreams());

        assertThrows(InvalidStateException.class, () -> sessionService.join(streamId, viewer, 15L),
            "Ended streams cannot be joined");

        RevenueDistributionService.Distribution distribution = distributionService.distribute(streamId, creator);
        printOutput("Distributed", distribution.getAmount());
        assertEquals(20L, distribution.getAmount());
        assertEquals(20L, ledgerService.getBalance(creator));
        assertTrue(lifecycleService.getStream(streamId).getBalance().isZero());
        assertEquals(0L, revenueLedger.getRevenuePoolBalance(streamId));

        List<OutboxEvent> events = outboxService.getEventsForStream(streamId);
        assertEquals(List.of(
            StreamCreatedEvent.EVENT_TYPE,
            StreamStartedEvent.EVENT_TYPE,
            ViewerJoinedEvent.EVENT_TYPE,
            TipSentEvent.EVENT_TYPE,
            StreamEndedEvent.EVENT_TYPE
        ), events.stream().map(OutboxEvent::getEventType).toList());

        JsonNode endedPayload = objectMapper.readTree(events.get(events.size() - 1).getPayload());
        assertEquals(20L, endedPayload.get("totalRevenue").asLong());
        assertEquals(1L, endedPayload.get("viewerCount").asLong());
        assertEquals(Duration.ofSeconds(40).plusMinutes(10).toMillis(), endedPayload.get("durationMillis").asLong());

        JsonNode joinedPayload = objectMapper.readTree(events.get(2).getPayload());
        assertEquals(viewer, joinedPayload.get("viewer").asText());
        assertEquals(15L, joinedPayload.get("paymentAmount").asLong());

        printSuccess("Revenue followed the broadcast from join to payout");
    }
}
