package io.vectorvault.sync;

import io.vectorvault.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for SyncEventQueue.
 */
class SyncEventQueueTest {

    private MutableClock clock;
    private SyncEventQueue queue;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-04-01T00:00:00Z"));
        queue = new SyncEventQueue(3, clock);
    }

    @Test
    void testDrainReturnsEventsInOrder() {
        queue.append(SyncEventKind.CREATED, "a", Map.of("displayName", "A"));
        clock.advance(Duration.ofSeconds(1));
        queue.append(SyncEventKind.DELETED, "b", Map.of());

        List<SyncEvent> events = queue.drain();

        assertEquals(2, events.size());
        assertEquals(1, events.get(0).sequence());
        assertEquals(2, events.get(1).sequence());
        assertEquals("A", events.get(0).details().get("displayName"));
        assertTrue(events.get(1).timestamp().isAfter(events.get(0).timestamp()));
        assertTrue(queue.drain().isEmpty());
    }

    @Test
    void testStatusTransitions() {
        assertEquals(SyncState.SYNCED, queue.status().state());

        queue.append(SyncEventKind.CREATED, "a", Map.of());
        SyncStatus pending = queue.status();
        assertEquals(SyncState.PENDING, pending.state());
        assertEquals(1, pending.pending());
        assertEquals(1, pending.lastSequence());
        assertEquals(clock.instant(), pending.lastEventAt());

        queue.drain();
        assertEquals(SyncState.SYNCED, queue.status().state());
    }

    @Test
    void testOverflowDropsOldest() {
        for (int i = 0; i < 5; i++) {
            queue.append(SyncEventKind.CREATED, "c" + i, Map.of());
        }

        SyncStatus status = queue.status();
        assertEquals(SyncState.OVERFLOWED, status.state());
        assertEquals(2, status.dropped());
        assertEquals(3, status.pending());

        List<String> ids = queue.drain().stream().map(SyncEvent::collectionId).collect(Collectors.toList());
        assertEquals(List.of("c2", "c3", "c4"), ids);
        assertEquals(SyncState.SYNCED, queue.status().state());
        assertEquals(2, queue.status().dropped());
    }

    @Test
    void testPartialDrainAndPeek() {
        queue.append(SyncEventKind.CREATED, "a", Map.of());
        queue.append(SyncEventKind.CREATED, "b", Map.of());

        assertEquals(2, queue.peek().size());
        assertEquals("a", queue.drain(1).get(0).collectionId());
        assertEquals(List.of("b"), queue.peek().stream().map(SyncEvent::collectionId).collect(Collectors.toList()));
    }

    @Test
    void testSubscribersSeeEveryAppend() {
        List<SyncEvent> seen = new ArrayList<>();
        SyncEventQueue.Subscription subscription = queue.subscribe(seen::add);

        queue.append(SyncEventKind.RENAMED, "new", Map.of("previousId", "old"));
        subscription.close();
        queue.append(SyncEventKind.DELETED, "new", Map.of());

        assertEquals(1, seen.size());
        assertEquals("old", seen.get(0).details().get("previousId"));
    }

    @Test
    void testFailingSubscriberDoesNotReachProducer() {
        queue.subscribe(event -> {
            throw new IllegalStateException("transport down");
        });

        SyncEvent event = queue.append(SyncEventKind.CREATED, "a", Map.of());

        assertEquals(1, event.sequence());
        assertEquals(1, queue.status().pending());
    }

    @Test
    void testCapacityMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new SyncEventQueue(0, clock));
    }
}
