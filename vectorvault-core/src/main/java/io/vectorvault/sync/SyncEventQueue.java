package io.vectorvault.sync;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Bounded, append-only queue of committed changes.
 *
 * <p>Consumers either {@link #drain()} the queue (polling transports) or
 * {@link #subscribe(Consumer)} to be called on each append (push transports). When the queue
 * is full the oldest event is dropped and counted; the status turns {@link SyncState#OVERFLOWED}
 * until the next drain.</p>
 */
public class SyncEventQueue {

    private static final Logger log = LoggerFactory.getLogger(SyncEventQueue.class);

    private final int capacity;
    private final Clock clock;
    private final Deque<SyncEvent> events = new ArrayDeque<>();
    private final List<Consumer<SyncEvent>> listeners = new CopyOnWriteArrayList<>();

    private long sequence;
    private long dropped;
    private long droppedSinceDrain;
    private Instant lastEventAt;

    public SyncEventQueue(int capacity, Clock clock) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0, got " + capacity);
        }
        this.capacity = capacity;
        this.clock = clock;
    }

    /**
     * Appends an event and notifies subscribers. Subscriber failures are logged and never
     * reach the caller.
     */
    public SyncEvent append(SyncEventKind kind, String collectionId, Map<String, String> details) {
        SyncEvent event;
        synchronized (this) {
            Instant now = clock.instant();
            sequence++;
            event = new SyncEvent(sequence, "evt-" + sequence + "-" + now.toEpochMilli(), kind, collectionId, now, details);
            if (events.size() == capacity) {
                SyncEvent oldest = events.removeFirst();
                dropped++;
                droppedSinceDrain++;
                log.warn("Sync queue full ({}); dropped event {} ({} {})",
                    capacity, oldest.sequence(), oldest.kind(), oldest.collectionId());
            }
            events.addLast(event);
            lastEventAt = now;
        }
        log.debug("Sync event {}: {} {}", event.sequence(), kind, collectionId);

        for (Consumer<SyncEvent> listener : listeners) {
            try {
                listener.accept(event);
            } catch (RuntimeException e) {
                log.error("Sync listener threw on event {}: {}", event.sequence(), e.getMessage(), e);
            }
        }
        return event;
    }

    /**
     * Removes and returns all pending events, oldest first.
     */
    public synchronized List<SyncEvent> drain() {
        return drain(Integer.MAX_VALUE);
    }

    /**
     * Removes and returns up to {@code max} pending events, oldest first.
     */
    public synchronized List<SyncEvent> drain(int max) {
        List<SyncEvent> out = new ArrayList<>(Math.min(max, events.size()));
        while (!events.isEmpty() && out.size() < max) {
            out.add(events.removeFirst());
        }
        droppedSinceDrain = 0;
        return out;
    }

    /**
     * Pending events without removing them.
     */
    public synchronized List<SyncEvent> peek() {
        return List.copyOf(events);
    }

    /**
     * Registers a listener called synchronously on each append.
     *
     * @return a handle that unregisters the listener when closed
     */
    public Subscription subscribe(Consumer<SyncEvent> listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    public synchronized SyncStatus status() {
        SyncState state;
        if (droppedSinceDrain > 0) {
            state = SyncState.OVERFLOWED;
        } else if (!events.isEmpty()) {
            state = SyncState.PENDING;
        } else {
            state = SyncState.SYNCED;
        }
        return new SyncStatus(state, events.size(), capacity, dropped, sequence, lastEventAt);
    }

    /**
     * Registration handle returned by {@link #subscribe(Consumer)}.
     */
    @FunctionalInterface
    public interface Subscription extends AutoCloseable {
        @Override
        void close();
    }
}
