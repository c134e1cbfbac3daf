package io.vectorvault.sync;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * A committed change to a collection.
 */
public record SyncEvent(
    /** Monotonic sequence number assigned by the queue */
    long sequence,

    String eventId,

    SyncEventKind kind,

    String collectionId,

    Instant timestamp,

    /** Kind-specific details, e.g. {@code previousId} and {@code displayName} for renames */
    Map<String, String> details
) {
    public SyncEvent {
        Objects.requireNonNull(kind, "kind cannot be null");
        Objects.requireNonNull(collectionId, "collectionId cannot be null");
        details = details != null ? Map.copyOf(details) : Map.of();
    }
}
