package io.vectorvault.sync;

import java.time.Instant;

/**
 * Snapshot of the sync queue bookkeeping.
 */
public record SyncStatus(
    SyncState state,
    int pending,
    int capacity,
    long dropped,
    long lastSequence,
    Instant lastEventAt
) {}
