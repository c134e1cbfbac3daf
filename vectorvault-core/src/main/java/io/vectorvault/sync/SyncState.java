package io.vectorvault.sync;

/**
 * Coarse state of the sync queue as seen by consumers.
 */
public enum SyncState {
    /** Nothing waiting to be drained */
    SYNCED,

    /** Events are waiting to be drained */
    PENDING,

    /** Events were dropped since the last drain; consumers must resynchronize from the catalog */
    OVERFLOWED
}
