package io.vectorvault.sync;

/**
 * Kinds of committed change announced on the sync queue.
 */
public enum SyncEventKind {
    CREATED,
    DELETED,
    RENAMED,
    RECOVERED
}
