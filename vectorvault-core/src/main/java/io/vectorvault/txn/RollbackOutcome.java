package io.vectorvault.txn;

/**
 * What happened to the pre-operation state after a failure.
 */
public enum RollbackOutcome {
    /** No rollback was needed (success, or failure before anything was touched) */
    NONE,
    /** Pre-operation state was restored from the checkpoint */
    RESTORED,
    /** Restoring the checkpoint failed; the ids are quarantined */
    FAILED
}
