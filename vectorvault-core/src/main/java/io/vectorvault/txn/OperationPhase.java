package io.vectorvault.txn;

/**
 * States of a transactional operation.
 * <pre>
 * PENDING -&gt; CHECKPOINTED -&gt; EXECUTING -&gt; VERIFYING -&gt; COMMITTED | ROLLED_BACK | FAILED
 * </pre>
 */
public enum OperationPhase {
    PENDING,
    CHECKPOINTED,
    EXECUTING,
    VERIFYING,
    COMMITTED,
    ROLLED_BACK,
    FAILED;

    public boolean isTerminal() {
        return this == COMMITTED || this == ROLLED_BACK || this == FAILED;
    }
}
