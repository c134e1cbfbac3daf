package io.vectorvault;

import io.vectorvault.txn.OperationPhase;
import io.vectorvault.txn.RollbackOutcome;

/**
 * Base class for every failure raised by the vault.
 *
 * <p>Each failure names the collection it concerns (or {@code null} for failures that are
 * not tied to one collection), the phase a transactional operation had reached when it
 * failed, and what happened to the rollback.</p>
 */
public class VaultException extends RuntimeException {

    private final String collectionId;
    private OperationPhase phase;
    private RollbackOutcome rollbackOutcome = RollbackOutcome.NONE;

    public VaultException(String message, String collectionId) {
        this(message, collectionId, null);
    }

    public VaultException(String message, String collectionId, Throwable cause) {
        super(message, cause);
        this.collectionId = collectionId;
    }

    /**
     * Records where a transactional operation stood when this failure surfaced.
     *
     * @return this exception, for chaining
     */
    public VaultException annotate(OperationPhase phase, RollbackOutcome rollbackOutcome) {
        this.phase = phase;
        this.rollbackOutcome = rollbackOutcome;
        return this;
    }

    public String getCollectionId() {
        return collectionId;
    }

    /**
     * Phase reached, or {@code null} when the failure happened outside a transactional operation.
     */
    public OperationPhase getPhase() {
        return phase;
    }

    public RollbackOutcome getRollbackOutcome() {
        return rollbackOutcome;
    }

    /**
     * Short machine-readable error code, e.g. {@code NOT_FOUND}.
     */
    public String code() {
        return "VAULT_ERROR";
    }
}
