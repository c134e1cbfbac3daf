package io.vectorvault.txn;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.vectorvault.VaultException;

import java.util.List;

/**
 * Definitive outcome of one transactional operation. Domain failures are reported here
 * rather than thrown.
 */
public record OperationResult(
    boolean success,

    String operationId,

    OperationKind kind,

    List<String> affectedIds,

    /** Id of the collection after the operation: the new id for create and rename, the deleted id for delete */
    String collectionId,

    /** Terminal phase: COMMITTED, ROLLED_BACK or FAILED; the error carries the phase reached */
    OperationPhase phase,

    RollbackOutcome rollbackOutcome,

    /** Archive holding the pre-operation state, or null if no checkpoint was taken */
    String checkpointId,

    @JsonIgnore
    VaultException error
) {
    public OperationResult {
        affectedIds = affectedIds != null ? List.copyOf(affectedIds) : List.of();
    }

    static OperationResult committed(String operationId, OperationKind kind, List<String> affectedIds,
                                     String collectionId, String checkpointId) {
        return new OperationResult(true, operationId, kind, affectedIds, collectionId,
            OperationPhase.COMMITTED, RollbackOutcome.NONE, checkpointId, null);
    }

    static OperationResult failed(String operationId, OperationKind kind, List<String> affectedIds,
                                  String collectionId, String checkpointId, OperationPhase phase,
                                  VaultException error) {
        return new OperationResult(false, operationId, kind, affectedIds, collectionId,
            phase, error.getRollbackOutcome(), checkpointId, error);
    }

    @JsonProperty("errorCode")
    public String errorCode() {
        return error != null ? error.code() : null;
    }

    @JsonProperty("errorMessage")
    public String errorMessage() {
        return error != null ? error.getMessage() : null;
    }

    /**
     * Returns the resulting collection id, or throws the failure.
     */
    public String orElseThrow() {
        if (!success) {
            throw error;
        }
        return collectionId;
    }
}
