package io.vectorvault.txn;

import java.time.Instant;
import java.util.List;

/**
 * Archive taken before an operation touched anything.
 */
public record Checkpoint(String operationId, List<String> affectedIds, String backupId, Instant createdAt) {

    public Checkpoint {
        affectedIds = List.copyOf(affectedIds);
    }
}
