package io.vectorvault.recovery;

import java.nio.file.Path;

/**
 * An orphaned physical collection, judged for whether a catalog record can be rebuilt for it.
 */
public record RecoveryCandidate(
    String collectionId,

    Path directory,

    long estimatedSizeBytes,

    long estimatedCount,

    /** Dimension read from the header; 0 when unknown */
    int dimension,

    /** True when item ids and the vector dimension could both be read */
    boolean recoverable,

    /** Why the candidate is not recoverable, or null */
    String reason
) {
    static RecoveryCandidate recoverable(String id, Path dir, long size, long count, int dimension) {
        return new RecoveryCandidate(id, dir, size, count, dimension, true, null);
    }

    static RecoveryCandidate unrecoverable(String id, Path dir, long size, long count, int dimension, String reason) {
        return new RecoveryCandidate(id, dir, size, count, dimension, false, reason);
    }
}
