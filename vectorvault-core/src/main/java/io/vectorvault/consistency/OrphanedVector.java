package io.vectorvault.consistency;

import java.nio.file.Path;

/**
 * A physical collection directory without a catalog entry.
 */
public record OrphanedVector(String collectionId, Path directory, long estimatedSizeBytes, long estimatedCount)
    implements ConsistencyIssue {

    @Override
    public String describe() {
        return String.format("Vector directory %s has no catalog entry (~%d items, %d bytes)",
            collectionId, estimatedCount, estimatedSizeBytes);
    }
}
