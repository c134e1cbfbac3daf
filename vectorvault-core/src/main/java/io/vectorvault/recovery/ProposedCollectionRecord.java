package io.vectorvault.recovery;

import io.vectorvault.catalog.CollectionRecord;
import io.vectorvault.catalog.UnknownEmbedding;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Catalog record that recovery intends to write for an orphaned directory.
 */
public record ProposedCollectionRecord(
    String collectionId,

    /**
     * Deterministic placeholder, {@code recovered_<first 8 chars of the id>}, or
     * {@code recovered_<id>} when the short form is not unique
     */
    String displayName,

    /** Dimension the directory must still have when the record is written; 0 when unknown */
    int dimension,

    long estimatedSizeBytes,

    long estimatedCount
) {
    public static final String PLACEHOLDER_PREFIX = "recovered_";

    static ProposedCollectionRecord from(RecoveryCandidate candidate, boolean shortNameUnique) {
        String id = candidate.collectionId();
        String name = shortNameUnique ? shortName(id) : longName(id);
        return new ProposedCollectionRecord(id, name, candidate.dimension(),
            candidate.estimatedSizeBytes(), candidate.estimatedCount());
    }

    static String shortName(String collectionId) {
        return PLACEHOLDER_PREFIX + collectionId.substring(0, Math.min(8, collectionId.length()));
    }

    static String longName(String collectionId) {
        return PLACEHOLDER_PREFIX + collectionId;
    }

    ProposedCollectionRecord withDisplayName(String name) {
        return new ProposedCollectionRecord(collectionId, name, dimension, estimatedSizeBytes, estimatedCount);
    }

    /**
     * Builds the record to store, with the exact item count found at write time.
     */
    CollectionRecord toRecord(long itemCount, Instant now) {
        Map<String, String> extra = new LinkedHashMap<>();
        extra.put("recovered", "true");
        extra.put("recovered_at", now.toString());
        extra.put("estimated_size_bytes", Long.toString(estimatedSizeBytes));
        extra.put("estimated_item_count", Long.toString(estimatedCount));
        return new CollectionRecord(collectionId, displayName, new UnknownEmbedding(dimension),
            itemCount, now, now, extra);
    }
}
