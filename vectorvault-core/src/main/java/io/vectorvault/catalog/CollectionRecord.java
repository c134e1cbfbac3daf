package io.vectorvault.catalog;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Catalog entry describing one collection.
 */
public record CollectionRecord(
    /** Stable, filesystem-safe identifier; never changes for the life of the collection */
    String collectionId,

    /** Arbitrary Unicode name shown to users */
    String displayName,

    /** How the vectors were produced */
    EmbeddingDescriptor embedding,

    /** Cached number of items, refreshed on writes */
    long itemCount,

    Instant createdAt,

    Instant updatedAt,

    /** Free-form metadata (recovery markers, owner, ...) */
    Map<String, String> extraMetadata
) {
    public CollectionRecord {
        CollectionIds.requireValid(collectionId);
        Objects.requireNonNull(displayName, "displayName cannot be null");
        Objects.requireNonNull(embedding, "embedding cannot be null");
        Objects.requireNonNull(createdAt, "createdAt cannot be null");
        if (itemCount < 0) throw new IllegalArgumentException("itemCount must be >= 0");
        updatedAt = updatedAt != null ? updatedAt : createdAt;
        extraMetadata = extraMetadata != null ? Map.copyOf(extraMetadata) : Map.of();
    }

    /**
     * Creates a record for a brand new, empty collection.
     */
    public static CollectionRecord create(String collectionId, String displayName,
                                          EmbeddingDescriptor embedding, Instant now) {
        return new CollectionRecord(collectionId, displayName, embedding, 0, now, now, Map.of());
    }

    public CollectionRecord withItemCount(long count, Instant now) {
        return new CollectionRecord(collectionId, displayName, embedding, count, createdAt, now, extraMetadata);
    }

    public CollectionRecord withDisplayName(String name, Instant now) {
        return new CollectionRecord(collectionId, name, embedding, itemCount, createdAt, now, extraMetadata);
    }

    /**
     * Returns a copy keyed under a fresh id. Used by rename, which never changes an id in place.
     */
    public CollectionRecord rekeyed(String newId, String newDisplayName, Instant now) {
        return new CollectionRecord(newId, newDisplayName, embedding, itemCount, createdAt, now, extraMetadata);
    }
}
