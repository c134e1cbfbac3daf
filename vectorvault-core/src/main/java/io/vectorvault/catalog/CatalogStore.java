package io.vectorvault.catalog;

import java.util.List;
import java.util.Optional;

/**
 * Durable map from collection id to {@link CollectionRecord}.
 *
 * <p>Implementations raise {@link io.vectorvault.StorageUnavailableException} when the
 * backing store cannot be read or written. Every {@link #put} and {@link #remove} is
 * atomic: after a crash the store holds either the old or the new state, never a mix.</p>
 */
public interface CatalogStore {

    Optional<CollectionRecord> get(String collectionId);

    /**
     * Returns all records ordered by collection id.
     */
    List<CollectionRecord> list();

    default boolean contains(String collectionId) {
        return get(collectionId).isPresent();
    }

    /**
     * Inserts or replaces the record stored under its collection id.
     */
    void put(CollectionRecord record);

    /**
     * Removes the record for {@code collectionId}.
     *
     * @return true if a record was removed
     */
    boolean remove(String collectionId);

    /**
     * Finds the first record (by id order) whose display name equals {@code displayName}.
     */
    default Optional<CollectionRecord> findByDisplayName(String displayName) {
        return list().stream()
            .filter(r -> r.displayName().equals(displayName))
            .findFirst();
    }

    /**
     * Schema version stamped into the persisted catalog, or empty if nothing was persisted yet.
     */
    Optional<String> schemaVersion();

    void setSchemaVersion(String version);
}
