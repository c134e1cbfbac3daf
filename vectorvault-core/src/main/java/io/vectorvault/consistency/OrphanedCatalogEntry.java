package io.vectorvault.consistency;

/**
 * A catalog entry whose physical collection is missing.
 */
public record OrphanedCatalogEntry(String collectionId) implements ConsistencyIssue {

    @Override
    public String describe() {
        return String.format("Catalog entry %s has no vector directory", collectionId);
    }
}
