package io.vectorvault.consistency;

/**
 * Stored vectors whose length disagrees with the dimension recorded in the catalog.
 * An {@code observed} value of 0 means the vectors could not be read at all.
 */
public record DimensionMismatch(String collectionId, int expected, int observed) implements ConsistencyIssue {

    @Override
    public String describe() {
        return String.format("Collection %s: catalog expects dimension %d, vectors have %d",
            collectionId, expected, observed);
    }
}
