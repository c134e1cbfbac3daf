package io.vectorvault.engine;

import java.util.Objects;

/**
 * Represents a search result from a vector similarity query.
 */
public record SearchResult(
    /** The matching item */
    VectorItem item,

    /** Similarity score (0.0 to 1.0, higher is more similar) */
    float similarity
) implements Comparable<SearchResult> {

    public SearchResult {
        Objects.requireNonNull(item, "item cannot be null");
        // Cosine similarity arrives in [-1, 1]; clamp after mapping to [0, 1]
        similarity = (similarity + 1f) / 2f;
        similarity = Math.max(0f, Math.min(1f, similarity));
    }

    /**
     * Compares by similarity (descending order).
     */
    @Override
    public int compareTo(SearchResult other) {
        return Float.compare(other.similarity, this.similarity);
    }
}
