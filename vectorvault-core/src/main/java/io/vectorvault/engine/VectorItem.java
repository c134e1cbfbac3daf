package io.vectorvault.engine;

import java.util.Arrays;
import java.util.Map;
import java.util.Objects;

/**
 * One embedded document stored in a physical collection.
 */
public record VectorItem(
    /** Item identifier, unique within its collection */
    String id,

    /** The embedding */
    float[] vector,

    /** Source text the embedding was generated from */
    String document,

    /** Free-form item metadata (source file, chunk index, ...) */
    Map<String, String> metadata
) {
    public VectorItem {
        Objects.requireNonNull(id, "id cannot be null");
        Objects.requireNonNull(vector, "vector cannot be null");
        document = document != null ? document : "";
        metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
    }

    public static VectorItem of(String id, float[] vector) {
        return new VectorItem(id, vector, "", Map.of());
    }

    public int dimension() {
        return vector.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof VectorItem other)) return false;
        return id.equals(other.id)
            && Arrays.equals(vector, other.vector)
            && document.equals(other.document)
            && metadata.equals(other.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, Arrays.hashCode(vector), document, metadata);
    }

    @Override
    public String toString() {
        return "VectorItem[id=" + id + ", dimension=" + vector.length + "]";
    }
}
