package io.vectorvault.store;

import java.nio.file.Path;

/**
 * Cheap, approximate description of a physical collection directory, gathered from
 * directory statistics and the collection header without loading vectors.
 */
public record PhysicalCollectionInfo(
    String collectionId,

    Path directory,

    /** Total bytes of all files in the directory */
    long sizeBytes,

    /** Item count estimated from the vector file size; 0 when the dimension is unknown */
    long estimatedCount,

    /** Dimension from the header, or 0 when the header is unreadable */
    int dimension,

    /** Whether header and vector file are present and the header parsed */
    boolean headerReadable,

    /** Why the header could not be read, or null */
    String problem
) {
    public boolean dimensionKnown() {
        return dimension > 0;
    }
}
