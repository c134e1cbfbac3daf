package io.vectorvault.catalog;

/**
 * Placeholder descriptor for collections whose provider is not known, typically
 * collections rebuilt from orphaned vector directories.
 */
public record UnknownEmbedding(int dimension) implements EmbeddingDescriptor {

    public UnknownEmbedding {
        if (dimension < 0) {
            throw new IllegalArgumentException("dimension must be >= 0, got " + dimension);
        }
    }

    @Override
    public EmbeddingProvider provider() {
        return EmbeddingProvider.UNKNOWN;
    }

    @Override
    public String modelName() {
        return "unknown";
    }
}
