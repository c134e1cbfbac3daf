package io.vectorvault.catalog;

/**
 * Embeddings produced by the Alibaba Cloud DashScope API (text-embedding-v*).
 */
public record DashScopeEmbedding(String modelName, int dimension, String region) implements EmbeddingDescriptor {

    public static final String DEFAULT_REGION = "cn-beijing";

    public DashScopeEmbedding {
        Descriptors.requireModel(modelName);
        Descriptors.requirePositive(dimension);
        region = region == null || region.isBlank() ? DEFAULT_REGION : region;
        if (!region.matches("[a-z]+(-[a-z0-9]+)+")) {
            throw new IllegalArgumentException("Invalid DashScope region: " + region);
        }
    }

    public static DashScopeEmbedding of(String modelName, int dimension) {
        return new DashScopeEmbedding(modelName, dimension, DEFAULT_REGION);
    }

    @Override
    public EmbeddingProvider provider() {
        return EmbeddingProvider.DASHSCOPE;
    }
}
