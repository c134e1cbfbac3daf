package io.vectorvault.catalog;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * How the vectors of a collection were produced. One record type per provider, each
 * validating its own settings when constructed, so a malformed provider configuration
 * is rejected before it can reach the catalog.
 *
 * <p>The core never calls the provider; the descriptor only tells the consistency checker
 * which dimension to expect.</p>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "provider")
@JsonSubTypes({
    @JsonSubTypes.Type(value = OllamaEmbedding.class, name = "ollama"),
    @JsonSubTypes.Type(value = DashScopeEmbedding.class, name = "dashscope"),
    @JsonSubTypes.Type(value = UnknownEmbedding.class, name = "unknown")
})
public interface EmbeddingDescriptor {

    EmbeddingProvider provider();

    String modelName();

    /**
     * Vector dimension, or 0 when unknown.
     */
    int dimension();

    default boolean dimensionKnown() {
        return dimension() > 0;
    }
}
