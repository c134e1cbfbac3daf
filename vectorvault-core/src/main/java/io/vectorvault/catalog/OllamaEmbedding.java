package io.vectorvault.catalog;

import java.net.URI;
import java.net.URISyntaxException;

/**
 * Embeddings produced by a local Ollama server.
 */
public record OllamaEmbedding(String modelName, int dimension, String baseUrl) implements EmbeddingDescriptor {

    public static final String DEFAULT_BASE_URL = "http://localhost:11434";

    public OllamaEmbedding {
        Descriptors.requireModel(modelName);
        Descriptors.requirePositive(dimension);
        baseUrl = baseUrl == null || baseUrl.isBlank() ? DEFAULT_BASE_URL : baseUrl;
        try {
            URI uri = new URI(baseUrl);
            if (!"http".equals(uri.getScheme()) && !"https".equals(uri.getScheme()) || uri.getHost() == null) {
                throw new IllegalArgumentException("Ollama baseUrl must be an http(s) URL: " + baseUrl);
            }
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Malformed Ollama baseUrl: " + baseUrl, e);
        }
    }

    public static OllamaEmbedding of(String modelName, int dimension) {
        return new OllamaEmbedding(modelName, dimension, DEFAULT_BASE_URL);
    }

    @Override
    public EmbeddingProvider provider() {
        return EmbeddingProvider.OLLAMA;
    }
}
