package io.vectorvault.catalog;

/**
 * Embedding providers a collection can be configured with.
 */
public enum EmbeddingProvider {
    /** Local Ollama server */
    OLLAMA,

    /** Alibaba Cloud DashScope API */
    DASHSCOPE,

    /** Provider could not be determined (recovered collections) */
    UNKNOWN
}
