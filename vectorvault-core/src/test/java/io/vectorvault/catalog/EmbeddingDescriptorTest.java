package io.vectorvault.catalog;

import com.fasterxml.jackson.databind.JsonNode;
import io.vectorvault.Json;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the per-provider embedding descriptors and their JSON tagging.
 */
class EmbeddingDescriptorTest {

    // ==================== Validation ====================

    @Test
    void testOllamaDefaults() {
        OllamaEmbedding ollama = new OllamaEmbedding("nomic-embed-text", 768, null);

        assertEquals(OllamaEmbedding.DEFAULT_BASE_URL, ollama.baseUrl());
        assertEquals(EmbeddingProvider.OLLAMA, ollama.provider());
        assertTrue(ollama.dimensionKnown());
    }

    @Test
    void testOllamaRejectsBadSettings() {
        assertThrows(IllegalArgumentException.class, () -> new OllamaEmbedding(" ", 768, null));
        assertThrows(IllegalArgumentException.class, () -> new OllamaEmbedding("m", 0, null));
        assertThrows(IllegalArgumentException.class, () -> new OllamaEmbedding("m", 768, "ftp://host"));
        assertThrows(IllegalArgumentException.class, () -> new OllamaEmbedding("m", 768, "http://bad host"));
    }

    @Test
    void testDashScopeRejectsBadRegion() {
        assertEquals(DashScopeEmbedding.DEFAULT_REGION, DashScopeEmbedding.of("text-embedding-v3", 1024).region());
        assertThrows(IllegalArgumentException.class, () -> new DashScopeEmbedding("text-embedding-v3", 1024, "Mars"));
    }

    @Test
    void testUnknownAllowsZeroDimension() {
        UnknownEmbedding unknown = new UnknownEmbedding(0);

        assertFalse(unknown.dimensionKnown());
        assertThrows(IllegalArgumentException.class, () -> new UnknownEmbedding(-1));
    }

    // ==================== JSON ====================

    @Test
    void testProviderTagWritten() throws Exception {
        String json = Json.mapper().writerFor(EmbeddingDescriptor.class)
            .writeValueAsString(DashScopeEmbedding.of("text-embedding-v3", 1024));
        JsonNode node = Json.mapper().readTree(json);

        assertEquals("dashscope", node.get("provider").asText());
        assertEquals(1024, node.get("dimension").asInt());
    }

    @Test
    void testReadsEachProvider() throws Exception {
        EmbeddingDescriptor ollama = Json.mapper().readValue(
            "{\"provider\":\"ollama\",\"modelName\":\"bge-m3\",\"dimension\":1024,\"baseUrl\":\"http://gpu:11434\"}",
            EmbeddingDescriptor.class);
        EmbeddingDescriptor unknown = Json.mapper().readValue(
            "{\"provider\":\"unknown\",\"dimension\":384}", EmbeddingDescriptor.class);

        assertEquals(new OllamaEmbedding("bge-m3", 1024, "http://gpu:11434"), ollama);
        assertEquals(new UnknownEmbedding(384), unknown);
    }

    @Test
    void testInvalidProviderSettingsRejectedOnRead() {
        assertThrows(Exception.class, () -> Json.mapper().readValue(
            "{\"provider\":\"ollama\",\"modelName\":\"\",\"dimension\":1024}", EmbeddingDescriptor.class));
        assertThrows(Exception.class, () -> Json.mapper().readValue(
            "{\"provider\":\"openai\",\"modelName\":\"x\",\"dimension\":3}", EmbeddingDescriptor.class));
    }
}
