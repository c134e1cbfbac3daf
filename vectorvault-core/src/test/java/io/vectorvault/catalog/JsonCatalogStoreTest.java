package io.vectorvault.catalog;

import io.vectorvault.StorageUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for JsonCatalogStore - the catalog persisted as catalog.json.
 */
class JsonCatalogStoreTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @TempDir
    Path tempDir;

    private JsonCatalogStore store;

    @BeforeEach
    void setUp() {
        store = JsonCatalogStore.inDataRoot(tempDir, "1.1.0");
    }

    // ==================== Read / Write ====================

    @Test
    void testEmptyStoreHasNoRecordsAndNoVersion() {
        assertTrue(store.list().isEmpty());
        assertTrue(store.get("missing").isEmpty());
        assertTrue(store.schemaVersion().isEmpty());
        assertFalse(Files.exists(store.file()));
    }

    @Test
    void testPutAndGet() {
        CollectionRecord record = record("c1", "Docs");

        store.put(record);

        assertEquals(record, store.get("c1").orElseThrow());
        assertTrue(store.contains("c1"));
        assertEquals("1.1.0", store.schemaVersion().orElseThrow());
    }

    @Test
    void testPersistsAcrossInstances() {
        store.put(new CollectionRecord("c1", "Документы 文档", DashScopeEmbedding.of("text-embedding-v3", 1024),
            12, NOW, NOW, Map.of("owner", "ops")));

        JsonCatalogStore reopened = JsonCatalogStore.inDataRoot(tempDir, "9.9.9");
        CollectionRecord loaded = reopened.get("c1").orElseThrow();

        assertEquals("Документы 文档", loaded.displayName());
        assertEquals(EmbeddingProvider.DASHSCOPE, loaded.embedding().provider());
        assertEquals(1024, loaded.embedding().dimension());
        assertEquals(12, loaded.itemCount());
        assertEquals("ops", loaded.extraMetadata().get("owner"));
        assertEquals("1.1.0", reopened.schemaVersion().orElseThrow());
    }

    @Test
    void testListOrderedById() {
        store.put(record("b", "second"));
        store.put(record("a", "first"));
        store.put(record("c", "third"));

        List<String> ids = store.list().stream().map(CollectionRecord::collectionId).toList();

        assertEquals(List.of("a", "b", "c"), ids);
    }

    @Test
    void testRemove() {
        store.put(record("c1", "Docs"));

        assertTrue(store.remove("c1"));
        assertFalse(store.remove("c1"));
        assertTrue(store.get("c1").isEmpty());
    }

    @Test
    void testFindByDisplayName() {
        store.put(record("c1", "Docs"));
        store.put(record("c2", "Notes"));

        assertEquals("c2", store.findByDisplayName("Notes").orElseThrow().collectionId());
        assertTrue(store.findByDisplayName("nothing").isEmpty());
    }

    @Test
    void testSetSchemaVersionKeepsRecords() {
        store.put(record("c1", "Docs"));

        store.setSchemaVersion("2.0.0");

        assertEquals("2.0.0", store.schemaVersion().orElseThrow());
        assertTrue(store.contains("c1"));
    }

    @Test
    void testNoTemporaryFileLeftBehind() {
        store.put(record("c1", "Docs"));

        assertFalse(Files.exists(tempDir.resolve(JsonCatalogStore.FILE_NAME + ".tmp")));
    }

    // ==================== Failures ====================

    @Test
    void testCorruptCatalogIsStorageUnavailable() throws IOException {
        Files.writeString(store.file(), "{ not json");

        StorageUnavailableException e = assertThrows(StorageUnavailableException.class, () -> store.list());
        assertEquals("STORAGE_UNAVAILABLE", e.code());
    }

    @Test
    void testRecordRejectsInvalidId() {
        assertThrows(IllegalArgumentException.class, () -> record("../escape", "x"));
        assertThrows(IllegalArgumentException.class, () -> record(".hidden", "x"));
    }

    private static CollectionRecord record(String id, String name) {
        return CollectionRecord.create(id, name, OllamaEmbedding.of("nomic-embed-text", 768), NOW);
    }
}
