package io.vectorvault.consistency;

import io.vectorvault.Fixtures;
import io.vectorvault.MutableClock;
import io.vectorvault.catalog.CollectionRecord;
import io.vectorvault.catalog.JsonCatalogStore;
import io.vectorvault.catalog.OllamaEmbedding;
import io.vectorvault.catalog.UnknownEmbedding;
import io.vectorvault.engine.HnswCollection;
import io.vectorvault.store.FilesystemInspector;
import io.vectorvault.store.HnswVectorStoreAdapter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ConsistencyChecker - the catalog/filesystem join.
 */
class ConsistencyCheckerTest {

    private static final int DIMENSIONS = 16;
    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @TempDir
    Path dataRoot;

    private JsonCatalogStore catalog;
    private HnswVectorStoreAdapter store;
    private ConsistencyChecker checker;
    private Random random;

    @BeforeEach
    void setUp() {
        catalog = JsonCatalogStore.inDataRoot(dataRoot, "1.1.0");
        store = new HnswVectorStoreAdapter(dataRoot);
        checker = new ConsistencyChecker(catalog, new FilesystemInspector(dataRoot), store, 8, new MutableClock(NOW));
        random = new Random(42);
    }

    // ==================== Join ====================

    @Test
    void testEmptyDataRootIsConsistent() {
        ConsistencyReport report = checker.check(true);

        assertEquals(ConsistencyStatus.CONSISTENT, report.status());
        assertTrue(report.issues().isEmpty());
        assertEquals(NOW, report.generatedAt());
    }

    @Test
    void testMatchingPairIsConsistent() {
        addPair("c1", DIMENSIONS, 10);

        assertTrue(checker.check(true).isConsistent());
    }

    @Test
    void testOrphanedVector() {
        store.create("c1", "model", DIMENSIONS);
        store.addItems("c1", Fixtures.items(random, 30, DIMENSIONS));

        ConsistencyReport report = checker.check(false);

        assertEquals(ConsistencyStatus.INCONSISTENT, report.status());
        OrphanedVector orphan = report.issuesOfType(OrphanedVector.class).get(0);
        assertEquals("c1", orphan.collectionId());
        assertEquals(30, orphan.estimatedCount());
        assertEquals(dataRoot.resolve("c1"), orphan.directory());
        assertTrue(orphan.estimatedSizeBytes() > 0);
    }

    @Test
    void testOrphanedCatalogEntry() {
        catalog.put(CollectionRecord.create("c1", "Docs", OllamaEmbedding.of("m", DIMENSIONS), NOW));

        ConsistencyReport report = checker.check(false);

        assertEquals(List.of(new OrphanedCatalogEntry("c1")), report.issues());
    }

    @Test
    void testDimensionMismatchOnlyOnFullCheck() {
        store.create("c1", "model", DIMENSIONS);
        catalog.put(CollectionRecord.create("c1", "Docs", OllamaEmbedding.of("m", 768), NOW));

        assertTrue(checker.check(false).isConsistent());

        ConsistencyReport full = checker.check(true);
        DimensionMismatch mismatch = full.issuesOfType(DimensionMismatch.class).get(0);
        assertEquals(768, mismatch.expected());
        assertEquals(DIMENSIONS, mismatch.observed());
    }

    @Test
    void testUnknownDimensionIsNotAMismatch() {
        store.create("c1", "model", DIMENSIONS);
        catalog.put(new CollectionRecord("c1", "recovered", new UnknownEmbedding(0), 0, NOW, NOW, null));

        assertTrue(checker.check(true).isConsistent());
    }

    @Test
    void testUnreadableHeaderReportedAsMismatch() throws IOException {
        addPair("c1", DIMENSIONS, 3);
        Files.write(dataRoot.resolve("c1").resolve(HnswCollection.HEADER_FILE), new byte[]{0});

        DimensionMismatch mismatch = checker.check(true).issuesOfType(DimensionMismatch.class).get(0);

        assertEquals(0, mismatch.observed());
    }

    @Test
    void testStoredVectorLengthDisagreeingWithRecord() throws IOException {
        addPair("c1", DIMENSIONS, 5);
        Files.write(dataRoot.resolve("c1").resolve(HnswCollection.VECTORS_FILE), new byte[5 * (DIMENSIONS + 4) * Float.BYTES]);

        assertTrue(checker.check(false).isConsistent());

        DimensionMismatch mismatch = checker.check(true).issuesOfType(DimensionMismatch.class).get(0);
        assertEquals(DIMENSIONS, mismatch.expected());
        assertEquals(DIMENSIONS + 4, mismatch.observed());
    }

    @Test
    void testScopedCheckIgnoresOtherIds() {
        addPair("c1", DIMENSIONS, 2);
        store.create("orphan", "model", DIMENSIONS);

        assertTrue(checker.check(List.of("c1"), true).isConsistent());
        assertFalse(checker.check(List.of("c1", "orphan"), true).isConsistent());
        assertTrue(checker.check(List.of("never-existed"), true).isConsistent());
    }

    // ==================== Failures ====================

    @Test
    void testMissingDataRootIsErrorNotOrphans() {
        catalog.put(CollectionRecord.create("c1", "Docs", OllamaEmbedding.of("m", DIMENSIONS), NOW));
        Path unmounted = dataRoot.resolve("unmounted");
        ConsistencyChecker blind = new ConsistencyChecker(catalog, new FilesystemInspector(unmounted),
            new HnswVectorStoreAdapter(unmounted), 8, new MutableClock(NOW));

        ConsistencyReport report = blind.check(false);

        assertEquals(ConsistencyStatus.ERROR, report.status());
        assertTrue(report.issues().isEmpty());
        assertNotNull(report.error());
    }

    @Test
    void testCorruptCatalogIsError() throws IOException {
        Files.writeString(catalog.file(), "garbage");

        assertEquals(ConsistencyStatus.ERROR, checker.check(false).status());
    }

    private void addPair(String id, int dimension, int items) {
        store.create(id, "model", dimension);
        store.addItems(id, Fixtures.items(random, items, dimension));
        catalog.put(CollectionRecord.create(id, id, OllamaEmbedding.of("m", dimension), NOW).withItemCount(items, NOW));
    }
}
