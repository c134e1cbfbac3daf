package io.vectorvault.engine;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for HnswCollection - the embedded engine behind a physical collection.
 */
class HnswCollectionTest {

    private static final int DIMENSIONS = 64; // Smaller for faster tests
    private static final String MODEL_ID = "nomic-embed-text";

    private HnswCollection collection;
    private Random random;

    @BeforeEach
    void setUp() {
        collection = new HnswCollection(MODEL_ID, DIMENSIONS);
        random = new Random(42); // Fixed seed for reproducibility
    }

    // ==================== Creation Tests ====================

    @Test
    void testCreateEmptyCollection() {
        assertEquals(0, collection.size());
        assertEquals(MODEL_ID, collection.modelId());
        assertEquals(DIMENSIONS, collection.dimension());
    }

    @Test
    void testRejectsNonPositiveDimension() {
        assertThrows(IllegalArgumentException.class, () -> new HnswCollection(MODEL_ID, 0));
    }

    // ==================== Add Tests ====================

    @Test
    void testAddSingleItem() {
        collection.add(item("a"));

        assertEquals(1, collection.size());
        assertTrue(collection.get("a").isPresent());
    }

    @Test
    void testAddAllBatch() {
        List<VectorItem> batch = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            batch.add(item("doc-" + i));
        }

        collection.addAll(batch);

        assertEquals(50, collection.size());
        assertEquals("doc-0", collection.ids().get(0));
    }

    @Test
    void testAddWithDimensionMismatch() {
        VectorItem wrong = VectorItem.of("bad", new float[DIMENSIONS + 10]);

        assertThrows(IllegalArgumentException.class, () -> collection.add(wrong));
    }

    @Test
    void testAddDuplicateIdRejected() {
        collection.add(item("a"));

        assertThrows(IllegalArgumentException.class, () -> collection.add(item("a")));
        assertThrows(IllegalArgumentException.class, () -> collection.addAll(List.of(item("b"), item("b"))));
        assertEquals(1, collection.size());
    }

    @Test
    void testGrowsBeyondInitialCapacity() {
        List<VectorItem> batch = new ArrayList<>();
        for (int i = 0; i < 1_200; i++) {
            batch.add(item("doc-" + i));
        }

        collection.addAll(batch);

        assertEquals(1_200, collection.size());
        assertEquals(10, collection.search(randomVector(), 10).size());
    }

    // ==================== Search Tests ====================

    @Test
    void testSearchFindsItself() {
        List<float[]> vectors = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            float[] v = randomVector();
            vectors.add(v);
            collection.add(VectorItem.of("doc-" + i, v));
        }

        List<SearchResult> results = collection.search(vectors.get(5), 5);

        assertEquals(5, results.size());
        assertEquals("doc-5", results.get(0).item().id());
        assertTrue(results.get(0).similarity() > 0.99f);
    }

    @Test
    void testSearchEmptyCollection() {
        assertTrue(collection.search(randomVector(), 5).isEmpty());
    }

    @Test
    void testSearchTopKGreaterThanSize() {
        for (int i = 0; i < 3; i++) {
            collection.add(item("doc-" + i));
        }

        assertEquals(3, collection.search(randomVector(), 10).size());
    }

    @Test
    void testResultsAreSortedBySimilarity() {
        for (int i = 0; i < 20; i++) {
            collection.add(item("doc-" + i));
        }

        List<SearchResult> results = collection.search(randomVector(), 10);

        for (int i = 1; i < results.size(); i++) {
            assertTrue(results.get(i - 1).similarity() >= results.get(i).similarity());
        }
    }

    @Test
    void testSearchDimensionMismatch() {
        collection.add(item("a"));

        assertThrows(IllegalArgumentException.class, () -> collection.search(new float[3], 1));
    }

    // ==================== Persistence Tests ====================

    @Test
    void testSaveAndLoad(@TempDir Path tempDir) throws IOException {
        for (int i = 0; i < 20; i++) {
            collection.add(new VectorItem("doc-" + i, randomVector(), "text " + i, Map.of("i", "" + i)));
        }
        Path dir = tempDir.resolve("c1");

        collection.save(dir);
        HnswCollection loaded = HnswCollection.load(dir);

        assertEquals(collection.size(), loaded.size());
        assertEquals(MODEL_ID, loaded.modelId());
        assertEquals(DIMENSIONS, loaded.dimension());
        assertEquals(collection.items(), loaded.items());
        assertFalse(Files.exists(dir.resolve(HnswCollection.HEADER_FILE + ".tmp")));
    }

    @Test
    void testVectorFileHasExactSize(@TempDir Path tempDir) throws IOException {
        for (int i = 0; i < 7; i++) {
            collection.add(item("doc-" + i));
        }
        collection.save(tempDir);

        assertEquals(7L * DIMENSIONS * Float.BYTES, Files.size(tempDir.resolve(HnswCollection.VECTORS_FILE)));
        CollectionHeader header = CollectionHeader.read(tempDir.resolve(HnswCollection.HEADER_FILE));
        assertEquals(7, header.itemCount());
        assertEquals(DIMENSIONS, header.dimension());
    }

    @Test
    void testLoadRebuildsMissingGraph(@TempDir Path tempDir) throws IOException {
        float[] known = randomVector();
        collection.add(VectorItem.of("known", known));
        for (int i = 0; i < 10; i++) {
            collection.add(item("other-" + i));
        }
        collection.save(tempDir);
        Files.delete(tempDir.resolve(HnswCollection.GRAPH_FILE));

        HnswCollection loaded = HnswCollection.load(tempDir);

        assertEquals(11, loaded.size());
        assertEquals("known", loaded.search(known, 1).get(0).item().id());
    }

    @Test
    void testLoadRejectsTruncatedVectors(@TempDir Path tempDir) throws IOException {
        for (int i = 0; i < 5; i++) {
            collection.add(item("doc-" + i));
        }
        collection.save(tempDir);
        Path vectors = tempDir.resolve(HnswCollection.VECTORS_FILE);
        byte[] bytes = Files.readAllBytes(vectors);
        Files.write(vectors, java.util.Arrays.copyOf(bytes, bytes.length - 8));

        assertThrows(IOException.class, () -> HnswCollection.load(tempDir));
    }

    @Test
    void testLoadRejectsBadHeader(@TempDir Path tempDir) throws IOException {
        collection.save(tempDir);
        Files.write(tempDir.resolve(HnswCollection.HEADER_FILE), new byte[]{'X', 'X', 'X', 'X', 0, 1});

        assertThrows(IOException.class, () -> HnswCollection.load(tempDir));
    }

    // ==================== Helpers ====================

    private VectorItem item(String id) {
        return VectorItem.of(id, randomVector());
    }

    private float[] randomVector() {
        float[] v = new float[DIMENSIONS];
        for (int i = 0; i < DIMENSIONS; i++) {
            v[i] = random.nextFloat() * 2 - 1;
        }
        return v;
    }
}
