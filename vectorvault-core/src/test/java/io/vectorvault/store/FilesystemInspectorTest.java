package io.vectorvault.store;

import io.vectorvault.AlreadyExistsException;
import io.vectorvault.Fixtures;
import io.vectorvault.NotFoundException;
import io.vectorvault.StorageUnavailableException;
import io.vectorvault.engine.HnswCollection;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for FilesystemInspector and HnswVectorStoreAdapter over a real data root.
 */
class FilesystemInspectorTest {

    private static final int DIMENSIONS = 16;

    @TempDir
    Path dataRoot;

    private HnswVectorStoreAdapter store;
    private FilesystemInspector inspector;
    private Random random;

    @BeforeEach
    void setUp() {
        store = new HnswVectorStoreAdapter(dataRoot);
        inspector = new FilesystemInspector(dataRoot);
        random = new Random(42);
    }

    // ==================== Adapter ====================

    @Test
    void testCreateAddAndCount() {
        store.create("c1", "model", DIMENSIONS);
        store.addItems("c1", Fixtures.items(random, 25, DIMENSIONS));

        assertTrue(store.exists("c1"));
        assertEquals(25, store.count("c1"));
        assertEquals(25, store.listIds("c1").size());
        assertEquals(Set.of("c1"), store.listCollections());
        assertEquals(Set.of(DIMENSIONS), store.sampleDimensions("c1", 4));
    }

    @Test
    void testSampleDimensionsReadsStoredVectors() throws IOException {
        store.create("c1", "model", DIMENSIONS);
        store.addItems("c1", Fixtures.items(random, 10, DIMENSIONS));
        Path vectors = dataRoot.resolve("c1").resolve(HnswCollection.VECTORS_FILE);

        Files.write(vectors, new byte[10 * (DIMENSIONS + 2) * Float.BYTES]);
        assertEquals(Set.of(DIMENSIONS + 2), store.sampleDimensions("c1", 4));

        Files.write(vectors, new byte[10 * DIMENSIONS * Float.BYTES + 3]);
        assertEquals(Set.of(0), store.sampleDimensions("c1", 4));
    }

    @Test
    void testSampleDimensionsFlagsNonFiniteRows() throws IOException {
        store.create("c1", "model", DIMENSIONS);
        store.addItems("c1", Fixtures.items(random, 4, DIMENSIONS));
        Path vectors = dataRoot.resolve("c1").resolve(HnswCollection.VECTORS_FILE);
        ByteBuffer buffer = ByteBuffer.wrap(Files.readAllBytes(vectors));
        buffer.putFloat(0, Float.NaN);
        Files.write(vectors, buffer.array());

        assertEquals(Set.of(0, DIMENSIONS), store.sampleDimensions("c1", 4));
    }

    @Test
    void testRemoveLeftoversKeepsCollections() throws IOException {
        store.create("c1", "model", DIMENSIONS);
        Path dropping = Files.createDirectories(dataRoot.resolve(".c2" + PhysicalLayout.DROPPING_SUFFIX));
        Files.write(dropping.resolve(HnswCollection.VECTORS_FILE), new byte[8]);
        Path restoring = Files.createDirectories(dataRoot.resolve(".c1" + PhysicalLayout.RESTORING_SUFFIX));
        Path other = Files.createDirectories(dataRoot.resolve(".cache"));

        List<Path> removed = store.removeLeftovers();

        assertEquals(Set.of(dropping, restoring), Set.copyOf(removed));
        assertFalse(Files.exists(dropping));
        assertFalse(Files.exists(restoring));
        assertTrue(Files.exists(other));
        assertTrue(store.exists("c1"));
    }

    @Test
    void testCreateTwiceFails() {
        store.create("c1", "model", DIMENSIONS);

        assertThrows(AlreadyExistsException.class, () -> store.create("c1", "model", DIMENSIONS));
    }

    @Test
    void testDropRemovesEverything() throws IOException {
        store.create("c1", "model", DIMENSIONS);

        store.drop("c1");

        assertFalse(store.exists("c1"));
        try (var entries = Files.list(dataRoot)) {
            assertEquals(0, entries.count());
        }
        assertThrows(NotFoundException.class, () -> store.drop("c1"));
    }

    @Test
    void testReadsOfMissingCollection() {
        assertThrows(NotFoundException.class, () -> store.count("nope"));
        assertThrows(NotFoundException.class, () -> store.readItems("nope"));
    }

    // ==================== Inspector ====================

    @Test
    void testScanEstimatesFromDirectoryStatistics() {
        store.create("c1", "model", DIMENSIONS);
        store.addItems("c1", Fixtures.items(random, 40, DIMENSIONS));
        store.create("c2", "model", 8);

        List<PhysicalCollectionInfo> found = inspector.scan();

        assertEquals(2, found.size());
        PhysicalCollectionInfo c1 = found.get(0);
        assertEquals("c1", c1.collectionId());
        assertEquals(40, c1.estimatedCount());
        assertEquals(DIMENSIONS, c1.dimension());
        assertTrue(c1.headerReadable());
        assertTrue(c1.sizeBytes() >= 40L * DIMENSIONS * Float.BYTES);
        assertEquals(0, found.get(1).estimatedCount());
    }

    @Test
    void testScanIgnoresFilesHiddenAndForeignDirectories() throws IOException {
        store.create("c1", "model", DIMENSIONS);
        Files.writeString(dataRoot.resolve("catalog.json"), "{}");
        Files.createDirectories(dataRoot.resolve(".c9.dropping"));
        Files.createDirectories(dataRoot.resolve("not-a-collection"));

        List<PhysicalCollectionInfo> found = inspector.scan();

        assertEquals(1, found.size());
        assertEquals("c1", found.get(0).collectionId());
    }

    @Test
    void testUnreadableHeaderReported() throws IOException {
        store.create("c1", "model", DIMENSIONS);
        Files.write(dataRoot.resolve("c1").resolve(HnswCollection.HEADER_FILE), new byte[]{1, 2, 3});

        PhysicalCollectionInfo info = inspector.inspect("c1").orElseThrow();

        assertFalse(info.headerReadable());
        assertFalse(info.dimensionKnown());
        assertNotNull(info.problem());
    }

    @Test
    void testPartialDirectoryIsListedButIncomplete() throws IOException {
        Path dir = Files.createDirectories(dataRoot.resolve("c1"));
        Files.write(dir.resolve(HnswCollection.ITEMS_FILE), "[]".getBytes());

        PhysicalCollectionInfo info = inspector.inspect("c1").orElseThrow();

        assertFalse(info.headerReadable());
        assertTrue(store.exists("c1"));
        assertEquals(0, info.estimatedCount());
    }

    @Test
    void testMissingDataRootIsUnavailableNotEmpty() {
        FilesystemInspector unmounted = new FilesystemInspector(dataRoot.resolve("unmounted"));

        assertThrows(StorageUnavailableException.class, unmounted::scan);
    }

    @Test
    void testInspectMissing() {
        assertTrue(inspector.inspect("nope").isEmpty());
    }
}
