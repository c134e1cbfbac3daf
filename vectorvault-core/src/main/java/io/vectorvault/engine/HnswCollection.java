package io.vectorvault.engine;

import com.fasterxml.jackson.core.type.TypeReference;
import com.github.jelmerk.hnswlib.core.DistanceFunctions;
import com.github.jelmerk.hnswlib.core.Item;
import com.github.jelmerk.hnswlib.core.hnsw.HnswIndex;
import io.vectorvault.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.*;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.*;
import java.util.stream.Collectors;

/**
 * The embedded vector engine: one physical collection backed by an HNSW graph.
 *
 * <p>On disk a collection is a directory holding four files:</p>
 * <ul>
 *   <li>{@code header.bin} - dimension, item count and model id ({@link CollectionHeader})</li>
 *   <li>{@code vectors.bin} - raw float32 vectors in item order</li>
 *   <li>{@code items.json} - item ids, documents and metadata in item order</li>
 *   <li>{@code graph.hnsw} - the serialized HNSW graph, rebuilt from the vectors when missing</li>
 * </ul>
 */
public class HnswCollection {

    private static final Logger log = LoggerFactory.getLogger(HnswCollection.class);

    public static final String HEADER_FILE = "header.bin";
    public static final String VECTORS_FILE = "vectors.bin";
    public static final String ITEMS_FILE = "items.json";
    public static final String GRAPH_FILE = "graph.hnsw";

    // HNSW parameters
    private static final int DEFAULT_M = 16;
    private static final int DEFAULT_EF_CONSTRUCTION = 200;
    private static final int DEFAULT_EF = 50;
    private static final int MIN_CAPACITY = 1_000;

    private final String modelId;
    private final int dimension;
    private final List<VectorItem> items;
    private final Map<String, Integer> idToIndex;
    private HnswIndex<String, float[], ItemVector, Float> graph;

    public HnswCollection(String modelId, int dimension) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("dimension must be > 0, got " + dimension);
        }
        this.modelId = Objects.requireNonNull(modelId, "modelId cannot be null");
        this.dimension = dimension;
        this.items = new ArrayList<>();
        this.idToIndex = new HashMap<>();
        this.graph = newGraph(MIN_CAPACITY);
    }

    // ==================== Modification ====================

    public void add(VectorItem item) {
        checkItem(item);
        ensureCapacity(items.size() + 1);

        int index = items.size();
        items.add(item);
        idToIndex.put(item.id(), index);
        graph.add(new ItemVector(item.id(), item.vector(), index));

        log.debug("Added item: {} (index={})", item.id(), index);
    }

    public void addAll(List<VectorItem> batch) {
        Set<String> batchIds = new HashSet<>();
        for (VectorItem item : batch) {
            checkItem(item);
            if (!batchIds.add(item.id())) {
                throw new IllegalArgumentException("Duplicate item id in batch: " + item.id());
            }
        }
        ensureCapacity(items.size() + batch.size());

        List<ItemVector> vectors = new ArrayList<>(batch.size());
        for (VectorItem item : batch) {
            int index = items.size();
            items.add(item);
            idToIndex.put(item.id(), index);
            vectors.add(new ItemVector(item.id(), item.vector(), index));
        }

        try {
            graph.addAll(vectors);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Interrupted while adding items to HNSW graph", e);
        }
        log.debug("Batch added {} items", vectors.size());
    }

    // ==================== Search ====================

    /**
     * Searches using a pre-computed query vector.
     *
     * @return results sorted by similarity (descending)
     */
    public List<SearchResult> search(float[] queryVector, int topK) {
        if (items.isEmpty()) {
            return List.of();
        }
        if (queryVector.length != dimension) {
            throw new IllegalArgumentException(String.format(
                "Query dimension mismatch: expected %d, got %d", dimension, queryVector.length));
        }

        // HNSW reports cosine distance; similarity is 1 - distance
        return graph.findNearest(queryVector, topK).stream()
            .map(r -> new SearchResult(items.get(r.item().itemIndex()), 1.0f - r.distance()))
            .sorted()
            .collect(Collectors.toList());
    }

    // ==================== Access ====================

    public List<VectorItem> items() {
        return Collections.unmodifiableList(items);
    }

    public Optional<VectorItem> get(String id) {
        Integer index = idToIndex.get(id);
        return index == null ? Optional.empty() : Optional.of(items.get(index));
    }

    public List<String> ids() {
        return items.stream().map(VectorItem::id).collect(Collectors.toList());
    }

    public String modelId() {
        return modelId;
    }

    public int dimension() {
        return dimension;
    }

    public int size() {
        return items.size();
    }

    // ==================== Persistence ====================

    /**
     * Writes the collection into {@code dir}. Each file is written to a temporary name and
     * moved into place; the header goes last so a torn write never looks complete.
     */
    public void save(Path dir) throws IOException {
        Files.createDirectories(dir);

        writeAtomically(dir.resolve(ITEMS_FILE), os -> {
            List<ItemDocument> documents = items.stream()
                .map(i -> new ItemDocument(i.id(), i.document(), i.metadata()))
                .collect(Collectors.toList());
            Json.mapper().writeValue(os, documents);
        });

        writeAtomically(dir.resolve(VECTORS_FILE), os -> {
            DataOutputStream dos = new DataOutputStream(new BufferedOutputStream(os));
            for (VectorItem item : items) {
                for (float v : item.vector()) {
                    dos.writeFloat(v);
                }
            }
            dos.flush();
        });

        writeAtomically(dir.resolve(GRAPH_FILE), os -> graph.save(os));

        Path headerTmp = dir.resolve(HEADER_FILE + ".tmp");
        CollectionHeader.of(modelId, dimension, items.size()).write(headerTmp);
        Files.move(headerTmp, dir.resolve(HEADER_FILE), StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);

        log.debug("Saved collection to {}: {} items", dir, items.size());
    }

    /**
     * Loads a collection from {@code dir}.
     *
     * @throws IOException if any required file is missing, truncated or unreadable
     */
    public static HnswCollection load(Path dir) throws IOException {
        CollectionHeader header = CollectionHeader.read(dir.resolve(HEADER_FILE));
        int dimension = header.dimension();
        int count = header.itemCount();

        Path vectorsFile = dir.resolve(VECTORS_FILE);
        long expectedBytes = (long) count * dimension * Float.BYTES;
        long actualBytes = Files.size(vectorsFile);
        if (actualBytes != expectedBytes) {
            throw new IOException(String.format(
                "Vector file %s has %d bytes, header promises %d", vectorsFile, actualBytes, expectedBytes));
        }

        List<ItemDocument> documents;
        try (InputStream is = Files.newInputStream(dir.resolve(ITEMS_FILE))) {
            documents = Json.mapper().readValue(is, new TypeReference<List<ItemDocument>>() {});
        }
        if (documents.size() != count) {
            throw new IOException(String.format(
                "Item file in %s lists %d items, header promises %d", dir, documents.size(), count));
        }

        HnswCollection collection = new HnswCollection(header.modelId(), dimension);
        try (InputStream is = Files.newInputStream(vectorsFile)) {
            DataInputStream dis = new DataInputStream(new BufferedInputStream(is));
            for (ItemDocument doc : documents) {
                float[] vector = new float[dimension];
                for (int j = 0; j < dimension; j++) {
                    vector[j] = dis.readFloat();
                }
                int index = collection.items.size();
                collection.items.add(new VectorItem(doc.id(), vector, doc.document(), doc.metadata()));
                collection.idToIndex.put(doc.id(), index);
            }
        }

        if (!collection.loadGraph(dir.resolve(GRAPH_FILE))) {
            collection.rebuildGraph(Math.max(count * 2, MIN_CAPACITY));
        }
        log.debug("Loaded collection from {}: {} items", dir, collection.size());
        return collection;
    }

    // ==================== Helpers ====================

    private void checkItem(VectorItem item) {
        if (item.vector().length != dimension) {
            throw new IllegalArgumentException(String.format(
                "Embedding dimension mismatch for '%s': expected %d, got %d",
                item.id(), dimension, item.vector().length
            ));
        }
        if (idToIndex.containsKey(item.id())) {
            throw new IllegalArgumentException("Duplicate item id: " + item.id());
        }
    }

    private boolean loadGraph(Path graphFile) {
        if (!Files.exists(graphFile)) {
            log.warn("HNSW graph missing in {}; rebuilding from vectors", graphFile.getParent());
            return false;
        }
        try (InputStream is = Files.newInputStream(graphFile)) {
            HnswIndex<String, float[], ItemVector, Float> loaded = HnswIndex.load(is);
            if (loaded.size() != items.size()) {
                log.warn("HNSW graph in {} holds {} items, expected {}; rebuilding",
                    graphFile.getParent(), loaded.size(), items.size());
                return false;
            }
            graph = loaded;
            return true;
        } catch (IOException | RuntimeException e) {
            log.warn("Unreadable HNSW graph in {} ({}); rebuilding from vectors", graphFile.getParent(), e.toString());
            return false;
        }
    }

    private void ensureCapacity(int needed) {
        if (needed > graph.getMaxItemCount()) {
            int newCapacity = Math.max(needed * 2, MIN_CAPACITY);
            log.info("Growing HNSW graph capacity to {} items", newCapacity);
            rebuildGraph(newCapacity);
        }
    }

    private void rebuildGraph(int capacity) {
        HnswIndex<String, float[], ItemVector, Float> rebuilt = newGraph(capacity);
        List<ItemVector> vectors = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) {
            vectors.add(new ItemVector(items.get(i).id(), items.get(i).vector(), i));
        }
        try {
            rebuilt.addAll(vectors);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Interrupted while rebuilding HNSW graph", e);
        }
        graph = rebuilt;
    }

    private HnswIndex<String, float[], ItemVector, Float> newGraph(int capacity) {
        return HnswIndex.newBuilder(dimension, DistanceFunctions.FLOAT_COSINE_DISTANCE, capacity)
            .withM(DEFAULT_M)
            .withEfConstruction(DEFAULT_EF_CONSTRUCTION)
            .withEf(DEFAULT_EF)
            .build();
    }

    private static void writeAtomically(Path target, StreamWriter writer) throws IOException {
        Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
        try (OutputStream os = Files.newOutputStream(tmp)) {
            writer.write(os);
        }
        Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    @FunctionalInterface
    private interface StreamWriter {
        void write(OutputStream os) throws IOException;
    }

    /**
     * Serialized form of an item in {@code items.json}; vectors live in {@code vectors.bin}.
     */
    public record ItemDocument(String id, String document, Map<String, String> metadata) {}

    // ==================== HNSW Item Implementation ====================

    /**
     * Item wrapper for the HNSW graph.
     */
    private static class ItemVector implements Item<String, float[]>, Serializable {
        private static final long serialVersionUID = 1L;

        private final String id;
        private final float[] vector;
        private final int itemIndex;

        ItemVector(String id, float[] vector, int itemIndex) {
            this.id = id;
            this.vector = vector;
            this.itemIndex = itemIndex;
        }

        @Override
        public String id() {
            return id;
        }

        @Override
        public float[] vector() {
            return vector;
        }

        @Override
        public int dimensions() {
            return vector.length;
        }

        int itemIndex() {
            return itemIndex;
        }
    }
}
