package io.vectorvault.store;

import io.vectorvault.AlreadyExistsException;
import io.vectorvault.Directories;
import io.vectorvault.NotFoundException;
import io.vectorvault.StorageUnavailableException;
import io.vectorvault.catalog.CollectionIds;
import io.vectorvault.engine.CollectionHeader;
import io.vectorvault.engine.HnswCollection;
import io.vectorvault.engine.SearchResult;
import io.vectorvault.engine.VectorItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.*;

/**
 * {@link VectorStoreAdapter} over {@link HnswCollection} directories, one per collection id,
 * directly under the data root.
 */
public class HnswVectorStoreAdapter implements VectorStoreAdapter {

    private static final Logger log = LoggerFactory.getLogger(HnswVectorStoreAdapter.class);

    private final Path dataRoot;

    public HnswVectorStoreAdapter(Path dataRoot) {
        this.dataRoot = dataRoot;
    }

    // ==================== Lifecycle ====================

    @Override
    public void create(String collectionId, String modelId, int dimension) {
        CollectionIds.requireValid(collectionId);
        Path dir = directoryOf(collectionId);
        if (Files.exists(dir)) {
            throw new AlreadyExistsException("Physical collection", collectionId);
        }
        try {
            new HnswCollection(modelId, dimension).save(dir);
        } catch (IOException e) {
            throw new StorageUnavailableException("Cannot create physical collection " + dir, collectionId, e);
        }
        log.info("Created physical collection {} (dimension={})", collectionId, dimension);
    }

    /**
     * Renames the directory out of sight first, so a crash during the recursive delete leaves
     * a hidden leftover rather than a half-deleted collection.
     */
    @Override
    public void drop(String collectionId) {
        Path dir = directoryOf(collectionId);
        if (!Files.isDirectory(dir)) {
            throw new NotFoundException("Physical collection", collectionId);
        }
        Path tombstone = dataRoot.resolve("." + collectionId + PhysicalLayout.DROPPING_SUFFIX);
        try {
            Directories.deleteRecursively(tombstone);
            Files.move(dir, tombstone, StandardCopyOption.ATOMIC_MOVE);
            Directories.deleteRecursively(tombstone);
        } catch (IOException e) {
            throw new StorageUnavailableException("Cannot drop physical collection " + dir, collectionId, e);
        }
        log.info("Dropped physical collection {}", collectionId);
    }

    @Override
    public boolean exists(String collectionId) {
        return CollectionIds.isValid(collectionId) && PhysicalLayout.isCollectionDirectory(directoryOf(collectionId));
    }

    @Override
    public List<Path> removeLeftovers() {
        List<Path> removed = new ArrayList<>();
        if (!Files.isDirectory(dataRoot)) {
            return removed;
        }
        try (DirectoryStream<Path> dirs = Files.newDirectoryStream(dataRoot, PhysicalLayout::isLeftover)) {
            for (Path dir : dirs) {
                Directories.deleteRecursively(dir);
                removed.add(dir);
                log.warn("Removed leftover directory {}", dir.getFileName());
            }
        } catch (IOException e) {
            throw new StorageUnavailableException("Cannot clean leftover directories in " + dataRoot, e);
        }
        return removed;
    }

    // ==================== Reads ====================

    @Override
    public long count(String collectionId) {
        requireExists(collectionId);
        try {
            return CollectionHeader.read(directoryOf(collectionId).resolve(HnswCollection.HEADER_FILE)).itemCount();
        } catch (IOException | RuntimeException e) {
            throw new StorageUnavailableException("Cannot read header of " + collectionId, collectionId, e);
        }
    }

    @Override
    public List<String> listIds(String collectionId) {
        return load(collectionId).ids();
    }

    @Override
    public Set<String> listCollections() {
        if (!Files.isDirectory(dataRoot)) {
            throw new StorageUnavailableException("Data root is not available: " + dataRoot, null);
        }
        Set<String> ids = new TreeSet<>();
        try (DirectoryStream<Path> dirs = Files.newDirectoryStream(dataRoot)) {
            for (Path dir : dirs) {
                if (PhysicalLayout.isCollectionDirectory(dir)) {
                    ids.add(dir.getFileName().toString());
                }
            }
        } catch (IOException e) {
            throw new StorageUnavailableException("Cannot list data root " + dataRoot, e);
        }
        return ids;
    }

    @Override
    public List<VectorItem> readItems(String collectionId) {
        return List.copyOf(load(collectionId).items());
    }

    /**
     * Reads {@code vectors.bin} directly instead of loading the collection, which would cut
     * every vector to the header's dimension. The row length is the file size divided by the
     * header's item count; a file that does not split into whole rows reports 0. Sampled rows
     * holding a non-finite value also report 0.
     */
    @Override
    public Set<Integer> sampleDimensions(String collectionId, int sampleSize) {
        requireExists(collectionId);
        Path dir = directoryOf(collectionId);
        Set<Integer> observed = new TreeSet<>();
        try {
            int count = CollectionHeader.read(dir.resolve(HnswCollection.HEADER_FILE)).itemCount();
            Path vectorsFile = dir.resolve(HnswCollection.VECTORS_FILE);
            long bytes = Files.size(vectorsFile);
            if (count == 0 || sampleSize <= 0) {
                return observed;
            }
            long rowBytes = (long) count * Float.BYTES;
            if (bytes % rowBytes != 0) {
                observed.add(0);
                return observed;
            }
            int rowLength = (int) (bytes / rowBytes);
            observed.add(rowLength);

            int step = Math.max(1, count / sampleSize);
            try (FileChannel channel = FileChannel.open(vectorsFile, StandardOpenOption.READ)) {
                ByteBuffer row = ByteBuffer.allocate(rowLength * Float.BYTES);
                for (int i = 0, taken = 0; i < count && taken < sampleSize; i += step, taken++) {
                    if (!finiteRow(channel, row, (long) i * row.capacity())) {
                        observed.add(0);
                    }
                }
                if (!finiteRow(channel, row, (long) (count - 1) * row.capacity())) {
                    observed.add(0);
                }
            }
        } catch (IOException | RuntimeException e) {
            throw new StorageUnavailableException("Cannot sample vectors of " + collectionId, collectionId, e);
        }
        return observed;
    }

    private static boolean finiteRow(FileChannel channel, ByteBuffer row, long offset) throws IOException {
        row.clear();
        while (row.hasRemaining()) {
            if (channel.read(row, offset + row.position()) < 0) {
                return false;
            }
        }
        row.flip();
        while (row.hasRemaining()) {
            if (!Float.isFinite(row.getFloat())) {
                return false;
            }
        }
        return true;
    }

    @Override
    public List<SearchResult> search(String collectionId, float[] queryVector, int topK) {
        return load(collectionId).search(queryVector, topK);
    }

    @Override
    public Path directoryOf(String collectionId) {
        return dataRoot.resolve(collectionId);
    }

    // ==================== Writes ====================

    @Override
    public void addItems(String collectionId, List<VectorItem> items) {
        HnswCollection collection = load(collectionId);
        collection.addAll(items);
        try {
            collection.save(directoryOf(collectionId));
        } catch (IOException e) {
            throw new StorageUnavailableException("Cannot write items to " + collectionId, collectionId, e);
        }
        log.info("Added {} items to {} (now {})", items.size(), collectionId, collection.size());
    }

    // ==================== Helpers ====================

    private HnswCollection load(String collectionId) {
        requireExists(collectionId);
        try {
            return HnswCollection.load(directoryOf(collectionId));
        } catch (IOException | RuntimeException e) {
            throw new StorageUnavailableException("Cannot load physical collection " + collectionId, collectionId, e);
        }
    }

    private void requireExists(String collectionId) {
        if (!exists(collectionId)) {
            throw new NotFoundException("Physical collection", collectionId);
        }
    }
}
