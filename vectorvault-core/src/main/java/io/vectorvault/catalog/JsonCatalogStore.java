package io.vectorvault.catalog;

import io.vectorvault.Json;
import io.vectorvault.StorageUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.*;

/**
 * {@link CatalogStore} persisted as a single JSON document ({@code catalog.json}).
 *
 * <p>The file is re-read on every call so edits made by other tools are seen immediately.
 * Writes go to a temporary file that is forced to disk and then atomically renamed over
 * the catalog.</p>
 */
public class JsonCatalogStore implements CatalogStore {

    private static final Logger log = LoggerFactory.getLogger(JsonCatalogStore.class);

    public static final String FILE_NAME = "catalog.json";

    private final Path file;
    private final String initialSchemaVersion;

    /**
     * @param file catalog file
     * @param initialSchemaVersion version stamped into a catalog created by this store
     */
    public JsonCatalogStore(Path file, String initialSchemaVersion) {
        this.file = file;
        this.initialSchemaVersion = initialSchemaVersion;
    }

    public static JsonCatalogStore inDataRoot(Path dataRoot, String schemaVersion) {
        return new JsonCatalogStore(dataRoot.resolve(FILE_NAME), schemaVersion);
    }

    public Path file() {
        return file;
    }

    // ==================== Reads ====================

    @Override
    public synchronized Optional<CollectionRecord> get(String collectionId) {
        return Optional.ofNullable(read().collections().get(collectionId));
    }

    @Override
    public synchronized List<CollectionRecord> list() {
        return List.copyOf(read().collections().values());
    }

    @Override
    public synchronized Optional<String> schemaVersion() {
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        return Optional.ofNullable(read().schemaVersion());
    }

    // ==================== Writes ====================

    @Override
    public synchronized void put(CollectionRecord record) {
        CatalogDocument doc = read();
        doc.collections().put(record.collectionId(), record);
        write(doc);
        log.debug("Catalog put: {} ('{}')", record.collectionId(), record.displayName());
    }

    @Override
    public synchronized boolean remove(String collectionId) {
        CatalogDocument doc = read();
        if (doc.collections().remove(collectionId) == null) {
            return false;
        }
        write(doc);
        log.debug("Catalog remove: {}", collectionId);
        return true;
    }

    @Override
    public synchronized void setSchemaVersion(String version) {
        CatalogDocument doc = read();
        write(new CatalogDocument(version, doc.collections()));
    }

    // ==================== Helpers ====================

    private CatalogDocument read() {
        if (!Files.exists(file)) {
            return new CatalogDocument(initialSchemaVersion, new TreeMap<>());
        }
        try {
            return Json.mapper().readValue(file.toFile(), CatalogDocument.class);
        } catch (IOException e) {
            throw new StorageUnavailableException("Cannot read catalog " + file, e);
        }
    }

    private void write(CatalogDocument doc) {
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            Files.createDirectories(file.toAbsolutePath().getParent());
            byte[] bytes = Json.mapper().writeValueAsBytes(doc);
            try (FileChannel ch = FileChannel.open(tmp,
                    StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
                ByteBuffer buffer = ByteBuffer.wrap(bytes);
                while (buffer.hasRemaining()) {
                    ch.write(buffer);
                }
                ch.force(true);
            }
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new StorageUnavailableException("Cannot write catalog " + file, e);
        }
    }

    /**
     * Persisted form of the catalog.
     */
    public record CatalogDocument(String schemaVersion, Map<String, CollectionRecord> collections) {
        public CatalogDocument {
            collections = collections != null ? new TreeMap<>(collections) : new TreeMap<>();
        }
    }
}
