package io.vectorvault.store;

import io.vectorvault.Directories;
import io.vectorvault.StorageUnavailableException;
import io.vectorvault.engine.CollectionHeader;
import io.vectorvault.engine.HnswCollection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Scans the data root for physical collection directories, independently of the catalog.
 *
 * <p>Sizes and counts come from directory statistics and the collection header only; the
 * vectors are never loaded, so the counts are estimates.</p>
 */
public class FilesystemInspector {

    private static final Logger log = LoggerFactory.getLogger(FilesystemInspector.class);

    private final Path dataRoot;

    public FilesystemInspector(Path dataRoot) {
        this.dataRoot = dataRoot;
    }

    /**
     * Lists every physical collection directory, ordered by collection id.
     *
     * @throws StorageUnavailableException if the data root is missing or cannot be listed; a
     *         missing root is never reported as "no collections"
     */
    public List<PhysicalCollectionInfo> scan() {
        if (!Files.isDirectory(dataRoot)) {
            throw new StorageUnavailableException("Data root is not available: " + dataRoot, null);
        }
        List<PhysicalCollectionInfo> found = new ArrayList<>();
        try (DirectoryStream<Path> dirs = Files.newDirectoryStream(dataRoot)) {
            for (Path dir : dirs) {
                if (PhysicalLayout.isCollectionDirectory(dir)) {
                    found.add(describe(dir));
                }
            }
        } catch (IOException e) {
            throw new StorageUnavailableException("Cannot scan data root " + dataRoot, e);
        }
        found.sort(Comparator.comparing(PhysicalCollectionInfo::collectionId));
        log.debug("Scanned {}: {} physical collections", dataRoot, found.size());
        return found;
    }

    /**
     * Describes a single collection directory, if it exists.
     */
    public Optional<PhysicalCollectionInfo> inspect(String collectionId) {
        Path dir = dataRoot.resolve(collectionId);
        if (!PhysicalLayout.isCollectionDirectory(dir)) {
            return Optional.empty();
        }
        try {
            return Optional.of(describe(dir));
        } catch (IOException e) {
            throw new StorageUnavailableException("Cannot inspect " + dir, collectionId, e);
        }
    }

    private PhysicalCollectionInfo describe(Path dir) throws IOException {
        String id = dir.getFileName().toString();
        long size = Directories.sizeOf(dir);

        if (!PhysicalLayout.isComplete(dir)) {
            return new PhysicalCollectionInfo(id, dir, size, 0, 0, false, "header or vector file missing");
        }

        CollectionHeader header;
        try {
            header = CollectionHeader.read(dir.resolve(HnswCollection.HEADER_FILE));
        } catch (IOException | RuntimeException e) {
            return new PhysicalCollectionInfo(id, dir, size, 0, 0, false, "unreadable header: " + e.getMessage());
        }

        long vectorBytes = Files.size(dir.resolve(HnswCollection.VECTORS_FILE));
        long estimatedCount = vectorBytes / ((long) header.dimension() * Float.BYTES);
        return new PhysicalCollectionInfo(id, dir, size, estimatedCount, header.dimension(), true, null);
    }
}
