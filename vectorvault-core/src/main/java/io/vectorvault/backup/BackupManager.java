package io.vectorvault.backup;

import io.vectorvault.Directories;
import io.vectorvault.Json;
import io.vectorvault.KeyedLocks;
import io.vectorvault.NotFoundException;
import io.vectorvault.StorageUnavailableException;
import io.vectorvault.catalog.CatalogStore;
import io.vectorvault.catalog.CollectionRecord;
import io.vectorvault.store.PhysicalLayout;
import io.vectorvault.store.VectorStoreAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.*;

/**
 * Point-in-time archives of collections: catalog records plus a copy of the physical
 * directories.
 *
 * <p>Archive layout under the backup root:</p>
 * <pre>
 * &lt;archiveId&gt;/manifest.json
 * &lt;archiveId&gt;/catalog/&lt;collectionId&gt;.json
 * &lt;archiveId&gt;/collections/&lt;collectionId&gt;/...
 * </pre>
 *
 * <p>An archive is assembled in a hidden staging directory and renamed into place once its
 * manifest is written, so {@link #list()} never sees a half-written archive. Checkpoints
 * and restores touching the same collection are serialized; the locks are released when
 * the call returns.</p>
 */
public class BackupManager {

    private static final Logger log = LoggerFactory.getLogger(BackupManager.class);

    static final String MANIFEST_FILE = "manifest.json";
    static final String CATALOG_DIR = "catalog";
    static final String COLLECTIONS_DIR = "collections";
    static final String PARTIAL_SUFFIX = ".partial";

    private static final DateTimeFormatter ID_FORMAT =
        DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSS").withZone(ZoneOffset.UTC);

    private final Path backupRoot;
    private final CatalogStore catalog;
    private final VectorStoreAdapter vectorStore;
    private final String schemaVersion;
    private final Clock clock;
    private final KeyedLocks locks;

    public BackupManager(Path backupRoot, CatalogStore catalog, VectorStoreAdapter vectorStore,
                         String schemaVersion, Clock clock) {
        this(backupRoot, catalog, vectorStore, schemaVersion, clock, new KeyedLocks());
    }

    /**
     * @param locks per-id locks shared with the callers that mutate the same collections
     */
    public BackupManager(Path backupRoot, CatalogStore catalog, VectorStoreAdapter vectorStore,
                         String schemaVersion, Clock clock, KeyedLocks locks) {
        this.locks = locks;
        this.backupRoot = backupRoot;
        this.catalog = catalog;
        this.vectorStore = vectorStore;
        this.schemaVersion = schemaVersion;
        this.clock = clock;
    }

    // ==================== Create ====================

    /**
     * Archives the given collections.
     */
    public BackupArchive checkpoint(Collection<String> collectionIds) {
        return checkpoint(collectionIds, null);
    }

    /**
     * Archives the given collections. Ids without a record or physical collection are
     * recorded as absent, so restoring the archive removes them again.
     *
     * @param label free text stored in the manifest
     * @throws StorageUnavailableException if the archive cannot be written; nothing is left behind
     */
    public BackupArchive checkpoint(Collection<String> collectionIds, String label) {
        if (collectionIds.isEmpty()) {
            throw new IllegalArgumentException("checkpoint needs at least one collection id");
        }
        try (KeyedLocks.Handle ignored = locks.lockAll(collectionIds)) {
            return write(BackupType.SINGLE_COLLECTION, new TreeSet<>(collectionIds), label);
        }
    }

    /**
     * Archives every collection known to the catalog or present on disk.
     */
    public BackupArchive fullBackup(String label) {
        Set<String> ids = knownIds();
        try (KeyedLocks.Handle ignored = locks.lockAll(ids)) {
            return write(BackupType.FULL, ids, label);
        }
    }

    /**
     * Ids present in the catalog or on disk.
     */
    public Set<String> knownIds() {
        Set<String> ids = new TreeSet<>(vectorStore.listCollections());
        catalog.list().forEach(r -> ids.add(r.collectionId()));
        return ids;
    }

    private BackupArchive write(BackupType type, Set<String> ids, String label) {
        Instant now = clock.instant();
        String archiveId = newArchiveId(type, now);
        Path staging = backupRoot.resolve("." + archiveId + PARTIAL_SUFFIX);
        Path target = backupRoot.resolve(archiveId);

        try {
            Files.createDirectories(staging.resolve(CATALOG_DIR));
            Files.createDirectories(staging.resolve(COLLECTIONS_DIR));

            List<ArchiveEntry> entries = new ArrayList<>();
            for (String id : ids) {
                Optional<CollectionRecord> record = catalog.get(id);
                if (record.isPresent()) {
                    Json.mapper().writeValue(staging.resolve(CATALOG_DIR).resolve(id + ".json").toFile(), record.get());
                }
                boolean physical = vectorStore.exists(id);
                if (physical) {
                    Directories.copyRecursively(vectorStore.directoryOf(id), staging.resolve(COLLECTIONS_DIR).resolve(id));
                }
                entries.add(new ArchiveEntry(id, record.isPresent(), physical));
            }

            ArchiveManifest manifest = new ArchiveManifest(
                ArchiveManifest.CURRENT_VERSION, archiveId, type, now, schemaVersion,
                List.copyOf(ids), entries, label);
            Json.mapper().writeValue(staging.resolve(MANIFEST_FILE).toFile(), manifest);

            Files.move(staging, target, StandardCopyOption.ATOMIC_MOVE);
            BackupArchive archive = toArchive(target, manifest);
            log.info("Created {} archive {} covering {} ({} bytes)", type, archiveId, ids, archive.sizeBytes());
            return archive;
        } catch (IOException e) {
            discard(staging);
            throw new StorageUnavailableException("Cannot write archive " + archiveId,
                ids.size() == 1 ? ids.iterator().next() : null, e);
        }
    }

    // ==================== Restore ====================

    public void restore(String backupId) {
        restore(find(backupId));
    }

    /**
     * Puts every collection covered by the archive back into its archived state, whatever
     * the current state is: archived records and directories overwrite current ones, and
     * ids that were absent at archive time are removed.
     *
     * @throws StorageUnavailableException if the archive cannot be read or a write fails
     */
    public void restore(BackupArchive archive) {
        ArchiveManifest manifest = readManifest(archive.path());
        Set<String> ids = new TreeSet<>(manifest.sourceIds());
        try (KeyedLocks.Handle ignored = locks.lockAll(ids)) {
            for (ArchiveEntry entry : manifest.entries()) {
                restoreEntry(archive.path(), entry);
            }
        }
        log.info("Restored archive {} ({})", manifest.archiveId(), ids);
    }

    private void restoreEntry(Path archiveDir, ArchiveEntry entry) {
        String id = entry.collectionId();
        Path current = vectorStore.directoryOf(id);
        try {
            if (entry.hadPhysical()) {
                Path staged = current.resolveSibling("." + id + PhysicalLayout.RESTORING_SUFFIX);
                Directories.deleteRecursively(staged);
                Directories.copyRecursively(archiveDir.resolve(COLLECTIONS_DIR).resolve(id), staged);
                Directories.deleteRecursively(current);
                Files.move(staged, current, StandardCopyOption.ATOMIC_MOVE);
            } else {
                Directories.deleteRecursively(current);
            }

            if (entry.hadRecord()) {
                CollectionRecord record = Json.mapper().readValue(
                    archiveDir.resolve(CATALOG_DIR).resolve(id + ".json").toFile(), CollectionRecord.class);
                catalog.put(record);
            } else {
                catalog.remove(id);
            }
            log.debug("Restored {} (record={}, physical={})", id, entry.hadRecord(), entry.hadPhysical());
        } catch (IOException e) {
            throw new StorageUnavailableException("Cannot restore " + id + " from " + archiveDir, id, e);
        }
    }

    // ==================== List / Cleanup ====================

    /**
     * Lists complete archives, newest first. Archives whose manifest cannot be read are
     * skipped with a warning.
     */
    public List<BackupArchive> list() {
        if (!Files.isDirectory(backupRoot)) {
            return List.of();
        }
        List<BackupArchive> archives = new ArrayList<>();
        try (DirectoryStream<Path> dirs = Files.newDirectoryStream(backupRoot)) {
            for (Path dir : dirs) {
                if (!Files.isDirectory(dir) || dir.getFileName().toString().startsWith(".")) {
                    continue;
                }
                try {
                    archives.add(toArchive(dir, readManifest(dir)));
                } catch (StorageUnavailableException | IOException e) {
                    log.warn("Skipping unreadable archive {}: {}", dir.getFileName(), e.getMessage());
                }
            }
        } catch (IOException e) {
            throw new StorageUnavailableException("Cannot list backups in " + backupRoot, e);
        }
        archives.sort(Comparator.comparing(BackupArchive::createdAt).reversed()
            .thenComparing(BackupArchive::backupId, Comparator.reverseOrder()));
        return archives;
    }

    public BackupArchive find(String backupId) {
        return list().stream()
            .filter(a -> a.backupId().equals(backupId))
            .findFirst()
            .orElseThrow(() -> new NotFoundException("Backup archive", backupId));
    }

    /**
     * Deletes archives that are neither among the {@code retentionCount} newest nor younger
     * than {@code retentionDays}.
     *
     * @return the archives deleted
     */
    public List<BackupArchive> cleanup(RetentionPolicy policy) {
        Instant cutoff = clock.instant().minus(Duration.ofDays(policy.retentionDays()));
        List<BackupArchive> archives = list();
        List<BackupArchive> deleted = new ArrayList<>();

        for (int i = 0; i < archives.size(); i++) {
            BackupArchive archive = archives.get(i);
            boolean newest = i < policy.retentionCount();
            boolean young = archive.createdAt().isAfter(cutoff);
            if (newest || young) {
                continue;
            }
            try {
                Directories.deleteRecursively(archive.path());
                deleted.add(archive);
                log.info("Deleted archive {} (created {})", archive.backupId(), archive.createdAt());
            } catch (IOException e) {
                log.error("Cannot delete archive {}: {}", archive.backupId(), e.getMessage());
            }
        }
        return deleted;
    }

    public boolean delete(String backupId) {
        BackupArchive archive = find(backupId);
        try {
            Directories.deleteRecursively(archive.path());
        } catch (IOException e) {
            throw new StorageUnavailableException("Cannot delete archive " + backupId, e);
        }
        log.info("Deleted archive {}", backupId);
        return true;
    }

    // ==================== Helpers ====================

    /**
     * Reads a manifest, upgrading version 1 manifests (no per-id entries) by looking at
     * what the archive actually contains.
     */
    ArchiveManifest readManifest(Path archiveDir) {
        ArchiveManifest manifest;
        try {
            manifest = Json.mapper().readValue(archiveDir.resolve(MANIFEST_FILE).toFile(), ArchiveManifest.class);
        } catch (IOException e) {
            throw new StorageUnavailableException("Cannot read manifest of " + archiveDir, e);
        }
        if (manifest.manifestVersion() > ArchiveManifest.CURRENT_VERSION) {
            throw new StorageUnavailableException(String.format(
                "Archive %s has manifest version %d, newer than supported %d",
                archiveDir.getFileName(), manifest.manifestVersion(), ArchiveManifest.CURRENT_VERSION), null);
        }
        if (manifest.entries().isEmpty() && !manifest.sourceIds().isEmpty()) {
            List<ArchiveEntry> inferred = new ArrayList<>();
            for (String id : manifest.sourceIds()) {
                inferred.add(new ArchiveEntry(id,
                    Files.exists(archiveDir.resolve(CATALOG_DIR).resolve(id + ".json")),
                    Files.isDirectory(archiveDir.resolve(COLLECTIONS_DIR).resolve(id))));
            }
            manifest = new ArchiveManifest(manifest.manifestVersion(), manifest.archiveId(), manifest.type(),
                manifest.createdAt(), manifest.schemaVersion(), manifest.sourceIds(), inferred, manifest.label());
        }
        return manifest;
    }

    private BackupArchive toArchive(Path dir, ArchiveManifest manifest) throws IOException {
        String archiveId = manifest.archiveId() != null ? manifest.archiveId() : dir.getFileName().toString();
        String source = manifest.sourceIds().size() == 1 ? manifest.sourceIds().get(0) : null;
        Instant createdAt = manifest.createdAt() != null
            ? manifest.createdAt()
            : Files.getLastModifiedTime(dir.resolve(MANIFEST_FILE)).toInstant();
        return new BackupArchive(archiveId, manifest.type(), dir, Directories.sizeOf(dir),
            createdAt, source, manifest.sourceIds(), manifest.schemaVersion(), manifest.label());
    }

    private String newArchiveId(BackupType type, Instant now) {
        String prefix = type == BackupType.FULL ? "full" : "checkpoint";
        String suffix = UUID.randomUUID().toString().substring(0, 8);
        return prefix + "_" + ID_FORMAT.format(now) + "_" + suffix;
    }

    private void discard(Path staging) {
        try {
            Directories.deleteRecursively(staging);
        } catch (IOException e) {
            log.warn("Cannot remove staging directory {}: {}", staging, e.getMessage());
        }
    }

    /**
     * Deletes staging directories of archives whose write never finished.
     *
     * @return the directories removed
     * @throws StorageUnavailableException if the backup root cannot be listed
     */
    public List<Path> removeAbandonedStaging() {
        List<Path> removed = new ArrayList<>();
        if (!Files.isDirectory(backupRoot)) {
            return removed;
        }
        try (DirectoryStream<Path> dirs = Files.newDirectoryStream(backupRoot, "*" + PARTIAL_SUFFIX)) {
            for (Path dir : dirs) {
                if (!dir.getFileName().toString().startsWith(".")) {
                    continue;
                }
                Directories.deleteRecursively(dir);
                removed.add(dir);
                log.warn("Removed unfinished archive {}", dir.getFileName());
            }
        } catch (IOException e) {
            throw new StorageUnavailableException("Cannot clean staging directories in " + backupRoot, e);
        }
        return removed;
    }

    public Path backupRoot() {
        return backupRoot;
    }
}
