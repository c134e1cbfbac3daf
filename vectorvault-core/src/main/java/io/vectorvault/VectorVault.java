package io.vectorvault;

import io.vectorvault.backup.BackupArchive;
import io.vectorvault.backup.BackupManager;
import io.vectorvault.backup.RetentionPolicy;
import io.vectorvault.catalog.CatalogStore;
import io.vectorvault.catalog.CollectionRecord;
import io.vectorvault.catalog.EmbeddingDescriptor;
import io.vectorvault.catalog.JsonCatalogStore;
import io.vectorvault.config.ConfigContext;
import io.vectorvault.config.VaultConfig;
import io.vectorvault.consistency.ConsistencyChecker;
import io.vectorvault.consistency.ConsistencyIssue;
import io.vectorvault.consistency.ConsistencyReport;
import io.vectorvault.engine.SearchResult;
import io.vectorvault.engine.VectorItem;
import io.vectorvault.recovery.ProposedCollectionRecord;
import io.vectorvault.recovery.RecoveryCandidate;
import io.vectorvault.recovery.RecoveryResult;
import io.vectorvault.recovery.RecoveryService;
import io.vectorvault.store.FilesystemInspector;
import io.vectorvault.store.HnswVectorStoreAdapter;
import io.vectorvault.store.VectorStoreAdapter;
import io.vectorvault.sync.SyncEvent;
import io.vectorvault.sync.SyncEventQueue;
import io.vectorvault.sync.SyncStatus;
import io.vectorvault.txn.OperationResult;
import io.vectorvault.txn.TransactionalOperations;
import io.vectorvault.version.CompatibilityReport;
import io.vectorvault.version.MigrationResult;
import io.vectorvault.version.SchemaMigrator;
import io.vectorvault.version.SchemaVersion;
import io.vectorvault.version.SchemaVersionChecker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.function.BooleanSupplier;
import java.util.stream.Collectors;

/**
 * Entry point for a vault: one data root holding the catalog and the physical collections,
 * plus a backup root.
 *
 * <p>Mutating collection operations go through {@link TransactionalOperations} and return an
 * {@link OperationResult}. Reads never take locks.</p>
 *
 * <pre>{@code
 * VectorVault vault = VectorVault.initialize(ConfigContext.of(VaultConfig.builder().dataRoot(root).build()));
 * String id = vault.create("docs", OllamaEmbedding.of("nomic-embed-text", 768)).orElseThrow();
 * vault.addItems(id, items);
 * }</pre>
 */
public class VectorVault {

    private static final Logger log = LoggerFactory.getLogger(VectorVault.class);

    private final ConfigContext config;
    private final Clock clock;
    private final CatalogStore catalog;
    private final VectorStoreAdapter vectorStore;
    private final FilesystemInspector inspector;
    private final ConsistencyChecker checker;
    private final BackupManager backups;
    private final SchemaVersionChecker versionChecker;
    private final SchemaMigrator migrator;
    private final SyncEventQueue syncQueue;
    private final TransactionalOperations operations;
    private final RecoveryService recovery;
    private final List<Path> removedOnOpen = new ArrayList<>();

    private VectorVault(ConfigContext config, Clock clock) {
        VaultConfig cfg = config.current();
        Path dataRoot = cfg.dataRoot();
        String running = SchemaVersion.CURRENT.toString();

        this.config = config;
        this.clock = clock;
        this.catalog = JsonCatalogStore.inDataRoot(dataRoot, running);
        this.vectorStore = new HnswVectorStoreAdapter(dataRoot);
        this.inspector = new FilesystemInspector(dataRoot);
        this.checker = new ConsistencyChecker(catalog, inspector, vectorStore, cfg.dimensionSampleSize(), clock);
        KeyedLocks locks = new KeyedLocks();
        this.backups = new BackupManager(cfg.backupRoot(), catalog, vectorStore, running, clock, locks);
        this.versionChecker = new SchemaVersionChecker(dataRoot, catalog, SchemaVersion.CURRENT, config);
        this.migrator = new SchemaMigrator(versionChecker, backups, catalog, clock);
        this.syncQueue = new SyncEventQueue(cfg.syncQueueCapacity(), clock);
        this.operations = new TransactionalOperations(catalog, vectorStore, inspector, backups, checker,
            versionChecker, syncQueue, config, clock, locks);
        this.recovery = new RecoveryService(checker, inspector, vectorStore, catalog, operations,
            versionChecker, backups, syncQueue, config, clock);
    }

    /**
     * Opens an existing data root.
     *
     * @throws StorageUnavailableException if the data root does not exist
     */
    public static VectorVault open(ConfigContext config) {
        return open(config, Clock.systemUTC());
    }

    public static VectorVault open(ConfigContext config, Clock clock) {
        Path dataRoot = config.current().dataRoot();
        if (!Files.isDirectory(dataRoot)) {
            throw new StorageUnavailableException("Data root is not available: " + dataRoot, null);
        }
        VectorVault vault = new VectorVault(config, clock);
        vault.removeLeftovers();
        log.info("Opened vault at {} (backups in {})", dataRoot, config.current().backupRoot());
        return vault;
    }

    /**
     * Deletes what an interrupted drop, restore or archive write left behind. Such
     * directories are hidden from scans, so nothing else ever removes them.
     */
    private void removeLeftovers() {
        removedOnOpen.addAll(vectorStore.removeLeftovers());
        removedOnOpen.addAll(backups.removeAbandonedStaging());
        if (!removedOnOpen.isEmpty()) {
            log.warn("Removed {} leftover directories on open: {}", removedOnOpen.size(), removedOnOpen);
        }
    }

    /**
     * Creates the data and backup roots if needed, then opens the vault.
     */
    public static VectorVault initialize(ConfigContext config) {
        return initialize(config, Clock.systemUTC());
    }

    public static VectorVault initialize(ConfigContext config, Clock clock) {
        VaultConfig cfg = config.current();
        try {
            Files.createDirectories(cfg.dataRoot());
            Files.createDirectories(cfg.backupRoot());
        } catch (IOException e) {
            throw new StorageUnavailableException("Cannot create vault directories under " + cfg.dataRoot(), e);
        }
        return open(config, clock);
    }

    // ==================== Collections ====================

    public OperationResult create(String displayName, EmbeddingDescriptor embedding) {
        return operations.create(displayName, embedding);
    }

    public OperationResult delete(String collectionId) {
        return operations.delete(collectionId);
    }

    public OperationResult rename(String collectionId, String newDisplayName) {
        return operations.rename(collectionId, newDisplayName);
    }

    /**
     * Appends items to a collection and refreshes the cached item count. The physical write
     * happens first; the record is updated after it.
     */
    public void addItems(String collectionId, List<VectorItem> items) {
        versionChecker.requireMutable();
        if (operations.isQuarantined(collectionId)) {
            throw new UnrecoverableStateException("Collection is quarantined after a failed rollback", collectionId, null);
        }
        try (KeyedLocks.Handle ignored = operations.lock(collectionId)) {
            CollectionRecord record = get(collectionId);
            vectorStore.addItems(collectionId, items);
            catalog.put(record.withItemCount(vectorStore.count(collectionId), clock.instant()));
        }
    }

    public List<SearchResult> search(String collectionId, float[] queryVector, int topK) {
        get(collectionId);
        return vectorStore.search(collectionId, queryVector, topK);
    }

    public List<VectorItem> items(String collectionId) {
        get(collectionId);
        return vectorStore.readItems(collectionId);
    }

    public CollectionRecord get(String collectionId) {
        return catalog.get(collectionId).orElseThrow(() -> new NotFoundException("Collection", collectionId));
    }

    public List<CollectionRecord> list() {
        return catalog.list();
    }

    /**
     * Looks a collection up by id, falling back to its display name.
     */
    public CollectionRecord resolve(String idOrName) {
        Optional<CollectionRecord> byId = catalog.get(idOrName);
        if (byId.isPresent()) {
            return byId.get();
        }
        return catalog.findByDisplayName(idOrName)
            .orElseThrow(() -> new NotFoundException("Collection", idOrName));
    }

    // ==================== Consistency ====================

    public ConsistencyReport check(boolean full) {
        return checker.check(full);
    }

    public ConsistencyReport check(Collection<String> collectionIds, boolean full) {
        return checker.check(collectionIds, full);
    }

    /**
     * Issues that are not explained by an operation currently in flight on the same id.
     */
    public List<ConsistencyIssue> actionableIssues(ConsistencyReport report) {
        return report.issues().stream()
            .filter(issue -> !operations.isLocked(issue.collectionId()))
            .collect(Collectors.toList());
    }

    // ==================== Backups ====================

    /**
     * Archives the given collections. Waits for operations in flight on any of them, since
     * the backup manager and the operations share one set of per-id locks.
     */
    public BackupArchive checkpoint(Collection<String> collectionIds) {
        return backups.checkpoint(collectionIds);
    }

    public BackupArchive fullBackup(String label) {
        return backups.fullBackup(label);
    }

    /**
     * Restores an archive while holding the operation locks of every id it covers.
     */
    public void restore(String backupId) {
        versionChecker.requireMutable();
        BackupArchive archive = backups.find(backupId);
        try (KeyedLocks.Handle ignored = operations.lockAll(archive.sourceIds())) {
            backups.restore(archive);
        }
    }

    public List<BackupArchive> listBackups() {
        return backups.list();
    }

    /**
     * Applies the configured retention policy.
     */
    public List<BackupArchive> cleanupBackups() {
        VaultConfig cfg = config.current();
        return backups.cleanup(new RetentionPolicy(cfg.retentionCount(), cfg.retentionDays()));
    }

    public List<BackupArchive> cleanupBackups(RetentionPolicy policy) {
        return backups.cleanup(policy);
    }

    // ==================== Recovery ====================

    public List<RecoveryCandidate> scanRecovery() {
        return recovery.scan();
    }

    public List<ProposedCollectionRecord> planRecovery(List<RecoveryCandidate> candidates) {
        return recovery.plan(candidates);
    }

    public RecoveryResult executeRecovery(List<ProposedCollectionRecord> plan, BooleanSupplier cancelled) {
        return recovery.execute(plan, cancelled);
    }

    public List<String> pruneOrphanedCatalogEntries() {
        return recovery.pruneOrphanedCatalogEntries();
    }

    // ==================== Version ====================

    public CompatibilityReport compatibility() {
        return versionChecker.check();
    }

    public MigrationResult migrate() {
        try (KeyedLocks.Handle ignored = operations.lockAll(backups.knownIds())) {
            return migrator.migrate();
        }
    }

    // ==================== Sync ====================

    public List<SyncEvent> drainEvents() {
        return syncQueue.drain();
    }

    public SyncStatus syncStatus() {
        return syncQueue.status();
    }

    public SyncEventQueue syncQueue() {
        return syncQueue;
    }

    // ==================== Accessors ====================

    public TransactionalOperations operations() {
        return operations;
    }

    public boolean releaseQuarantine(String collectionId) {
        return operations.releaseQuarantine(collectionId);
    }

    /**
     * Leftover directories deleted when the vault was opened.
     */
    public List<Path> removedOnOpen() {
        return List.copyOf(removedOnOpen);
    }

    public ConfigContext config() {
        return config;
    }

    public VectorStoreAdapter vectorStore() {
        return vectorStore;
    }

    public CatalogStore catalog() {
        return catalog;
    }

    public BackupManager backups() {
        return backups;
    }
}
