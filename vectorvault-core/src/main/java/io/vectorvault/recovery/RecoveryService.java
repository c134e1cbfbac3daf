package io.vectorvault.recovery;

import io.vectorvault.KeyedLocks;
import io.vectorvault.StorageUnavailableException;
import io.vectorvault.VaultException;
import io.vectorvault.backup.BackupManager;
import io.vectorvault.catalog.CatalogStore;
import io.vectorvault.catalog.CollectionRecord;
import io.vectorvault.config.ConfigContext;
import io.vectorvault.consistency.ConsistencyChecker;
import io.vectorvault.consistency.ConsistencyReport;
import io.vectorvault.consistency.OrphanedCatalogEntry;
import io.vectorvault.consistency.OrphanedVector;
import io.vectorvault.store.FilesystemInspector;
import io.vectorvault.store.PhysicalCollectionInfo;
import io.vectorvault.store.VectorStoreAdapter;
import io.vectorvault.sync.SyncEventKind;
import io.vectorvault.sync.SyncEventQueue;
import io.vectorvault.txn.TransactionalOperations;
import io.vectorvault.version.SchemaVersionChecker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.*;
import java.util.function.BooleanSupplier;
import java.util.stream.Collectors;

/**
 * Rebuilds catalog records for orphaned physical collections.
 *
 * <p>Recovery is scan, plan, execute. Execution writes one record at a time; each write is
 * gated on a fresh look at the directory, and a failed record does not undo the others.</p>
 */
public class RecoveryService {

    private static final Logger log = LoggerFactory.getLogger(RecoveryService.class);

    private static final Comparator<RecoveryCandidate> LARGEST_FIRST =
        Comparator.comparingLong(RecoveryCandidate::estimatedSizeBytes).reversed()
            .thenComparing(RecoveryCandidate::collectionId);

    private final ConsistencyChecker checker;
    private final FilesystemInspector inspector;
    private final VectorStoreAdapter vectorStore;
    private final CatalogStore catalog;
    private final TransactionalOperations operations;
    private final SchemaVersionChecker versionChecker;
    private final BackupManager backups;
    private final SyncEventQueue syncQueue;
    private final ConfigContext config;
    private final Clock clock;

    public RecoveryService(ConsistencyChecker checker, FilesystemInspector inspector,
                           VectorStoreAdapter vectorStore, CatalogStore catalog,
                           TransactionalOperations operations, SchemaVersionChecker versionChecker,
                           BackupManager backups, SyncEventQueue syncQueue,
                           ConfigContext config, Clock clock) {
        this.checker = checker;
        this.inspector = inspector;
        this.vectorStore = vectorStore;
        this.catalog = catalog;
        this.operations = operations;
        this.versionChecker = versionChecker;
        this.backups = backups;
        this.syncQueue = syncQueue;
        this.config = config;
        this.clock = clock;
    }

    // ==================== Scan / Plan ====================

    /**
     * Finds orphaned physical collections and decides for each whether it can be recovered.
     *
     * @return candidates, largest first
     * @throws StorageUnavailableException if the data root cannot be scanned
     */
    public List<RecoveryCandidate> scan() {
        ConsistencyReport report = requireScan(checker.check(false));

        List<RecoveryCandidate> candidates = new ArrayList<>();
        for (OrphanedVector orphan : report.issuesOfType(OrphanedVector.class)) {
            candidates.add(assess(orphan));
        }
        candidates.sort(LARGEST_FIRST);

        long recoverable = candidates.stream().filter(RecoveryCandidate::recoverable).count();
        log.info("Recovery scan: {} orphaned directories, {} recoverable", candidates.size(), recoverable);
        return candidates;
    }

    private RecoveryCandidate assess(OrphanedVector orphan) {
        String id = orphan.collectionId();
        Optional<PhysicalCollectionInfo> info = inspector.inspect(id);
        if (info.isEmpty()) {
            return RecoveryCandidate.unrecoverable(id, orphan.directory(), orphan.estimatedSizeBytes(),
                orphan.estimatedCount(), 0, "directory disappeared");
        }
        PhysicalCollectionInfo physical = info.get();
        if (!physical.headerReadable() || !physical.dimensionKnown()) {
            return RecoveryCandidate.unrecoverable(id, physical.directory(), physical.sizeBytes(),
                physical.estimatedCount(), physical.dimension(), physical.problem());
        }
        try {
            vectorStore.listIds(id);
        } catch (VaultException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            return RecoveryCandidate.unrecoverable(id, physical.directory(), physical.sizeBytes(),
                physical.estimatedCount(), physical.dimension(), "items not readable: " + cause.getMessage());
        }
        return RecoveryCandidate.recoverable(id, physical.directory(), physical.sizeBytes(),
            physical.estimatedCount(), physical.dimension());
    }

    /**
     * Proposes a record for every recoverable candidate, largest first. Unrecoverable
     * candidates are left out. A candidate whose short placeholder name is shared with
     * another candidate or already used in the catalog is named after its full id.
     */
    public List<ProposedCollectionRecord> plan(List<RecoveryCandidate> candidates) {
        List<RecoveryCandidate> recoverable = candidates.stream()
            .filter(RecoveryCandidate::recoverable)
            .sorted(LARGEST_FIRST)
            .collect(Collectors.toList());
        Map<String, Long> shortNames = recoverable.stream()
            .collect(Collectors.groupingBy(c -> ProposedCollectionRecord.shortName(c.collectionId()), Collectors.counting()));
        return recoverable.stream()
            .map(c -> {
                String name = ProposedCollectionRecord.shortName(c.collectionId());
                boolean unique = shortNames.get(name) == 1 && catalog.findByDisplayName(name).isEmpty();
                return ProposedCollectionRecord.from(c, unique);
            })
            .collect(Collectors.toList());
    }

    // ==================== Execute ====================

    public RecoveryResult execute(List<ProposedCollectionRecord> plan) {
        return execute(plan, () -> false);
    }

    /**
     * Writes the planned records one at a time, checking {@code cancelled} before each.
     *
     * @throws io.vectorvault.IncompatibleVersionException if the data root schema blocks writes
     */
    public RecoveryResult execute(List<ProposedCollectionRecord> plan, BooleanSupplier cancelled) {
        versionChecker.requireMutable();

        List<String> succeeded = new ArrayList<>();
        List<RecoveryResult.Failure> failed = new ArrayList<>();
        List<String> notAttempted = new ArrayList<>();

        for (int i = 0; i < plan.size(); i++) {
            ProposedCollectionRecord proposed = plan.get(i);
            if (cancelled.getAsBoolean()) {
                plan.subList(i, plan.size()).forEach(p -> notAttempted.add(p.collectionId()));
                log.info("Recovery cancelled; {} records not attempted", notAttempted.size());
                break;
            }
            try {
                recoverOne(proposed);
                succeeded.add(proposed.collectionId());
            } catch (VaultException | IllegalStateException e) {
                failed.add(new RecoveryResult.Failure(proposed.collectionId(), e.getMessage()));
                log.warn("Cannot recover {}: {}", proposed.collectionId(), e.getMessage());
            }
        }

        log.info("Recovery finished: {} succeeded, {} failed, {} cancelled",
            succeeded.size(), failed.size(), notAttempted.size());
        return new RecoveryResult(succeeded, failed, notAttempted);
    }

    private void recoverOne(ProposedCollectionRecord proposed) {
        String id = proposed.collectionId();
        if (operations.isQuarantined(id)) {
            throw new IllegalStateException("collection is quarantined");
        }
        try (KeyedLocks.Handle ignored = operations.lock(id)) {
            if (catalog.contains(id)) {
                throw new IllegalStateException("catalog already has a record for this id");
            }
            PhysicalCollectionInfo physical = inspector.inspect(id)
                .orElseThrow(() -> new IllegalStateException("directory no longer exists"));
            if (!physical.headerReadable()) {
                throw new IllegalStateException("directory no longer intact: " + physical.problem());
            }
            if (proposed.dimension() > 0 && physical.dimension() != proposed.dimension()) {
                throw new IllegalStateException(String.format(
                    "dimension changed from %d to %d since planning", proposed.dimension(), physical.dimension()));
            }

            Instant now = clock.instant();
            CollectionRecord record = named(proposed).toRecord(vectorStore.count(id), now);
            catalog.put(record);
            syncQueue.append(SyncEventKind.RECOVERED, id, Map.of("displayName", record.displayName()));
            log.info("Recovered {} as '{}' ({} items, dimension {})",
                id, record.displayName(), record.itemCount(), physical.dimension());
        }
    }

    /**
     * Keeps the planned name if it is still free, otherwise falls back to the full-id name.
     */
    private ProposedCollectionRecord named(ProposedCollectionRecord proposed) {
        if (catalog.findByDisplayName(proposed.displayName()).isEmpty()) {
            return proposed;
        }
        String fallback = ProposedCollectionRecord.longName(proposed.collectionId());
        if (catalog.findByDisplayName(fallback).isPresent()) {
            throw new IllegalStateException("display names '" + proposed.displayName()
                + "' and '" + fallback + "' are both taken");
        }
        log.info("Display name '{}' is taken; recovering {} as '{}'", proposed.displayName(),
            proposed.collectionId(), fallback);
        return proposed.withDisplayName(fallback);
    }

    // ==================== Orphaned catalog entries ====================

    /**
     * Removes catalog records whose physical collection is missing. Refused unless
     * {@code allowOrphanedCatalogCleanup} is set: an unmounted data root looks exactly like a
     * set of deleted directories. A checkpoint of the affected records is taken first.
     *
     * @return ids whose records were removed
     * @throws IllegalStateException if the policy flag is not set
     */
    public List<String> pruneOrphanedCatalogEntries() {
        if (!config.current().allowOrphanedCatalogCleanup()) {
            throw new IllegalStateException("Orphaned catalog cleanup is disabled (allowOrphanedCatalogCleanup=false)");
        }
        versionChecker.requireMutable();

        ConsistencyReport report = requireScan(checker.check(false));
        List<String> candidates = report.issuesOfType(OrphanedCatalogEntry.class).stream()
            .map(OrphanedCatalogEntry::collectionId)
            .filter(id -> {
                boolean busy = operations.isLocked(id) || operations.isQuarantined(id);
                if (busy) {
                    log.info("Skipping orphaned catalog entry {}: operation in flight or quarantined", id);
                }
                return !busy;
            })
            .collect(Collectors.toList());
        if (candidates.isEmpty()) {
            return List.of();
        }

        backups.checkpoint(candidates, "prune orphaned catalog entries");
        List<String> removed = new ArrayList<>();
        for (String id : candidates) {
            try (KeyedLocks.Handle ignored = operations.lock(id)) {
                if (vectorStore.exists(id) || !catalog.remove(id)) {
                    continue;
                }
                removed.add(id);
                syncQueue.append(SyncEventKind.DELETED, id, Map.of("reason", "orphaned_catalog_entry"));
                log.info("Removed orphaned catalog entry {}", id);
            }
        }
        return removed;
    }

    private static ConsistencyReport requireScan(ConsistencyReport report) {
        if (report.error() != null) {
            throw new StorageUnavailableException("Consistency scan failed: " + report.error(), null);
        }
        return report;
    }
}
