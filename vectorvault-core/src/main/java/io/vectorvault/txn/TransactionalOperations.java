package io.vectorvault.txn;

import io.vectorvault.AlreadyExistsException;
import io.vectorvault.IntegrityException;
import io.vectorvault.InvalidRequestException;
import io.vectorvault.KeyedLocks;
import io.vectorvault.NotFoundException;
import io.vectorvault.UnrecoverableStateException;
import io.vectorvault.VaultException;
import io.vectorvault.backup.BackupArchive;
import io.vectorvault.backup.BackupManager;
import io.vectorvault.catalog.CatalogStore;
import io.vectorvault.catalog.CollectionIds;
import io.vectorvault.catalog.CollectionRecord;
import io.vectorvault.catalog.EmbeddingDescriptor;
import io.vectorvault.config.ConfigContext;
import io.vectorvault.consistency.ConsistencyChecker;
import io.vectorvault.consistency.ConsistencyIssue;
import io.vectorvault.consistency.ConsistencyReport;
import io.vectorvault.engine.VectorItem;
import io.vectorvault.store.FilesystemInspector;
import io.vectorvault.store.PhysicalCollectionInfo;
import io.vectorvault.store.VectorStoreAdapter;
import io.vectorvault.sync.SyncEventKind;
import io.vectorvault.sync.SyncEventQueue;
import io.vectorvault.version.SchemaVersionChecker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Runs mutating collection operations so that they either commit completely or leave the
 * catalog and the physical store exactly as they were.
 *
 * <p>Every operation locks the ids it touches, archives them, mutates, then re-checks the
 * affected ids. Any failure after the archive was taken restores it before the result is
 * returned. If that restore fails the ids are quarantined: further operations on them are
 * refused until {@link #releaseQuarantine(String)} is called.</p>
 *
 * <p>Operations never retry. Each call returns one {@link OperationResult}.</p>
 */
public class TransactionalOperations {

    private static final Logger log = LoggerFactory.getLogger(TransactionalOperations.class);

    private final CatalogStore catalog;
    private final VectorStoreAdapter vectorStore;
    private final FilesystemInspector inspector;
    private final BackupManager backups;
    private final ConsistencyChecker checker;
    private final SchemaVersionChecker versionChecker;
    private final SyncEventQueue syncQueue;
    private final ConfigContext config;
    private final Clock clock;

    private final KeyedLocks locks;
    private final Set<String> quarantined = ConcurrentHashMap.newKeySet();
    private volatile PhaseHook hook = PhaseHook.NONE;

    public TransactionalOperations(CatalogStore catalog, VectorStoreAdapter vectorStore,
                                   FilesystemInspector inspector, BackupManager backups,
                                   ConsistencyChecker checker, SchemaVersionChecker versionChecker,
                                   SyncEventQueue syncQueue, ConfigContext config, Clock clock,
                                   KeyedLocks locks) {
        this.locks = locks;
        this.catalog = catalog;
        this.vectorStore = vectorStore;
        this.inspector = inspector;
        this.backups = backups;
        this.checker = checker;
        this.versionChecker = versionChecker;
        this.syncQueue = syncQueue;
        this.config = config;
        this.clock = clock;
    }

    public void setPhaseHook(PhaseHook hook) {
        this.hook = hook != null ? hook : PhaseHook.NONE;
    }

    // ==================== Operations ====================

    /**
     * Creates an empty collection under a fresh id.
     */
    public OperationResult create(String displayName, EmbeddingDescriptor embedding) {
        String id = CollectionIds.newId();
        if (displayName == null) {
            return rejected(OperationKind.CREATE, id, "displayName cannot be null");
        }
        if (embedding == null || !embedding.dimensionKnown()) {
            return rejected(OperationKind.CREATE, id, "A new collection needs a known dimension");
        }

        return run(OperationKind.CREATE, List.of(id), id, new Action() {
            @Override
            public void precheck() {
                requireNameFree(displayName);
            }

            @Override
            public void execute() {
                vectorStore.create(id, embedding.modelName(), embedding.dimension());
                step(OperationKind.CREATE, "physical-created");
                catalog.put(CollectionRecord.create(id, displayName, embedding, clock.instant()));
                step(OperationKind.CREATE, "record-written");
            }

            @Override
            public List<String> postconditions() {
                List<String> problems = new ArrayList<>();
                if (!vectorStore.exists(id)) problems.add("physical collection missing");
                if (!catalog.contains(id)) problems.add("catalog record missing");
                return problems;
            }

            @Override
            public void commit() {
                syncQueue.append(SyncEventKind.CREATED, id, Map.of("displayName", displayName));
            }
        });
    }

    /**
     * Deletes a collection. The physical collection goes first, so a crash part way through
     * leaves at worst an orphaned catalog entry.
     */
    public OperationResult delete(String collectionId) {
        if (!CollectionIds.isValid(collectionId)) {
            return rejected(OperationKind.DELETE, collectionId, "Invalid collection id: '" + collectionId + "'");
        }

        return run(OperationKind.DELETE, List.of(collectionId), collectionId, new Action() {
            @Override
            public void precheck() {
                if (!catalog.contains(collectionId) && !vectorStore.exists(collectionId)) {
                    throw new NotFoundException("Collection", collectionId);
                }
            }

            @Override
            public void execute() {
                if (vectorStore.exists(collectionId)) {
                    vectorStore.drop(collectionId);
                }
                step(OperationKind.DELETE, "physical-dropped");
                catalog.remove(collectionId);
                step(OperationKind.DELETE, "record-removed");
            }

            @Override
            public List<String> postconditions() {
                List<String> problems = new ArrayList<>();
                if (vectorStore.exists(collectionId)) problems.add("physical collection still present");
                if (catalog.contains(collectionId)) problems.add("catalog record still present");
                return problems;
            }

            @Override
            public void commit() {
                syncQueue.append(SyncEventKind.DELETED, collectionId, Map.of());
            }
        });
    }

    /**
     * Renames a collection by copying it under a fresh id and then removing the old one.
     * The old collection is not touched until the copy and its record exist.
     *
     * @return a result whose {@code collectionId} is the new id
     */
    public OperationResult rename(String collectionId, String newDisplayName) {
        if (!CollectionIds.isValid(collectionId)) {
            return rejected(OperationKind.RENAME, collectionId, "Invalid collection id: '" + collectionId + "'");
        }
        if (newDisplayName == null) {
            return rejected(OperationKind.RENAME, collectionId, "newDisplayName cannot be null");
        }
        String newId = CollectionIds.newId();

        return run(OperationKind.RENAME, List.of(collectionId, newId), newId, new Action() {
            private CollectionRecord old;
            private PhysicalCollectionInfo physical;
            private long expectedCount;

            @Override
            public void precheck() {
                old = catalog.get(collectionId).orElseThrow(() -> new NotFoundException("Collection", collectionId));
                physical = inspector.inspect(collectionId)
                    .orElseThrow(() -> new NotFoundException("Physical collection", collectionId));
                if (!physical.headerReadable()) {
                    throw new IntegrityException(collectionId, List.of(physical.problem()));
                }
                if (!old.displayName().equals(newDisplayName)) {
                    requireNameFree(newDisplayName);
                }
            }

            @Override
            public void execute() {
                List<VectorItem> items = vectorStore.readItems(collectionId);
                expectedCount = items.size();

                vectorStore.create(newId, old.embedding().modelName(), physical.dimension());
                if (!items.isEmpty()) {
                    vectorStore.addItems(newId, items);
                }
                step(OperationKind.RENAME, "copied");
                catalog.put(old.rekeyed(newId, newDisplayName, clock.instant()).withItemCount(items.size(), clock.instant()));
                step(OperationKind.RENAME, "record-written");

                vectorStore.drop(collectionId);
                step(OperationKind.RENAME, "old-physical-dropped");
                catalog.remove(collectionId);
                step(OperationKind.RENAME, "old-record-removed");
            }

            @Override
            public List<String> postconditions() {
                List<String> problems = new ArrayList<>();
                if (vectorStore.exists(collectionId)) problems.add("old physical collection still present");
                if (catalog.contains(collectionId)) problems.add("old catalog record still present");
                if (!vectorStore.exists(newId)) {
                    problems.add("new physical collection missing");
                } else if (vectorStore.count(newId) != expectedCount) {
                    problems.add(String.format("new collection holds %d items, expected %d",
                        vectorStore.count(newId), expectedCount));
                }
                if (!catalog.contains(newId)) problems.add("new catalog record missing");
                return problems;
            }

            @Override
            public void commit() {
                syncQueue.append(SyncEventKind.RENAMED, newId,
                    Map.of("previousId", collectionId, "displayName", newDisplayName));
            }
        });
    }

    // ==================== Locks / Quarantine ====================

    /**
     * Whether an operation currently holds the lock for {@code collectionId}. Issues reported
     * for a locked id may be transient.
     */
    public boolean isLocked(String collectionId) {
        return locks.isLocked(collectionId);
    }

    /**
     * Locks {@code collectionId} for a caller that mutates it outside of this class.
     */
    public KeyedLocks.Handle lock(String collectionId) {
        return locks.lock(collectionId);
    }

    public KeyedLocks.Handle lockAll(Collection<String> collectionIds) {
        return locks.lockAll(collectionIds);
    }

    public KeyedLocks locks() {
        return locks;
    }

    public boolean isQuarantined(String collectionId) {
        return quarantined.contains(collectionId);
    }

    public Set<String> quarantined() {
        return Set.copyOf(quarantined);
    }

    /**
     * Lifts the quarantine placed on an id after a failed rollback. The caller is expected to
     * have repaired the id by hand.
     *
     * @return true if the id was quarantined
     */
    public boolean releaseQuarantine(String collectionId) {
        boolean released = quarantined.remove(collectionId);
        if (released) {
            log.warn("Quarantine released for {}", collectionId);
        }
        return released;
    }

    // ==================== State machine ====================

    private interface Action {
        /** Validates preconditions; runs under the lock before the checkpoint */
        void precheck();

        void execute();

        /** Operation-specific checks run after the consistency check */
        List<String> postconditions();

        /** Runs under the lock once verification passed */
        void commit();
    }

    private OperationResult run(OperationKind kind, List<String> ids, String resultId, Action action) {
        String operationId = UUID.randomUUID().toString();
        OperationPhase phase = OperationPhase.PENDING;
        Checkpoint checkpoint = null;

        try (KeyedLocks.Handle ignored = locks.lockAll(ids)) {
            try {
                requireNotQuarantined(ids);
                versionChecker.requireMutable();
                hook.on(kind, phase, PhaseHook.ENTER);
                action.precheck();

                BackupArchive archive = backups.checkpoint(ids, kind + " " + operationId);
                checkpoint = new Checkpoint(operationId, ids, archive.backupId(), archive.createdAt());
                phase = OperationPhase.CHECKPOINTED;
                hook.on(kind, phase, PhaseHook.ENTER);

                phase = OperationPhase.EXECUTING;
                hook.on(kind, phase, PhaseHook.ENTER);
                action.execute();

                phase = OperationPhase.VERIFYING;
                hook.on(kind, phase, PhaseHook.ENTER);
                verify(ids, action);

                action.commit();
                log.info("{} {} committed (ids={}, checkpoint={})", kind, operationId, ids, checkpoint.backupId());
            } catch (RuntimeException e) {
                VaultException error = e instanceof VaultException
                    ? (VaultException) e
                    : new VaultException(kind + " failed: " + e.getMessage(), ids.get(0), e);
                if (checkpoint == null) {
                    error.annotate(phase, RollbackOutcome.NONE);
                    log.warn("{} {} aborted in {} before any change: {}", kind, operationId, phase, error.getMessage());
                } else {
                    error = rollback(kind, operationId, ids, checkpoint, phase, error);
                }
                OperationPhase terminal = phase == OperationPhase.VERIFYING
                    && error instanceof IntegrityException
                    && error.getRollbackOutcome() == RollbackOutcome.RESTORED
                    ? OperationPhase.ROLLED_BACK
                    : OperationPhase.FAILED;
                return OperationResult.failed(operationId, kind, ids, resultId,
                    checkpoint != null ? checkpoint.backupId() : null, terminal, error);
            }
        }

        discardCheckpoint(checkpoint);
        return OperationResult.committed(operationId, kind, ids, resultId, checkpoint.backupId());
    }

    /**
     * Result for a call refused before any lock was taken.
     */
    private OperationResult rejected(OperationKind kind, String collectionId, String message) {
        VaultException error = new InvalidRequestException(message, collectionId);
        error.annotate(OperationPhase.PENDING, RollbackOutcome.NONE);
        log.warn("{} rejected: {}", kind, message);
        List<String> ids = collectionId != null ? List.of(collectionId) : List.of();
        return OperationResult.failed(UUID.randomUUID().toString(), kind, ids, collectionId, null,
            OperationPhase.FAILED, error);
    }

    private void verify(List<String> ids, Action action) {
        ConsistencyReport report = checker.check(ids, true);
        List<String> problems = new ArrayList<>();
        if (report.error() != null) {
            problems.add("consistency check failed: " + report.error());
        }
        report.issues().stream().map(ConsistencyIssue::describe).forEach(problems::add);
        problems.addAll(action.postconditions());
        if (!problems.isEmpty()) {
            throw new IntegrityException(String.join(",", ids), problems);
        }
    }

    /**
     * Restores the checkpoint and records the phase reached and the outcome on the failure.
     *
     * @return the failure to report: {@code error}, or an {@link UnrecoverableStateException}
     *         wrapping it when the restore itself failed
     */
    private VaultException rollback(OperationKind kind, String operationId, List<String> ids,
                          Checkpoint checkpoint, OperationPhase reached, VaultException error) {
        try {
            backups.restore(checkpoint.backupId());
            error.annotate(reached, RollbackOutcome.RESTORED);
            log.warn("{} {} failed in {}; restored checkpoint {}: {}",
                kind, operationId, reached, checkpoint.backupId(), error.getMessage());
            return error;
        } catch (RuntimeException restoreFailure) {
            quarantined.addAll(ids);
            UnrecoverableStateException fatal = new UnrecoverableStateException(
                "Rollback from " + checkpoint.backupId() + " failed after: " + error.getMessage(),
                ids.get(0), restoreFailure);
            fatal.addSuppressed(error);
            fatal.annotate(reached, RollbackOutcome.FAILED);
            log.error("{} {} failed in {} and rollback from {} failed; quarantined {}",
                kind, operationId, reached, checkpoint.backupId(), ids, restoreFailure);
            return fatal;
        }
    }

    private void discardCheckpoint(Checkpoint checkpoint) {
        if (config.current().keepCheckpointOnCommit()) {
            return;
        }
        try {
            backups.delete(checkpoint.backupId());
        } catch (VaultException e) {
            log.warn("Cannot discard checkpoint {}: {}", checkpoint.backupId(), e.getMessage());
        }
    }

    private void requireNotQuarantined(List<String> ids) {
        List<String> blocked = ids.stream().filter(quarantined::contains).collect(Collectors.toList());
        if (!blocked.isEmpty()) {
            throw new UnrecoverableStateException(
                "Collection is quarantined after a failed rollback: " + blocked, blocked.get(0), null);
        }
    }

    private void requireNameFree(String displayName) {
        catalog.findByDisplayName(displayName).ifPresent(existing -> {
            throw new AlreadyExistsException("Collection named '" + displayName + "'", existing.collectionId());
        });
    }

    private void step(OperationKind kind, String step) {
        hook.on(kind, OperationPhase.EXECUTING, step);
    }
}
