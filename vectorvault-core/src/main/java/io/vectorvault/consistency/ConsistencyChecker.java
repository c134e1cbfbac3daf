package io.vectorvault.consistency;

import io.vectorvault.VaultException;
import io.vectorvault.catalog.CatalogStore;
import io.vectorvault.catalog.CollectionRecord;
import io.vectorvault.store.FilesystemInspector;
import io.vectorvault.store.PhysicalCollectionInfo;
import io.vectorvault.store.VectorStoreAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.time.Clock;
import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Joins the catalog against the physical collections found on disk.
 *
 * <ul>
 *   <li>catalog only: {@link OrphanedCatalogEntry}</li>
 *   <li>filesystem only: {@link OrphanedVector}, sized from directory statistics</li>
 *   <li>both, full check only: {@link DimensionMismatch} when sampled vectors disagree with the
 *       catalog dimension</li>
 * </ul>
 *
 * <p>Checks are read-only and take no locks. A check that overlaps a running mutation may
 * report a transient issue for the id being mutated.</p>
 */
public class ConsistencyChecker {

    private static final Logger log = LoggerFactory.getLogger(ConsistencyChecker.class);

    private final CatalogStore catalog;
    private final FilesystemInspector inspector;
    private final VectorStoreAdapter vectorStore;
    private final int sampleSize;
    private final Clock clock;

    public ConsistencyChecker(CatalogStore catalog, FilesystemInspector inspector,
                              VectorStoreAdapter vectorStore, int sampleSize, Clock clock) {
        this.catalog = catalog;
        this.inspector = inspector;
        this.vectorStore = vectorStore;
        this.sampleSize = sampleSize;
        this.clock = clock;
    }

    /**
     * Checks every collection known to either side.
     *
     * @param full also sample vector dimensions of collections present on both sides
     */
    public ConsistencyReport check(boolean full) {
        try {
            Map<String, CollectionRecord> records = catalog.list().stream()
                .collect(Collectors.toMap(CollectionRecord::collectionId, Function.identity()));
            Map<String, PhysicalCollectionInfo> physical = inspector.scan().stream()
                .collect(Collectors.toMap(PhysicalCollectionInfo::collectionId, Function.identity()));

            Set<String> ids = new TreeSet<>(records.keySet());
            ids.addAll(physical.keySet());
            return join(ids, records::get, physical::get, full);
        } catch (VaultException | UncheckedIOException e) {
            log.error("Consistency check failed: {}", e.getMessage());
            return ConsistencyReport.failed(e.getMessage(), clock.instant());
        }
    }

    /**
     * Checks only the given collection ids.
     */
    public ConsistencyReport check(Collection<String> scope, boolean full) {
        try {
            Map<String, CollectionRecord> records = new HashMap<>();
            Map<String, PhysicalCollectionInfo> physical = new HashMap<>();
            for (String id : scope) {
                catalog.get(id).ifPresent(r -> records.put(id, r));
                inspector.inspect(id).ifPresent(p -> physical.put(id, p));
            }
            return join(new TreeSet<>(scope), records::get, physical::get, full);
        } catch (VaultException | UncheckedIOException e) {
            log.error("Scoped consistency check of {} failed: {}", scope, e.getMessage());
            return ConsistencyReport.failed(e.getMessage(), clock.instant());
        }
    }

    private ConsistencyReport join(Set<String> ids,
                                   Function<String, CollectionRecord> records,
                                   Function<String, PhysicalCollectionInfo> physical,
                                   boolean full) {
        List<ConsistencyIssue> issues = new ArrayList<>();
        for (String id : ids) {
            CollectionRecord record = records.apply(id);
            PhysicalCollectionInfo info = physical.apply(id);

            if (record != null && info == null) {
                issues.add(new OrphanedCatalogEntry(id));
            } else if (record == null && info != null) {
                issues.add(new OrphanedVector(id, info.directory(), info.sizeBytes(), info.estimatedCount()));
            } else if (record != null && full) {
                checkDimension(record, info).ifPresent(issues::add);
            }
        }

        ConsistencyReport report = ConsistencyReport.of(issues, clock.instant());
        if (report.isConsistent()) {
            log.debug("Consistency check over {} ids: consistent", ids.size());
        } else {
            log.info("Consistency check over {} ids: {} issues", ids.size(), issues.size());
        }
        return report;
    }

    private Optional<ConsistencyIssue> checkDimension(CollectionRecord record, PhysicalCollectionInfo info) {
        int expected = record.embedding().dimension();
        if (expected <= 0) {
            return Optional.empty();
        }
        if (!info.headerReadable()) {
            return Optional.of(new DimensionMismatch(record.collectionId(), expected, 0));
        }
        if (info.dimension() != expected) {
            return Optional.of(new DimensionMismatch(record.collectionId(), expected, info.dimension()));
        }
        try {
            for (int observed : vectorStore.sampleDimensions(record.collectionId(), sampleSize)) {
                if (observed != expected) {
                    return Optional.of(new DimensionMismatch(record.collectionId(), expected, observed));
                }
            }
        } catch (VaultException e) {
            log.warn("Cannot sample vectors of {}: {}", record.collectionId(), e.getMessage());
            return Optional.of(new DimensionMismatch(record.collectionId(), expected, 0));
        }
        return Optional.empty();
    }
}
