package io.vectorvault.version;

import io.vectorvault.IncompatibleVersionException;
import io.vectorvault.backup.BackupArchive;
import io.vectorvault.backup.BackupManager;
import io.vectorvault.catalog.CatalogStore;
import io.vectorvault.catalog.CollectionRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.*;

/**
 * Brings a data root up to the running schema version.
 *
 * <p>A full backup is taken before the first step runs. Steps are registered by the
 * version they start from and applied in order until the running version is reached;
 * versions with no registered step (patch bumps) are stamped without changes.</p>
 */
public class SchemaMigrator {

    private static final Logger log = LoggerFactory.getLogger(SchemaMigrator.class);

    private final SchemaVersionChecker checker;
    private final BackupManager backups;
    private final CatalogStore catalog;
    private final Clock clock;
    private final NavigableMap<SchemaVersion, Registered> steps = new TreeMap<>();

    public SchemaMigrator(SchemaVersionChecker checker, BackupManager backups, CatalogStore catalog, Clock clock) {
        this.checker = checker;
        this.backups = backups;
        this.catalog = catalog;
        this.clock = clock;
        register(new SchemaVersion(1, 0, 0), new SchemaVersion(1, 1, 0), this::rewriteCatalogRecords);
    }

    /**
     * Registers a step upgrading {@code from} to {@code to}.
     */
    public void register(SchemaVersion from, SchemaVersion to, MigrationStep step) {
        if (to.compareTo(from) <= 0) {
            throw new IllegalArgumentException("Migration must move forward: " + from + " -> " + to);
        }
        steps.put(from, new Registered(to, step));
    }

    /**
     * Migrates the data root to the running version.
     *
     * @throws IncompatibleVersionException if the data root is newer than the running version
     *         or belongs to a different major version with no registered path
     */
    public MigrationResult migrate() {
        SchemaVersion running = checker.running();
        String persistedText = checker.persistedVersion();
        SchemaVersion current = SchemaVersion.parse(persistedText);

        if (current.compareTo(running) > 0) {
            throw new IncompatibleVersionException(persistedText, running.toString());
        }
        if (current.equals(running)) {
            log.info("Schema already at {}; nothing to migrate", running);
            return new MigrationResult(persistedText, running.toString(), List.of(), null);
        }

        BackupArchive backup = backups.fullBackup("pre-migration " + current + " -> " + running);
        List<MigrationRecord> applied = new ArrayList<>();
        while (current.compareTo(running) < 0) {
            Map.Entry<SchemaVersion, Registered> next = steps.floorEntry(current);
            if (next == null || next.getValue().to().compareTo(current) <= 0 || next.getValue().to().compareTo(running) > 0) {
                if (current.major() != running.major()) {
                    throw new IncompatibleVersionException(current.toString(), running.toString());
                }
                log.info("No migration step from {}; stamping {}", current, running);
                applied.add(new MigrationRecord(current.toString(), running.toString(), clock.instant(), backup.backupId()));
                current = running;
                break;
            }
            Registered step = next.getValue();
            log.info("Migrating schema {} -> {}", current, step.to());
            step.step().apply();
            applied.add(new MigrationRecord(current.toString(), step.to().toString(), clock.instant(), backup.backupId()));
            current = step.to();
        }

        List<MigrationRecord> history = new ArrayList<>(checker.readInfo()
            .map(VersionInfo::migrationHistory)
            .orElse(List.of()));
        history.addAll(applied);
        checker.writeInfo(new VersionInfo(running.toString(), SchemaVersionChecker.ENGINE_VERSION, history));
        catalog.setSchemaVersion(running.toString());

        log.info("Migrated schema {} -> {} ({} steps, backup {})", persistedText, running, applied.size(), backup.backupId());
        return new MigrationResult(persistedText, running.toString(), applied, backup.backupId());
    }

    /**
     * 1.0 catalogs may lack {@code updatedAt} and {@code extraMetadata}; re-saving every record
     * fills them with their defaults.
     */
    private void rewriteCatalogRecords() {
        for (CollectionRecord record : catalog.list()) {
            catalog.put(record);
        }
    }

    private record Registered(SchemaVersion to, MigrationStep step) {}
}
