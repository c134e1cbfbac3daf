package io.vectorvault.version;

import io.vectorvault.IncompatibleVersionException;
import io.vectorvault.Json;
import io.vectorvault.StorageUnavailableException;
import io.vectorvault.catalog.CatalogStore;
import io.vectorvault.config.ConfigContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Compares the schema version persisted in the data root with the running version.
 *
 * <ul>
 *   <li>major differs, or persisted is newer: incompatible</li>
 *   <li>persisted is older within the same major: compatible, migration needed</li>
 *   <li>unparseable: incompatible</li>
 * </ul>
 *
 * <p>An incompatible data root blocks mutating operations until it is migrated or the
 * operator sets {@code allowIncompatibleSchema}; reads are never blocked.</p>
 */
public class SchemaVersionChecker {

    private static final Logger log = LoggerFactory.getLogger(SchemaVersionChecker.class);

    public static final String FILE_NAME = "version_info.json";
    static final String ENGINE_VERSION = "hnsw-1";

    private final Path versionFile;
    private final CatalogStore catalog;
    private final SchemaVersion running;
    private final ConfigContext config;

    public SchemaVersionChecker(Path dataRoot, CatalogStore catalog, SchemaVersion running, ConfigContext config) {
        this.versionFile = dataRoot.resolve(FILE_NAME);
        this.catalog = catalog;
        this.running = running;
        this.config = config;
    }

    public CompatibilityReport check() {
        String persisted = persistedVersion();
        List<String> issues = new ArrayList<>();
        boolean compatible = true;
        boolean migrationNeeded = false;

        SchemaVersion version;
        try {
            version = SchemaVersion.parse(persisted);
        } catch (IllegalArgumentException e) {
            issues.add("Persisted schema version is unreadable: '" + persisted + "'");
            return report(false, true, persisted, issues);
        }

        int cmp = version.compareTo(running);
        if (version.major() != running.major()) {
            compatible = false;
            migrationNeeded = true;
            issues.add(String.format("Major schema version changed: %s -> %s", version, running));
        } else if (cmp > 0) {
            compatible = false;
            issues.add(String.format("Data root was written by a newer schema %s than running %s", version, running));
        } else if (cmp < 0) {
            migrationNeeded = true;
            issues.add(String.format("Schema %s is older than running %s; migration recommended", version, running));
        }
        return report(compatible, migrationNeeded, persisted, issues);
    }

    /**
     * Fails closed when mutations are not allowed.
     *
     * @throws IncompatibleVersionException unless the data root is compatible or overridden
     */
    public void requireMutable() {
        CompatibilityReport report = check();
        if (!report.allowsMutation()) {
            throw new IncompatibleVersionException(report.persistedVersion(), report.runningVersion());
        }
        if (report.overridden()) {
            log.warn("Mutating an incompatible data root ({} vs {}) under operator override",
                report.persistedVersion(), report.runningVersion());
        }
    }

    /**
     * The persisted version: from {@code version_info.json}, else from the catalog, else the
     * running version for a fresh data root (which is stamped on first read).
     *
     * @throws StorageUnavailableException if the data root does not exist; a missing root is
     *         never treated as fresh
     */
    public String persistedVersion() {
        Optional<VersionInfo> info = readInfo();
        if (info.isPresent()) {
            return info.get().schemaVersion();
        }
        Optional<String> fromCatalog = catalog.schemaVersion();
        if (fromCatalog.isPresent()) {
            return fromCatalog.get();
        }
        if (!Files.isDirectory(versionFile.toAbsolutePath().getParent())) {
            throw new StorageUnavailableException("Data root is not available: " + versionFile.getParent(), null);
        }
        writeInfo(new VersionInfo(running.toString(), ENGINE_VERSION, List.of()));
        log.info("Stamped fresh data root with schema version {}", running);
        return running.toString();
    }

    public SchemaVersion running() {
        return running;
    }

    // ==================== Persistence ====================

    public Optional<VersionInfo> readInfo() {
        if (!Files.exists(versionFile)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Json.mapper().readValue(versionFile.toFile(), VersionInfo.class));
        } catch (IOException e) {
            throw new StorageUnavailableException("Cannot read " + versionFile, e);
        }
    }

    public void writeInfo(VersionInfo info) {
        Path tmp = versionFile.resolveSibling(FILE_NAME + ".tmp");
        try {
            Json.mapper().writeValue(tmp.toFile(), info);
            Files.move(tmp, versionFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new StorageUnavailableException("Cannot write " + versionFile, e);
        }
    }

    private CompatibilityReport report(boolean compatible, boolean migrationNeeded, String persisted, List<String> issues) {
        boolean overridden = !compatible && config.current().allowIncompatibleSchema();
        return new CompatibilityReport(compatible, migrationNeeded, persisted, running.toString(), issues, overridden);
    }
}
