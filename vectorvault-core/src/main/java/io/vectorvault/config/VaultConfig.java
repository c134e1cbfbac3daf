package io.vectorvault.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;

/**
 * Configuration of a vault.
 *
 * <p>Values are resolved with the following priority (highest first):</p>
 * <ol>
 *   <li>Programmatic values set on the {@link Builder}</li>
 *   <li>System properties (e.g. {@code -Dvectorvault.dataRoot=/data})</li>
 *   <li>Environment variables (e.g. {@code VECTORVAULT_DATA_ROOT})</li>
 *   <li>A properties file passed to {@link #resolve(Path)}</li>
 *   <li>Defaults</li>
 * </ol>
 *
 * <table border="1">
 *   <tr><th>Property</th><th>Env variable</th><th>Default</th></tr>
 *   <tr><td>vectorvault.dataRoot</td><td>VECTORVAULT_DATA_ROOT</td><td>~/.vectorvault/data</td></tr>
 *   <tr><td>vectorvault.backupRoot</td><td>VECTORVAULT_BACKUP_ROOT</td><td>&lt;dataRoot&gt;/../backups</td></tr>
 *   <tr><td>vectorvault.retentionCount</td><td>VECTORVAULT_RETENTION_COUNT</td><td>10</td></tr>
 *   <tr><td>vectorvault.retentionDays</td><td>VECTORVAULT_RETENTION_DAYS</td><td>30</td></tr>
 *   <tr><td>vectorvault.syncQueueCapacity</td><td>VECTORVAULT_SYNC_QUEUE_CAPACITY</td><td>1000</td></tr>
 *   <tr><td>vectorvault.keepCheckpointOnCommit</td><td>VECTORVAULT_KEEP_CHECKPOINT_ON_COMMIT</td><td>true</td></tr>
 *   <tr><td>vectorvault.allowOrphanedCatalogCleanup</td><td>VECTORVAULT_ALLOW_ORPHANED_CATALOG_CLEANUP</td><td>false</td></tr>
 *   <tr><td>vectorvault.allowIncompatibleSchema</td><td>VECTORVAULT_ALLOW_INCOMPATIBLE_SCHEMA</td><td>false</td></tr>
 *   <tr><td>vectorvault.dimensionSampleSize</td><td>VECTORVAULT_DIMENSION_SAMPLE_SIZE</td><td>16</td></tr>
 * </table>
 */
public record VaultConfig(
    Path dataRoot,
    Path backupRoot,
    int retentionCount,
    int retentionDays,
    int syncQueueCapacity,
    boolean keepCheckpointOnCommit,
    boolean allowOrphanedCatalogCleanup,
    boolean allowIncompatibleSchema,
    int dimensionSampleSize
) {
    static final String PREFIX = "vectorvault.";

    public VaultConfig {
        Objects.requireNonNull(dataRoot, "dataRoot cannot be null");
        backupRoot = backupRoot != null ? backupRoot : defaultBackupRoot(dataRoot);
        if (retentionCount < 0) throw new IllegalArgumentException("retentionCount must be >= 0");
        if (retentionDays < 0) throw new IllegalArgumentException("retentionDays must be >= 0");
        if (syncQueueCapacity <= 0) throw new IllegalArgumentException("syncQueueCapacity must be > 0");
        if (dimensionSampleSize <= 0) throw new IllegalArgumentException("dimensionSampleSize must be > 0");
        if (backupRoot.toAbsolutePath().normalize().equals(dataRoot.toAbsolutePath().normalize())) {
            throw new IllegalArgumentException("backupRoot must differ from dataRoot");
        }
    }

    public static VaultConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Starts a builder pre-populated from system properties, environment variables and
     * the given properties file (which may be {@code null} or missing).
     */
    public static Builder resolve(Path propertiesFile) {
        return resolve(propertiesFile, System.getProperties(), System.getenv());
    }

    static Builder resolve(Path propertiesFile, Properties system, Map<String, String> env) {
        Properties file = new Properties();
        if (propertiesFile != null && Files.exists(propertiesFile)) {
            try (InputStream is = Files.newInputStream(propertiesFile)) {
                file.load(is);
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot read configuration " + propertiesFile, e);
            }
        }
        Lookup lookup = new Lookup(system, env, file);

        Builder builder = new Builder();
        lookup.get("dataRoot").ifPresent(v -> builder.dataRoot(Paths.get(v)));
        lookup.get("backupRoot").ifPresent(v -> builder.backupRoot(Paths.get(v)));
        lookup.get("retentionCount").ifPresent(v -> builder.retentionCount(Integer.parseInt(v)));
        lookup.get("retentionDays").ifPresent(v -> builder.retentionDays(Integer.parseInt(v)));
        lookup.get("syncQueueCapacity").ifPresent(v -> builder.syncQueueCapacity(Integer.parseInt(v)));
        lookup.get("keepCheckpointOnCommit").ifPresent(v -> builder.keepCheckpointOnCommit(Boolean.parseBoolean(v)));
        lookup.get("allowOrphanedCatalogCleanup").ifPresent(v -> builder.allowOrphanedCatalogCleanup(Boolean.parseBoolean(v)));
        lookup.get("allowIncompatibleSchema").ifPresent(v -> builder.allowIncompatibleSchema(Boolean.parseBoolean(v)));
        lookup.get("dimensionSampleSize").ifPresent(v -> builder.dimensionSampleSize(Integer.parseInt(v)));
        return builder;
    }

    public VaultConfig withDataRoot(Path dataRoot) {
        return new VaultConfig(dataRoot, null, retentionCount, retentionDays, syncQueueCapacity,
            keepCheckpointOnCommit, allowOrphanedCatalogCleanup, allowIncompatibleSchema, dimensionSampleSize);
    }

    private static Path defaultBackupRoot(Path dataRoot) {
        Path parent = dataRoot.toAbsolutePath().getParent();
        return parent != null ? parent.resolve("backups") : dataRoot.resolveSibling("backups");
    }

    /**
     * Property lookup across system properties, environment and file, in that order.
     */
    private record Lookup(Properties system, Map<String, String> env, Properties file) {
        Optional<String> get(String key) {
            String value = system.getProperty(PREFIX + key);
            if (value == null) {
                value = env.get(envName(key));
            }
            if (value == null) {
                value = file.getProperty(PREFIX + key);
            }
            return value == null || value.isBlank() ? Optional.empty() : Optional.of(value.trim());
        }

        static String envName(String key) {
            return "VECTORVAULT_" + key.replaceAll("([a-z])([A-Z])", "$1_$2").toUpperCase();
        }
    }

    /**
     * Builder for {@link VaultConfig}.
     */
    public static final class Builder {
        private Path dataRoot = Paths.get(System.getProperty("user.home"), ".vectorvault", "data");
        private Path backupRoot;
        private int retentionCount = 10;
        private int retentionDays = 30;
        private int syncQueueCapacity = 1000;
        private boolean keepCheckpointOnCommit = true;
        private boolean allowOrphanedCatalogCleanup = false;
        private boolean allowIncompatibleSchema = false;
        private int dimensionSampleSize = 16;

        private Builder() {
        }

        public Builder dataRoot(Path dataRoot) {
            this.dataRoot = dataRoot;
            return this;
        }

        public Builder backupRoot(Path backupRoot) {
            this.backupRoot = backupRoot;
            return this;
        }

        public Builder retentionCount(int retentionCount) {
            this.retentionCount = retentionCount;
            return this;
        }

        public Builder retentionDays(int retentionDays) {
            this.retentionDays = retentionDays;
            return this;
        }

        public Builder syncQueueCapacity(int syncQueueCapacity) {
            this.syncQueueCapacity = syncQueueCapacity;
            return this;
        }

        public Builder keepCheckpointOnCommit(boolean keep) {
            this.keepCheckpointOnCommit = keep;
            return this;
        }

        public Builder allowOrphanedCatalogCleanup(boolean allow) {
            this.allowOrphanedCatalogCleanup = allow;
            return this;
        }

        public Builder allowIncompatibleSchema(boolean allow) {
            this.allowIncompatibleSchema = allow;
            return this;
        }

        public Builder dimensionSampleSize(int dimensionSampleSize) {
            this.dimensionSampleSize = dimensionSampleSize;
            return this;
        }

        public VaultConfig build() {
            return new VaultConfig(dataRoot, backupRoot, retentionCount, retentionDays, syncQueueCapacity,
                keepCheckpointOnCommit, allowOrphanedCatalogCleanup, allowIncompatibleSchema, dimensionSampleSize);
        }
    }
}
