package io.vectorvault.version;

import java.util.List;

/**
 * Contents of {@code version_info.json} in the data root.
 */
public record VersionInfo(String schemaVersion, String engineVersion, List<MigrationRecord> migrationHistory) {

    public VersionInfo {
        migrationHistory = migrationHistory != null ? List.copyOf(migrationHistory) : List.of();
    }
}
