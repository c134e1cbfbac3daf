package io.vectorvault.version;

import java.util.List;

/**
 * What a migration run did.
 */
public record MigrationResult(String fromVersion, String toVersion, List<MigrationRecord> applied, String backupId) {

    public MigrationResult {
        applied = applied != null ? List.copyOf(applied) : List.of();
    }

    public boolean changed() {
        return !fromVersion.equals(toVersion);
    }
}
