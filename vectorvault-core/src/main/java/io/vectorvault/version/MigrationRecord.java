package io.vectorvault.version;

import java.time.Instant;

/**
 * One applied migration step.
 */
public record MigrationRecord(String fromVersion, String toVersion, Instant appliedAt, String backupId) {}
