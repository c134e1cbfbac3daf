package io.vectorvault.backup;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

/**
 * A complete archive on disk, as listed by {@link BackupManager}.
 */
public record BackupArchive(
    String backupId,

    BackupType type,

    Path path,

    long sizeBytes,

    Instant createdAt,

    /** The collection this archive was taken for, when it covers exactly one */
    String sourceCollection,

    List<String> sourceIds,

    String schemaVersion,

    String label
) {
    public BackupArchive {
        sourceIds = sourceIds != null ? List.copyOf(sourceIds) : List.of();
    }
}
