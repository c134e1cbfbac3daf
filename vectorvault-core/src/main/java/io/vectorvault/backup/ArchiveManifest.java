package io.vectorvault.backup;

import java.time.Instant;
import java.util.List;

/**
 * Contents of {@code manifest.json} at the root of every archive.
 *
 * <p>Version 1 manifests carry no {@code entries}; readers infer them from the archive
 * contents (see {@link BackupManager}).</p>
 */
public record ArchiveManifest(
    int manifestVersion,

    String archiveId,

    BackupType type,

    Instant createdAt,

    /** Schema version of the data root the archive was taken from */
    String schemaVersion,

    List<String> sourceIds,

    List<ArchiveEntry> entries,

    /** Free text, e.g. the operation a checkpoint was taken for */
    String label
) {
    public static final int CURRENT_VERSION = 2;

    public ArchiveManifest {
        sourceIds = sourceIds != null ? List.copyOf(sourceIds) : List.of();
        entries = entries != null ? List.copyOf(entries) : List.of();
        type = type != null ? type : BackupType.SINGLE_COLLECTION;
    }
}
