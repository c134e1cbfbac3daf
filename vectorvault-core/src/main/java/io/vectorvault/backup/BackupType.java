package io.vectorvault.backup;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * What an archive covers.
 */
public enum BackupType {
    /** Every collection known to the catalog or present on disk */
    @JsonProperty("full")
    FULL,

    /** The collections affected by one operation */
    @JsonProperty("single-collection")
    SINGLE_COLLECTION
}
