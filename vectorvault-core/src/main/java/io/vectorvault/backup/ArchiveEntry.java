package io.vectorvault.backup;

/**
 * State of one collection id at archive time. An id that had neither a record nor a
 * physical collection is still recorded, so restoring removes anything created since.
 */
public record ArchiveEntry(String collectionId, boolean hadRecord, boolean hadPhysical) {}
