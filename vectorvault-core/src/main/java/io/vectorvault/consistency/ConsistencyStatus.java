package io.vectorvault.consistency;

/**
 * Overall verdict of a consistency check.
 */
public enum ConsistencyStatus {
    /** Catalog and physical store agree */
    CONSISTENT,

    /** At least one issue was found */
    INCONSISTENT,

    /** The scan itself failed; nothing is known about consistency */
    ERROR
}
