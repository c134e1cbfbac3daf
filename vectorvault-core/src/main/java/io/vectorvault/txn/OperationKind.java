package io.vectorvault.txn;

public enum OperationKind {
    CREATE,
    DELETE,
    RENAME
}
