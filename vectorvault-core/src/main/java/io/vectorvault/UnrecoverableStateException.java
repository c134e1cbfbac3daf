package io.vectorvault;

/**
 * Exception thrown when a rollback itself failed. The collection is quarantined: no
 * automatic operation touches it again until an operator releases it.
 */
public class UnrecoverableStateException extends VaultException {

    public UnrecoverableStateException(String message, String collectionId, Throwable cause) {
        super(message, collectionId, cause);
    }

    @Override
    public String code() {
        return "UNRECOVERABLE_STATE";
    }
}
