package io.vectorvault;

/**
 * Exception thrown when creating something that is already present.
 */
public class AlreadyExistsException extends VaultException {

    public AlreadyExistsException(String what, String collectionId) {
        super(String.format("%s already exists: '%s'", what, collectionId), collectionId);
    }

    @Override
    public String code() {
        return "ALREADY_EXISTS";
    }
}
