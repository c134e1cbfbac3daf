package io.vectorvault;

/**
 * Exception thrown when a collection, record or archive does not exist.
 */
public class NotFoundException extends VaultException {

    public NotFoundException(String what, String collectionId) {
        super(String.format("%s not found: '%s'", what, collectionId), collectionId);
    }

    @Override
    public String code() {
        return "NOT_FOUND";
    }
}
