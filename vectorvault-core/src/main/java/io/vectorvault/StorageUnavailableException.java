package io.vectorvault;

/**
 * Exception thrown when the data root, the catalog or the backup area cannot be read or written.
 */
public class StorageUnavailableException extends VaultException {

    public StorageUnavailableException(String message, String collectionId, Throwable cause) {
        super(message, collectionId, cause);
    }

    public StorageUnavailableException(String message, Throwable cause) {
        super(message, null, cause);
    }

    @Override
    public String code() {
        return "STORAGE_UNAVAILABLE";
    }
}
