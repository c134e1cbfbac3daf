package io.vectorvault;

/**
 * Exception raised when a call names an invalid id or leaves out a required argument.
 */
public class InvalidRequestException extends VaultException {

    public InvalidRequestException(String message, String collectionId) {
        super(message, collectionId);
    }

    @Override
    public String code() {
        return "INVALID_REQUEST";
    }
}
