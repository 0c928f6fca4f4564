package dev.postrelay.exception;

/**
 * Failure to read, write or delete a stored media artifact.
 */
public class StorageFailureException extends RelayException {

    public StorageFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
