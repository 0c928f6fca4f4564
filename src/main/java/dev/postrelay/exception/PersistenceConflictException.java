package dev.postrelay.exception;

/**
 * A concurrent writer changed the row between our read and our write. Nothing was overwritten.
 */
public class PersistenceConflictException extends RelayException {

    public PersistenceConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
