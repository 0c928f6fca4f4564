package dev.postrelay.exception;

/**
 * Base class of the failures raised by the relay core.
 */
public abstract class RelayException extends RuntimeException {

    protected RelayException(String message) {
        super(message);
    }

    protected RelayException(String message, Throwable cause) {
        super(message, cause);
    }
}
