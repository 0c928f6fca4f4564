package dev.postrelay.exception;

/**
 * Thrown when an operation targets an unknown content item, job or profile.
 */
public class NotFoundException extends RelayException {

    public NotFoundException(String message) {
        super(message);
    }

    public static NotFoundException item(Long id) {
        return new NotFoundException("Content item not found: " + id);
    }

    public static NotFoundException job(String name) {
        return new NotFoundException("Job not found: " + name);
    }
}
