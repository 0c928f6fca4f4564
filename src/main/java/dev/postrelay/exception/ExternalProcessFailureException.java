package dev.postrelay.exception;

import lombok.Getter;

/**
 * An external job could not be started or terminated with a non-zero status.
 */
@Getter
public class ExternalProcessFailureException extends RelayException {

    private final String jobName;

    public ExternalProcessFailureException(String jobName, String message) {
        super(message);
        this.jobName = jobName;
    }

    public ExternalProcessFailureException(String jobName, String message, Throwable cause) {
        super(message, cause);
        this.jobName = jobName;
    }
}
