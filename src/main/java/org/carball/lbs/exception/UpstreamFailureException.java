package org.carball.lbs.exception;

/**
 * Raised when an external collaborator (warehouse, embedding endpoint, language model) fails.
 */
public class UpstreamFailureException extends RuntimeException {

    public UpstreamFailureException(String message) {
        super(message);
    }

    public UpstreamFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
