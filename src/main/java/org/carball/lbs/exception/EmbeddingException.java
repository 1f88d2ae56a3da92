package org.carball.lbs.exception;

public class EmbeddingException extends UpstreamFailureException {

    public EmbeddingException(String message, Throwable cause) {
        super(message, cause);
    }
}
