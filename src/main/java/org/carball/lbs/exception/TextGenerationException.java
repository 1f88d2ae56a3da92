package org.carball.lbs.exception;

public class TextGenerationException extends UpstreamFailureException {

    public TextGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
