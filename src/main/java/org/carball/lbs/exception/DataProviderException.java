package org.carball.lbs.exception;

public class DataProviderException extends UpstreamFailureException {

    public DataProviderException(String message) {
        super(message);
    }

    public DataProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
