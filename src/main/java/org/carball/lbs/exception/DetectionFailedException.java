package org.carball.lbs.exception;

import lombok.Getter;
import org.carball.lbs.model.anomaly.DetectionMethod;

import java.util.Map;

/**
 * A detection run that could not complete because its data could not be fetched. Carries the
 * method and parameters of the failed run.
 */
@Getter
public class DetectionFailedException extends UpstreamFailureException {

    private final DetectionMethod method;
    private final Map<String, Object> parameters;

    public DetectionFailedException(DetectionMethod method, Map<String, Object> parameters, Throwable cause) {
        super(String.format("%s detection failed with parameters %s: %s",
                method.getLabel(), parameters, cause.getMessage()), cause);
        this.method = method;
        this.parameters = Map.copyOf(parameters);
    }
}
