package org.carball.lbs.model.anomaly;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum DetectionStatus {
    COMPLETED("completed"),
    INSUFFICIENT_DATA("insufficient_data"),
    UNAVAILABLE("unavailable");

    private final String label;

    DetectionStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    @JsonCreator
    public static DetectionStatus fromLabel(String label) {
        for (DetectionStatus status : values()) {
            if (status.label.equalsIgnoreCase(label)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown detection status: " + label);
    }
}
