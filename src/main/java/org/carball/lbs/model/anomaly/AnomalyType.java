package org.carball.lbs.model.anomaly;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum AnomalyType {
    SPIKE("spike"),
    DROP("drop"),
    INCREASE("increase"),
    DECREASE("decrease"),
    OUTLIER("outlier");

    private final String label;

    AnomalyType(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    @JsonCreator
    public static AnomalyType fromLabel(String label) {
        for (AnomalyType type : values()) {
            if (type.label.equalsIgnoreCase(label)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown anomaly type: " + label);
    }
}
