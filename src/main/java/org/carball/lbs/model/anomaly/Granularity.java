package org.carball.lbs.model.anomaly;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum Granularity {
    DAILY("daily"),
    WEEKLY("weekly"),
    MONTHLY("monthly");

    private final String label;

    Granularity(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    @JsonCreator
    public static Granularity fromName(String name) {
        for (Granularity granularity : values()) {
            if (granularity.label.equalsIgnoreCase(name)) {
                return granularity;
            }
        }
        throw new IllegalArgumentException("Unknown granularity: " + name + ". Use daily, weekly or monthly");
    }
}
