package org.carball.lbs.model.anomaly;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
public enum Severity {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high"),
    CRITICAL("critical");

    private final String label;

    Severity(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    /**
     * Text used in generated descriptions: "HIGH" for high severity, capitalized otherwise.
     */
    public String getDisplayText() {
        if (this == HIGH || this == CRITICAL) {
            return name();
        }
        return Character.toUpperCase(label.charAt(0)) + label.substring(1);
    }

    @JsonCreator
    public static Severity fromLabel(String label) {
        for (Severity severity : values()) {
            if (severity.label.equalsIgnoreCase(label)) {
                return severity;
            }
        }
        throw new IllegalArgumentException("Unknown severity: " + label);
    }
}
