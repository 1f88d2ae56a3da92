package org.carball.lbs.model.anomaly;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

/**
 * The detection strategies offered by the engine. The label is the wire name used in
 * requests, cache keys and reports.
 */
@Getter
public enum DetectionMethod {
    TIME_SERIES("time_series", "Moving-window time series"),
    ZSCORE("zscore", "Z-score across dimension values"),
    IQR("iqr", "Interquartile range across dimension values"),
    ISOLATION_FOREST("isolation_forest", "Isolation forest across dimension values"),
    PERIOD_COMPARISON("comparative", "Period-over-period comparison"),
    DAY_ON_DAY("day_on_day", "Day-on-day change per entity"),
    FORECAST("forecast", "Forecast confidence band");

    private final String label;
    private final String description;

    DetectionMethod(String label, String description) {
        this.label = label;
        this.description = description;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public boolean isCrossSectional() {
        return this == ZSCORE || this == IQR || this == ISOLATION_FOREST;
    }

    @JsonCreator
    public static DetectionMethod fromName(String name) {
        for (DetectionMethod method : values()) {
            if (method.label.equalsIgnoreCase(name) || method.name().equalsIgnoreCase(name)) {
                return method;
            }
        }
        throw new IllegalArgumentException("Unknown detection method: " + name +
                ". Available methods: " + getAvailableMethods());
    }

    public static String getAvailableMethods() {
        StringBuilder sb = new StringBuilder();
        for (DetectionMethod method : values()) {
            if (!sb.isEmpty()) sb.append(", ");
            sb.append(method.label);
        }
        return sb.toString();
    }
}
