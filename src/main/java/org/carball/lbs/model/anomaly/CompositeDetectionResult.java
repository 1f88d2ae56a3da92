package org.carball.lbs.model.anomaly;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

@Value
@JsonIgnoreProperties(ignoreUnknown = true)
public class CompositeDetectionResult {

    public static final String SUCCESS = "success";
    public static final String PARTIAL = "partial";
    public static final String FAILED = "failed";

    Instant timestamp;
    Map<String, DetectionResult> results;
    Map<String, String> errors;
    int totalAnomalies;
    int detectionMethods;
    String status;

    @Builder
    @Jacksonized
    private CompositeDetectionResult(Instant timestamp, Map<String, DetectionResult> results,
                                     Map<String, String> errors, int totalAnomalies, int detectionMethods,
                                     String status) {
        this.timestamp = timestamp;
        this.results = results == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(results));
        this.errors = errors == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(errors));
        this.totalAnomalies = totalAnomalies;
        this.detectionMethods = detectionMethods;
        this.status = status;
    }
}
