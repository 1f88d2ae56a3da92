package org.carball.lbs.model.anomaly;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Output of one detection strategy. Immutable once built: the collections handed to the builder
 * are copied. Cached copies are marked with {@link #isCached()}.
 */
@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class DetectionResult {

    DetectionMethod method;
    Map<String, Object> parameters;
    List<AnomalyFinding> findings;
    DetectionStatistics statistics;
    DetectionStatus status;
    String reason;
    List<ForecastPoint> forecast;
    Instant generatedAt;
    boolean cached;

    @Builder(toBuilder = true)
    @Jacksonized
    private DetectionResult(DetectionMethod method, Map<String, Object> parameters, List<AnomalyFinding> findings,
                            DetectionStatistics statistics, DetectionStatus status, String reason,
                            List<ForecastPoint> forecast, Instant generatedAt, boolean cached) {
        this.method = method;
        this.parameters = parameters == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        this.findings = findings == null ? List.of() : List.copyOf(findings);
        this.statistics = statistics == null ? DetectionStatistics.empty() : statistics;
        this.status = status == null ? DetectionStatus.COMPLETED : status;
        this.reason = reason;
        this.forecast = forecast == null ? null : List.copyOf(forecast);
        this.generatedAt = generatedAt == null ? Instant.now() : generatedAt;
        this.cached = cached;
    }

    public int getAnomalyCount() {
        return findings.size();
    }

    @JsonIgnore
    public boolean isCompleted() {
        return status == DetectionStatus.COMPLETED;
    }

    /**
     * A result with no findings and zero-valued statistics, explaining why nothing was detected.
     */
    public static DetectionResult empty(DetectionMethod method, Map<String, Object> parameters,
                                        DetectionStatus status, String reason) {
        return DetectionResult.builder()
                .method(method)
                .parameters(parameters)
                .status(status)
                .reason(reason)
                .build();
    }
}
