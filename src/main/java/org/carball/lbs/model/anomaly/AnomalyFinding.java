package org.carball.lbs.model.anomaly;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;

/**
 * A single flagged dimension value or time period. A finding always carries the
 * {@link ThresholdRule} that triggered it.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class AnomalyFinding {

    DetectionMethod method;
    String dimension;
    String identifier;
    String label;
    String category;
    LocalDate date;
    LocalDate previousDate;

    Double observedValue;
    Double expectedValue;
    Double previousValue;
    Double deviation;
    Double deviationPct;
    Double zscore;
    Double anomalyScore;
    Double lowerBound;
    Double upperBound;
    Double trend;

    Long recordCount;
    Long previousRecordCount;

    @NonNull
    AnomalyType type;

    @NonNull
    Severity severity;

    @NonNull
    ThresholdRule rule;

    String description;
}
