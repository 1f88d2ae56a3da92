package org.carball.lbs.model.anomaly;

import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Parameters for a single detection run. Unset optional fields fall back to the configured
 * defaults of the chosen method.
 */
@Value
@Builder(toBuilder = true)
public class DetectionRequest {

    DetectionMethod method;
    String metric;
    String dimension;
    Double threshold;
    Granularity granularity;
    Integer lookbackDays;
    ComparisonType comparisonType;
    Integer topN;
    Integer forecastDays;

    /**
     * The resolved request as a flat parameter map, used in results and cache keys.
     */
    public Map<String, Object> toParameters() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("method", method.getLabel());
        putIfPresent(params, "metric", metric);
        putIfPresent(params, "dimension", dimension);
        putIfPresent(params, "threshold", threshold);
        putIfPresent(params, "granularity", granularity == null ? null : granularity.getLabel());
        putIfPresent(params, "lookback_days", lookbackDays);
        putIfPresent(params, "comparison_type", comparisonType == null ? null : comparisonType.getLabel());
        putIfPresent(params, "top_n", topN);
        putIfPresent(params, "forecast_days", forecastDays);
        return params;
    }

    private static void putIfPresent(Map<String, Object> params, String key, Object value) {
        if (value != null) {
            params.put(key, value);
        }
    }
}
