package org.carball.lbs.model.anomaly;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;
import org.carball.lbs.detector.stats.SummaryStatistics;

import java.util.Map;

@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class DetectionStatistics {

    int count;
    Double mean;
    Double std;
    Double min;
    Double max;
    Double median;

    @Singular
    Map<String, Double> thresholds;

    @Singular
    Map<String, Object> extras;

    /**
     * Zero-valued statistics for an empty input.
     */
    public static DetectionStatistics empty() {
        return DetectionStatistics.builder()
                .count(0)
                .mean(0.0)
                .std(0.0)
                .min(0.0)
                .max(0.0)
                .median(0.0)
                .build();
    }

    public static DetectionStatisticsBuilder from(SummaryStatistics summary) {
        return DetectionStatistics.builder()
                .count(summary.count())
                .mean(summary.mean())
                .std(summary.std())
                .min(summary.min())
                .max(summary.max())
                .median(summary.p50());
    }
}
