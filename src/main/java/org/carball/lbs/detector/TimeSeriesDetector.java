package org.carball.lbs.detector;

import lombok.extern.slf4j.Slf4j;
import org.carball.lbs.config.DetectionConfig;
import org.carball.lbs.detector.stats.Statistics;
import org.carball.lbs.detector.stats.SummaryStatistics;
import org.carball.lbs.model.anomaly.AnomalyFinding;
import org.carball.lbs.model.anomaly.AnomalyType;
import org.carball.lbs.model.anomaly.DetectionMethod;
import org.carball.lbs.model.anomaly.DetectionResult;
import org.carball.lbs.model.anomaly.DetectionStatistics;
import org.carball.lbs.model.anomaly.DetectionStatus;
import org.carball.lbs.model.anomaly.Granularity;
import org.carball.lbs.model.anomaly.Severity;
import org.carball.lbs.model.anomaly.ThresholdRule;
import org.carball.lbs.model.data.AggregateRow;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Flags time buckets that leave a moving band of mean &plusmn; k&middot;std. The band comes from a
 * centered rolling window of {@code min(maxWindow, n / 3)} buckets, or from the whole series
 * when that window would be shorter than two.
 */
@Slf4j
public class TimeSeriesDetector {

    private final DetectionConfig config;

    public TimeSeriesDetector(DetectionConfig config) {
        this.config = config;
    }

    public DetectionResult detect(List<AggregateRow> rows, String metric, Granularity granularity,
                                  int lookbackDays, Map<String, Object> parameters) {
        List<AggregateRow> series = rows.stream()
                .filter(row -> row.bucket() != null && row.hasMetric())
                .sorted(Comparator.comparing(AggregateRow::bucket))
                .toList();
        int excluded = rows.size() - series.size();

        if (series.isEmpty()) {
            return DetectionResult.empty(DetectionMethod.TIME_SERIES, parameters, DetectionStatus.INSUFFICIENT_DATA,
                    "No " + granularity.getLabel() + " data found in the last " + lookbackDays + " days");
        }

        double[] values = series.stream().mapToDouble(AggregateRow::metricValue).toArray();
        SummaryStatistics summary = Statistics.describe(values);
        double k = config.getTimeSeriesBandMultiplier();
        int window = Math.min(config.getTimeSeriesMaxWindow(), values.length / 3);
        boolean rolling = window >= 2;

        double[] centers;
        double[] spreads;
        if (rolling) {
            centers = Statistics.rollingMean(values, window);
            spreads = Statistics.rollingStd(values, window);
        } else {
            centers = new double[values.length];
            spreads = new double[values.length];
            Arrays.fill(centers, summary.mean());
            Arrays.fill(spreads, summary.std());
        }

        List<AnomalyFinding> findings = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            if (Double.isNaN(centers[i]) || Double.isNaN(spreads[i])) {
                continue;
            }
            double value = values[i];
            double upper = centers[i] + k * spreads[i];
            double lower = centers[i] - k * spreads[i];
            if (value <= upper && value >= lower) {
                continue;
            }

            boolean spike = value > upper;
            double expected = rolling ? neighbourMean(values, i, window) : summary.mean();
            Double zscore = summary.std() > 0 ? (value - summary.mean()) / summary.std() : null;
            Severity severity = zscore != null && Math.abs(zscore) > config.getTimeSeriesHighZscore()
                    ? Severity.HIGH : Severity.MEDIUM;
            double deviation = value - expected;
            AggregateRow row = series.get(i);

            findings.add(AnomalyFinding.builder()
                    .method(DetectionMethod.TIME_SERIES)
                    .identifier(row.bucket().toString())
                    .label(row.bucket().toString())
                    .date(row.bucket())
                    .observedValue(value)
                    .expectedValue(expected)
                    .deviation(deviation)
                    .deviationPct(expected != 0 ? deviation / expected * 100 : null)
                    .zscore(zscore)
                    .lowerBound(lower)
                    .upperBound(upper)
                    .recordCount(row.recordCount())
                    .type(spike ? AnomalyType.SPIKE : AnomalyType.DROP)
                    .severity(severity)
                    .rule(spike ? ThresholdRule.above("value", upper, value) : ThresholdRule.below("value", lower, value))
                    .description(String.format(Locale.US, "%s in %s %s for %s: %,.2f against an expected %,.2f (band %,.2f to %,.2f)",
                            spike ? "Spike" : "Drop", granularity.getLabel(), metric, row.bucket(),
                            value, expected, lower, upper))
                    .build());
        }

        log.debug("Time series {} {}: {} buckets, window {}, {} anomalies",
                metric, granularity.getLabel(), values.length, rolling ? window : "global", findings.size());

        DetectionStatistics statistics = DetectionStatistics.from(summary)
                .threshold("band_multiplier", k)
                .threshold("window", (double) (rolling ? window : values.length))
                .extra("granularity", granularity.getLabel())
                .extra("lookback_days", lookbackDays)
                .extra("rolling_window", rolling)
                .extra("excluded_points", excluded)
                .build();

        return DetectionResult.builder()
                .method(DetectionMethod.TIME_SERIES)
                .parameters(parameters)
                .findings(findings)
                .statistics(statistics)
                .build();
    }

    /**
     * Mean of the centered window around {@code i}, leaving {@code i} itself out.
     */
    private static double neighbourMean(double[] values, int i, int window) {
        int start = Statistics.windowStart(i, window);
        double sum = 0.0;
        int count = 0;
        for (int j = start; j < start + window; j++) {
            if (j != i) {
                sum += values[j];
                count++;
            }
        }
        return count == 0 ? values[i] : sum / count;
    }
}
