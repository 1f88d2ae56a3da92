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
import org.carball.lbs.model.anomaly.Severity;
import org.carball.lbs.model.anomaly.ThresholdRule;
import org.carball.lbs.model.data.AggregateRow;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Scores dimension values against each other: z-score, interquartile range and isolation
 * forest over the per-group metric totals.
 */
@Slf4j
public class CrossSectionalDetector {

    private final DetectionConfig config;

    public CrossSectionalDetector(DetectionConfig config) {
        this.config = config;
    }

    public DetectionResult detectZScore(List<AggregateRow> rows, String dimension, double threshold,
                                        Map<String, Object> parameters) {
        List<Group> groups = aggregate(rows);
        if (groups.isEmpty()) {
            return noGroups(DetectionMethod.ZSCORE, dimension, parameters);
        }

        double[] values = totals(groups);
        SummaryStatistics summary = Statistics.describe(values);
        List<AnomalyFinding> findings = new ArrayList<>();

        // Each group is compared with the others so an extreme group cannot hide behind the
        // spread it causes itself.
        if (groups.size() >= 3) {
            for (int i = 0; i < groups.size(); i++) {
                double[] others = without(values, i);
                double mean = Statistics.mean(others);
                double std = Statistics.sampleStd(others);
                if (std == 0) {
                    continue;
                }
                Group group = groups.get(i);
                double z = (group.total - mean) / std;
                if (Math.abs(z) <= threshold) {
                    continue;
                }
                double deviation = group.total - mean;
                findings.add(AnomalyFinding.builder()
                        .method(DetectionMethod.ZSCORE)
                        .dimension(dimension)
                        .identifier(group.key)
                        .label(group.label)
                        .observedValue(group.total)
                        .expectedValue(mean)
                        .deviation(deviation)
                        .deviationPct(mean != 0 ? deviation / mean * 100 : null)
                        .zscore(z)
                        .recordCount(group.records)
                        .type(z > 0 ? AnomalyType.SPIKE : AnomalyType.DROP)
                        .severity(Math.abs(z) > config.getZscoreHighSeverity() ? Severity.HIGH : Severity.MEDIUM)
                        .rule(ThresholdRule.above("|zscore|", threshold, Math.abs(z)))
                        .description(String.format(Locale.US, "%s '%s' total %,.2f is %.2f standard deviations %s the other %d groups (mean %,.2f)",
                                dimension, group.label, group.total, Math.abs(z), z > 0 ? "above" : "below",
                                others.length, mean))
                        .build());
            }
        }
        findings.sort(Comparator.comparing((AnomalyFinding f) -> Math.abs(f.getZscore())).reversed());

        log.debug("Z-score on {}: {} groups, {} anomalies", dimension, groups.size(), findings.size());
        return completed(DetectionMethod.ZSCORE, parameters, findings, DetectionStatistics.from(summary)
                .threshold("zscore", threshold)
                .threshold("high_severity_zscore", config.getZscoreHighSeverity())
                .extra("dimension", dimension)
                .extra("excluded_groups", excludedGroups(rows, groups))
                .build());
    }

    public DetectionResult detectIqr(List<AggregateRow> rows, String dimension, double multiplier,
                                     Map<String, Object> parameters) {
        List<Group> groups = aggregate(rows);
        if (groups.isEmpty()) {
            return noGroups(DetectionMethod.IQR, dimension, parameters);
        }

        double[] values = totals(groups);
        SummaryStatistics summary = Statistics.describe(values);
        double q1 = summary.p25();
        double q3 = summary.p75();
        double iqr = q3 - q1;
        double lower = q1 - multiplier * iqr;
        double upper = q3 + multiplier * iqr;

        List<AnomalyFinding> findings = new ArrayList<>();
        for (Group group : groups) {
            boolean high = group.total > upper;
            boolean low = group.total < lower;
            if (!high && !low) {
                continue;
            }
            double expected = high ? q3 : q1;
            double deviation = group.total - expected;
            boolean extreme = high ? group.total > upper + iqr : group.total < lower - iqr;
            findings.add(AnomalyFinding.builder()
                    .method(DetectionMethod.IQR)
                    .dimension(dimension)
                    .identifier(group.key)
                    .label(group.label)
                    .observedValue(group.total)
                    .expectedValue(expected)
                    .deviation(deviation)
                    .deviationPct(expected != 0 ? deviation / expected * 100 : null)
                    .lowerBound(lower)
                    .upperBound(upper)
                    .recordCount(group.records)
                    .type(high ? AnomalyType.SPIKE : AnomalyType.DROP)
                    .severity(extreme ? Severity.HIGH : Severity.MEDIUM)
                    .rule(high ? ThresholdRule.above("value", upper, group.total)
                            : ThresholdRule.below("value", lower, group.total))
                    .description(String.format(Locale.US, "%s '%s' total %,.2f is outside the expected range %,.2f to %,.2f",
                            dimension, group.label, group.total, lower, upper))
                    .build());
        }
        findings.sort(Comparator.comparing((AnomalyFinding f) -> Math.abs(f.getDeviation())).reversed());

        log.debug("IQR on {}: {} groups, bounds [{}, {}], {} anomalies", dimension, groups.size(), lower, upper, findings.size());
        return completed(DetectionMethod.IQR, parameters, findings, DetectionStatistics.from(summary)
                .threshold("q1", q1)
                .threshold("q3", q3)
                .threshold("iqr", iqr)
                .threshold("lower_bound", lower)
                .threshold("upper_bound", upper)
                .threshold("multiplier", multiplier)
                .extra("dimension", dimension)
                .extra("excluded_groups", excludedGroups(rows, groups))
                .build());
    }

    public DetectionResult detectIsolationForest(List<AggregateRow> rows, String dimension,
                                                 Map<String, Object> parameters) {
        DetectionConfig.IsolationForestSettings settings = config.getIsolationForest();
        List<Group> groups = aggregate(rows);
        if (groups.size() < settings.getMinSamples()) {
            DetectionResult empty = DetectionResult.empty(DetectionMethod.ISOLATION_FOREST, parameters,
                    DetectionStatus.INSUFFICIENT_DATA,
                    String.format("Isolation forest needs at least %d groups, got %d",
                            settings.getMinSamples(), groups.size()));
            if (groups.isEmpty()) {
                return empty;
            }
            return empty.toBuilder()
                    .statistics(DetectionStatistics.from(Statistics.describe(totals(groups))).build())
                    .build();
        }

        double[] values = totals(groups);
        SummaryStatistics summary = Statistics.describe(values);
        double[] scores = new IsolationForest(settings.getTrees(), settings.getSampleSize(), settings.getSeed())
                .fit(values)
                .scoreAll(values);
        double cutoff = Statistics.percentile(scores, 100.0 * (1.0 - settings.getContamination()));
        double median = summary.p50();

        List<AnomalyFinding> findings = new ArrayList<>();
        for (int i = 0; i < groups.size(); i++) {
            if (scores[i] <= cutoff) {
                continue;
            }
            Group group = groups.get(i);
            double deviation = group.total - median;
            findings.add(AnomalyFinding.builder()
                    .method(DetectionMethod.ISOLATION_FOREST)
                    .dimension(dimension)
                    .identifier(group.key)
                    .label(group.label)
                    .observedValue(group.total)
                    .expectedValue(median)
                    .deviation(deviation)
                    .deviationPct(median != 0 ? deviation / median * 100 : null)
                    .anomalyScore(scores[i])
                    .recordCount(group.records)
                    .type(AnomalyType.OUTLIER)
                    .severity(Severity.MEDIUM)
                    .rule(ThresholdRule.above("anomaly_score", cutoff, scores[i]))
                    .description(String.format(Locale.US, "%s '%s' total %,.2f isolates early (score %.3f, median group %,.2f)",
                            dimension, group.label, group.total, scores[i], median))
                    .build());
        }
        findings.sort(Comparator.comparing(AnomalyFinding::getAnomalyScore).reversed());

        log.debug("Isolation forest on {}: {} groups, cutoff {}, {} anomalies", dimension, groups.size(), cutoff, findings.size());
        return completed(DetectionMethod.ISOLATION_FOREST, parameters, findings, DetectionStatistics.from(summary)
                .threshold("score_cutoff", cutoff)
                .threshold("contamination", settings.getContamination())
                .extra("dimension", dimension)
                .extra("trees", settings.getTrees())
                .extra("seed", settings.getSeed())
                .extra("excluded_groups", excludedGroups(rows, groups))
                .build());
    }

    /**
     * Sums the metric per dimension value, skipping missing metrics and dropping groups backed
     * by fewer records than the configured minimum. Groups keep first-seen order.
     */
    List<Group> aggregate(List<AggregateRow> rows) {
        Map<String, Group> groups = new LinkedHashMap<>();
        for (AggregateRow row : rows) {
            if (!row.hasMetric() || row.dimensionValue() == null) {
                continue;
            }
            Group group = groups.computeIfAbsent(row.dimensionValue(), key -> new Group(key, row.displayLabel()));
            group.total += row.metricValue();
            group.records += row.recordCount();
        }
        return groups.values().stream()
                .filter(group -> group.records >= config.getMinRecordsPerGroup())
                .toList();
    }

    private static long excludedGroups(List<AggregateRow> rows, List<Group> kept) {
        long distinct = rows.stream().map(AggregateRow::dimensionValue).filter(v -> v != null).distinct().count();
        return distinct - kept.size();
    }

    private static double[] totals(List<Group> groups) {
        return groups.stream().mapToDouble(group -> group.total).toArray();
    }

    private static double[] without(double[] values, int index) {
        double[] out = new double[values.length - 1];
        for (int i = 0, j = 0; i < values.length; i++) {
            if (i != index) {
                out[j++] = values[i];
            }
        }
        return out;
    }

    private DetectionResult noGroups(DetectionMethod method, String dimension, Map<String, Object> parameters) {
        return DetectionResult.empty(method, parameters, DetectionStatus.INSUFFICIENT_DATA,
                String.format("No %s groups with at least %d records", dimension, config.getMinRecordsPerGroup()));
    }

    private static DetectionResult completed(DetectionMethod method, Map<String, Object> parameters,
                                             List<AnomalyFinding> findings, DetectionStatistics statistics) {
        return DetectionResult.builder()
                .method(method)
                .parameters(parameters)
                .findings(findings)
                .statistics(statistics)
                .build();
    }

    static final class Group {
        final String key;
        final String label;
        double total;
        long records;

        Group(String key, String label) {
            this.key = key;
            this.label = label;
        }
    }
}
