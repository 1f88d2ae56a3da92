package org.carball.lbs.detector;

import lombok.extern.slf4j.Slf4j;
import org.carball.lbs.config.DetectionConfig;
import org.carball.lbs.detector.stats.Statistics;
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
 * Flags day-to-day swings for the top entities of a dimension. Each entity is compared with
 * its own previous day of activity; a previous value of zero or less leaves the change
 * undefined and never flags.
 */
@Slf4j
public class DayOnDayDetector {

    private static final Comparator<AnomalyFinding> REPORT_ORDER = Comparator
            .comparing(AnomalyFinding::getDate, Comparator.reverseOrder())
            .thenComparing(f -> Math.abs(f.getDeviationPct()), Comparator.reverseOrder())
            .thenComparing(AnomalyFinding::getLabel, Comparator.nullsLast(Comparator.naturalOrder()));

    private final DetectionConfig config;

    public DayOnDayDetector(DetectionConfig config) {
        this.config = config;
    }

    /**
     * @param dimensionLabel human name of the dimension, e.g. "Product"
     * @param metricLabel    human name of the metric, e.g. "sales"
     */
    public DetectionResult detect(List<AggregateRow> rows, String dimension, String dimensionLabel,
                                  String metricLabel, double thresholdPct, int topN, int lookbackDays,
                                  Map<String, Object> parameters) {
        Map<String, List<AggregateRow>> series = new LinkedHashMap<>();
        Map<String, Double> totals = new LinkedHashMap<>();
        for (AggregateRow row : rows) {
            if (row.bucket() == null || row.dimensionValue() == null || !row.hasMetric()) {
                continue;
            }
            series.computeIfAbsent(row.dimensionValue(), key -> new ArrayList<>()).add(row);
            totals.merge(row.dimensionValue(), row.metricValue(), Double::sum);
        }

        if (series.isEmpty()) {
            return DetectionResult.empty(DetectionMethod.DAY_ON_DAY, parameters, DetectionStatus.INSUFFICIENT_DATA,
                    "No daily " + dimensionLabel.toLowerCase(Locale.US) + " activity in the last " + lookbackDays + " days");
        }

        List<String> topEntities = totals.entrySet().stream()
                .sorted(Map.Entry.<String, Double>comparingByValue().reversed()
                        .thenComparing(Map.Entry.<String, Double>comparingByKey()))
                .limit(topN)
                .map(Map.Entry::getKey)
                .toList();

        List<AnomalyFinding> findings = new ArrayList<>();
        List<Double> changes = new ArrayList<>();
        int undefined = 0;

        for (String entity : topEntities) {
            List<AggregateRow> days = series.get(entity).stream()
                    .sorted(Comparator.comparing(AggregateRow::bucket))
                    .toList();
            for (int i = 1; i < days.size(); i++) {
                AggregateRow previous = days.get(i - 1);
                AggregateRow current = days.get(i);
                if (previous.metricValue() <= 0) {
                    undefined++;
                    continue;
                }
                double change = (current.metricValue() - previous.metricValue()) / previous.metricValue() * 100;
                changes.add(change);
                if (Math.abs(change) < thresholdPct) {
                    continue;
                }
                findings.add(buildFinding(dimension, dimensionLabel, metricLabel, thresholdPct, previous, current, change));
            }
        }

        findings.sort(REPORT_ORDER);

        long spikes = findings.stream().filter(f -> f.getType() == AnomalyType.SPIKE).count();
        double[] changeValues = Statistics.finite(changes);
        DetectionStatistics.DetectionStatisticsBuilder statistics = changeValues.length == 0
                ? DetectionStatistics.empty().toBuilder()
                : DetectionStatistics.from(Statistics.describe(changeValues));

        log.debug("Day-on-day on {}: {} entities, {} comparisons, {} anomalies",
                dimension, topEntities.size(), changeValues.length, findings.size());

        return DetectionResult.builder()
                .method(DetectionMethod.DAY_ON_DAY)
                .parameters(parameters)
                .findings(findings)
                .statistics(statistics
                        .threshold("threshold_pct", thresholdPct)
                        .threshold("high_severity_pct", config.getDayOnDayHighPct())
                        .threshold("medium_severity_pct", config.getDayOnDayMediumPct())
                        .extra("dimension", dimension)
                        .extra("entities_analyzed", topEntities.size())
                        .extra("top_n", topN)
                        .extra("lookback_days", lookbackDays)
                        .extra("spike_count", spikes)
                        .extra("drop_count", findings.size() - spikes)
                        .extra("undefined_changes", undefined)
                        .build())
                .build();
    }

    private AnomalyFinding buildFinding(String dimension, String dimensionLabel, String metricLabel,
                                        double thresholdPct, AggregateRow previous, AggregateRow current,
                                        double change) {
        boolean spike = change > 0;
        double magnitude = Math.abs(change);
        Severity severity = magnitude >= config.getDayOnDayHighPct() ? Severity.HIGH
                : magnitude >= config.getDayOnDayMediumPct() ? Severity.MEDIUM
                : Severity.LOW;

        StringBuilder description = new StringBuilder(String.format(Locale.US,
                "%s severity %s detected for %s '%s' on %s. The %s %s by %.1f%% from %,.0f to %,.0f compared to the previous day (%s).",
                severity.getDisplayText(), spike ? "spike" : "drop", dimensionLabel, current.displayLabel(),
                current.bucket(), metricLabel, spike ? "increased" : "decreased", magnitude,
                previous.metricValue(), current.metricValue(), previous.bucket()));
        if (current.category() != null && !current.category().isBlank()) {
            description.append(" Category: ").append(current.category()).append('.');
        }

        return AnomalyFinding.builder()
                .method(DetectionMethod.DAY_ON_DAY)
                .dimension(dimension)
                .identifier(current.dimensionValue())
                .label(current.displayLabel())
                .category(current.category())
                .date(current.bucket())
                .previousDate(previous.bucket())
                .observedValue(current.metricValue())
                .expectedValue(previous.metricValue())
                .previousValue(previous.metricValue())
                .deviation(current.metricValue() - previous.metricValue())
                .deviationPct(change)
                .recordCount(current.recordCount())
                .previousRecordCount(previous.recordCount())
                .type(spike ? AnomalyType.SPIKE : AnomalyType.DROP)
                .severity(severity)
                .rule(ThresholdRule.atLeast("|percent_change|", thresholdPct, magnitude))
                .description(description.toString())
                .build();
    }
}
