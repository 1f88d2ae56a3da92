package org.carball.lbs.detector;

import lombok.extern.slf4j.Slf4j;
import org.carball.lbs.detector.stats.Statistics;
import org.carball.lbs.model.anomaly.AnomalyFinding;
import org.carball.lbs.model.anomaly.AnomalyType;
import org.carball.lbs.model.anomaly.ComparisonType;
import org.carball.lbs.model.anomaly.DetectionMethod;
import org.carball.lbs.model.anomaly.DetectionResult;
import org.carball.lbs.model.anomaly.DetectionStatistics;
import org.carball.lbs.model.anomaly.DetectionStatus;
import org.carball.lbs.model.anomaly.Severity;
import org.carball.lbs.model.anomaly.ThresholdRule;
import org.carball.lbs.model.data.AggregateRow;

import java.time.LocalDate;
import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Compares each period with its counterpart in the previous cycle and flags percentage
 * changes above the threshold. Periods without a usable counterpart are skipped.
 */
@Slf4j
public class PeriodComparisonDetector {

    public DetectionResult detect(List<AggregateRow> rows, String metric, ComparisonType type,
                                  double thresholdPct, Map<String, Object> parameters) {
        TreeMap<LocalDate, AggregateRow> buckets = new TreeMap<>();
        for (AggregateRow row : rows) {
            if (row.bucket() == null || !row.hasMetric()) {
                continue;
            }
            LocalDate bucket = type.normalize(row.bucket());
            AggregateRow existing = buckets.get(bucket);
            if (existing != null) {
                row = AggregateRow.ofBucket(bucket, existing.metricValue() + row.metricValue(),
                        existing.recordCount() + row.recordCount());
            }
            buckets.put(bucket, row);
        }

        if (buckets.isEmpty()) {
            return DetectionResult.empty(DetectionMethod.PERIOD_COMPARISON, parameters,
                    DetectionStatus.INSUFFICIENT_DATA, "No periods with data to compare");
        }

        List<AnomalyFinding> findings = new ArrayList<>();
        List<Double> changes = new ArrayList<>();
        int excluded = 0;

        for (Map.Entry<LocalDate, AggregateRow> entry : buckets.entrySet()) {
            LocalDate bucket = entry.getKey();
            AggregateRow previous = buckets.get(type.counterpart(bucket));
            if (previous == null || previous.metricValue() == 0) {
                excluded++;
                continue;
            }
            double current = entry.getValue().metricValue();
            double prior = previous.metricValue();
            double change = (current - prior) / prior * 100;
            changes.add(change);

            if (Math.abs(change) <= thresholdPct) {
                continue;
            }
            boolean increase = change > 0;
            findings.add(AnomalyFinding.builder()
                    .method(DetectionMethod.PERIOD_COMPARISON)
                    .identifier(periodKey(bucket, type))
                    .label(periodLabel(bucket, type))
                    .date(bucket)
                    .previousDate(type.counterpart(bucket))
                    .observedValue(current)
                    .expectedValue(prior)
                    .previousValue(prior)
                    .deviation(current - prior)
                    .deviationPct(change)
                    .recordCount(entry.getValue().recordCount())
                    .previousRecordCount(previous.recordCount())
                    .type(increase ? AnomalyType.INCREASE : AnomalyType.DECREASE)
                    .severity(Math.abs(change) > 2 * thresholdPct ? Severity.HIGH : Severity.MEDIUM)
                    .rule(ThresholdRule.above("|percent_change|", thresholdPct, Math.abs(change)))
                    .description(String.format(Locale.US, "%s %s %s by %.1f%% %s (%,.2f to %,.2f)",
                            periodLabel(bucket, type), metric, increase ? "increased" : "decreased",
                            Math.abs(change), type.getDescription(), prior, current))
                    .build());
        }

        findings.sort(Comparator.comparing(AnomalyFinding::getDate).reversed());

        double[] changeValues = Statistics.finite(changes);
        DetectionStatistics.DetectionStatisticsBuilder statistics = changeValues.length == 0
                ? DetectionStatistics.empty().toBuilder()
                : DetectionStatistics.from(Statistics.describe(changeValues));
        statistics.threshold("threshold_pct", thresholdPct)
                .extra("comparison_type", type.getLabel())
                .extra("periods", buckets.size())
                .extra("excluded_periods", excluded);
        if (changeValues.length > 0) {
            double maxIncrease = 0.0;
            double maxDecrease = 0.0;
            for (double change : changeValues) {
                maxIncrease = Math.max(maxIncrease, change);
                maxDecrease = Math.min(maxDecrease, change);
            }
            statistics.extra("max_increase_pct", maxIncrease).extra("max_decrease_pct", maxDecrease);
        }

        log.debug("{} comparison of {}: {} periods, {} excluded, {} anomalies",
                type.getLabel(), metric, buckets.size(), excluded, findings.size());

        DetectionResult.DetectionResultBuilder result = DetectionResult.builder()
                .method(DetectionMethod.PERIOD_COMPARISON)
                .parameters(parameters)
                .findings(findings)
                .statistics(statistics.build());
        if (changeValues.length == 0) {
            result.status(DetectionStatus.INSUFFICIENT_DATA)
                    .reason("No period has a prior " + type.getDescription() + " counterpart to compare with");
        }
        return result.build();
    }

    static String periodKey(LocalDate bucket, ComparisonType type) {
        if (type.isQuarterly()) {
            return bucket.getYear() + "-Q" + ((bucket.getMonthValue() - 1) / 3 + 1);
        }
        return String.format("%d-%02d", bucket.getYear(), bucket.getMonthValue());
    }

    static String periodLabel(LocalDate bucket, ComparisonType type) {
        if (type.isQuarterly()) {
            return "Q" + ((bucket.getMonthValue() - 1) / 3 + 1) + " " + bucket.getYear();
        }
        return bucket.getMonth().getDisplayName(TextStyle.FULL, Locale.US) + " " + bucket.getYear();
    }
}
