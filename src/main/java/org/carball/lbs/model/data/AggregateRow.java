package org.carball.lbs.model.data;

import java.time.LocalDate;

/**
 * One row of an aggregate query: a dimension value or a time bucket with its summed metric.
 * A null or non-finite metric value marks the row as missing.
 */
public record AggregateRow(String dimension,
                           String dimensionValue,
                           String label,
                           String category,
                           LocalDate bucket,
                           Double metricValue,
                           long recordCount) {

    public AggregateRow {
        if (recordCount < 0) {
            throw new IllegalArgumentException("Record count must not be negative: " + recordCount);
        }
    }

    public static AggregateRow ofGroup(String dimension, String value, String label, Double metric, long count) {
        return new AggregateRow(dimension, value, label, null, null, metric, count);
    }

    public static AggregateRow ofBucket(LocalDate bucket, Double metric, long count) {
        return new AggregateRow(null, null, null, null, bucket, metric, count);
    }

    public static AggregateRow ofEntityDay(String dimension, String value, String label, String category,
                                           LocalDate day, Double metric, long count) {
        return new AggregateRow(dimension, value, label, category, day, metric, count);
    }

    public boolean hasMetric() {
        return metricValue != null && Double.isFinite(metricValue);
    }

    public String displayLabel() {
        return label != null && !label.isBlank() ? label : dimensionValue;
    }
}
