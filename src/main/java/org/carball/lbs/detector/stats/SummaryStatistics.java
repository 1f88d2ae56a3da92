package org.carball.lbs.detector.stats;

/**
 * Descriptive statistics over the finite values of a sample. Standard deviation is the sample
 * (n - 1) estimate; percentiles use linear interpolation between order statistics.
 */
public record SummaryStatistics(int count,
                                double mean,
                                double std,
                                double min,
                                double max,
                                double p25,
                                double p50,
                                double p75,
                                double p95,
                                double p99) {

    public static SummaryStatistics empty() {
        return new SummaryStatistics(0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0);
    }

    public double iqr() {
        return p75 - p25;
    }

    public boolean isEmpty() {
        return count == 0;
    }
}
