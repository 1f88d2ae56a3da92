package org.carball.lbs.detector.stats;

import java.util.Arrays;
import java.util.Collection;

/**
 * Pure numeric helpers shared by the detectors. Null, NaN and infinite inputs are dropped by
 * {@link #finite(Collection)} before any of the other functions see them.
 */
public final class Statistics {

    private Statistics() {
    }

    public static double[] finite(Collection<Double> values) {
        return values.stream()
                .filter(v -> v != null && Double.isFinite(v))
                .mapToDouble(Double::doubleValue)
                .toArray();
    }

    public static double[] finite(double[] values) {
        return Arrays.stream(values).filter(Double::isFinite).toArray();
    }

    public static SummaryStatistics describe(double[] values) {
        double[] clean = finite(values);
        if (clean.length == 0) {
            return SummaryStatistics.empty();
        }
        double[] sorted = clean.clone();
        Arrays.sort(sorted);
        return new SummaryStatistics(
                sorted.length,
                mean(sorted),
                sampleStd(sorted),
                sorted[0],
                sorted[sorted.length - 1],
                percentileOfSorted(sorted, 25),
                percentileOfSorted(sorted, 50),
                percentileOfSorted(sorted, 75),
                percentileOfSorted(sorted, 95),
                percentileOfSorted(sorted, 99));
    }

    public static double mean(double[] values) {
        if (values.length == 0) {
            return 0.0;
        }
        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    /**
     * Sample standard deviation (ddof = 1). Fewer than two values yield 0.
     */
    public static double sampleStd(double[] values) {
        int n = values.length;
        if (n < 2) {
            return 0.0;
        }
        // Welford
        double mean = 0.0;
        double m2 = 0.0;
        int k = 0;
        for (double v : values) {
            k++;
            double delta = v - mean;
            mean += delta / k;
            m2 += delta * (v - mean);
        }
        return Math.sqrt(Math.max(0.0, m2 / (n - 1)));
    }

    public static double percentile(double[] values, double percentile) {
        if (values.length == 0) {
            return 0.0;
        }
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        return percentileOfSorted(sorted, percentile);
    }

    public static double median(double[] values) {
        return percentile(values, 50);
    }

    /**
     * Linear interpolation between the two closest ranks of an ascending array.
     */
    static double percentileOfSorted(double[] sorted, double percentile) {
        if (percentile < 0 || percentile > 100) {
            throw new IllegalArgumentException("Percentile must be between 0 and 100: " + percentile);
        }
        if (sorted.length == 1) {
            return sorted[0];
        }
        double rank = percentile / 100.0 * (sorted.length - 1);
        int lower = (int) Math.floor(rank);
        int upper = (int) Math.ceil(rank);
        if (lower == upper) {
            return sorted[lower];
        }
        double fraction = rank - lower;
        return sorted[lower] + (sorted[upper] - sorted[lower]) * fraction;
    }

    /**
     * Centered rolling mean. Positions whose window does not fit in the series are NaN.
     */
    public static double[] rollingMean(double[] series, int window) {
        double[] out = new double[series.length];
        for (int i = 0; i < series.length; i++) {
            int start = windowStart(i, window);
            int end = start + window - 1;
            if (start < 0 || end >= series.length) {
                out[i] = Double.NaN;
            } else {
                out[i] = mean(Arrays.copyOfRange(series, start, end + 1));
            }
        }
        return out;
    }

    /**
     * Centered rolling sample standard deviation, aligned like {@link #rollingMean(double[], int)}.
     */
    public static double[] rollingStd(double[] series, int window) {
        double[] out = new double[series.length];
        for (int i = 0; i < series.length; i++) {
            int start = windowStart(i, window);
            int end = start + window - 1;
            if (start < 0 || end >= series.length) {
                out[i] = Double.NaN;
            } else {
                out[i] = sampleStd(Arrays.copyOfRange(series, start, end + 1));
            }
        }
        return out;
    }

    /**
     * First index of the centered window for position {@code i}; for even windows the extra
     * element sits before the center.
     */
    public static int windowStart(int i, int window) {
        return i + (window - 1) / 2 - window + 1;
    }
}
