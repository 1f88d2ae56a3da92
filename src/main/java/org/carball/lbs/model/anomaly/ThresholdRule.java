package org.carball.lbs.model.anomaly;

import java.util.Locale;

/**
 * The concrete comparison that made a finding anomalous, e.g. {@code |zscore| > 3.0}.
 */
public record ThresholdRule(String statistic, String comparison, double threshold, double observed) {

    public static ThresholdRule above(String statistic, double threshold, double observed) {
        return new ThresholdRule(statistic, ">", threshold, observed);
    }

    public static ThresholdRule below(String statistic, double threshold, double observed) {
        return new ThresholdRule(statistic, "<", threshold, observed);
    }

    public static ThresholdRule atLeast(String statistic, double threshold, double observed) {
        return new ThresholdRule(statistic, ">=", threshold, observed);
    }

    public String describe() {
        return String.format(Locale.US, "%s %s %.4g (observed %.4g)", statistic, comparison, threshold, observed);
    }
}
