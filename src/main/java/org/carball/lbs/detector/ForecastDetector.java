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
import org.carball.lbs.model.anomaly.ForecastPoint;
import org.carball.lbs.model.anomaly.Severity;
import org.carball.lbs.model.anomaly.ThresholdRule;
import org.carball.lbs.model.data.AggregateRow;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Fits a {@link SeasonalTrendModel} to the daily history, flags days outside the prediction
 * band and projects the band forward.
 */
@Slf4j
public class ForecastDetector {

    private final DetectionConfig.ForecastSettings settings;

    public ForecastDetector(DetectionConfig.ForecastSettings settings) {
        this.settings = settings;
    }

    public DetectionResult detect(List<AggregateRow> rows, String metric, int lookbackDays, int forecastDays,
                                  Map<String, Object> parameters) {
        if (!settings.isEnabled()) {
            return DetectionResult.empty(DetectionMethod.FORECAST, parameters, DetectionStatus.UNAVAILABLE,
                    "Forecast detection is disabled in configuration");
        }

        List<AggregateRow> series = rows.stream()
                .filter(row -> row.bucket() != null && row.hasMetric())
                .sorted(Comparator.comparing(AggregateRow::bucket))
                .toList();
        if (series.size() < settings.getMinPoints()) {
            return DetectionResult.empty(DetectionMethod.FORECAST, parameters, DetectionStatus.INSUFFICIENT_DATA,
                    String.format("Insufficient data: %d days (need at least %d)", series.size(), settings.getMinPoints()));
        }

        List<LocalDate> dates = series.stream().map(AggregateRow::bucket).toList();
        double[] values = series.stream().mapToDouble(AggregateRow::metricValue).toArray();
        SeasonalTrendModel model = SeasonalTrendModel.fit(dates, values);
        double z = settings.getIntervalZ();

        List<AnomalyFinding> findings = new ArrayList<>();
        List<Double> deviations = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            LocalDate date = dates.get(i);
            double actual = values[i];
            double predicted = model.predict(date);
            double halfWidth = model.intervalHalfWidth(date, z);
            double lower = predicted - halfWidth;
            double upper = predicted + halfWidth;
            if (actual <= upper && actual >= lower) {
                continue;
            }

            boolean spike = actual > upper;
            Double deviationPct = predicted != 0 ? (actual - predicted) / predicted * 100 : null;
            if (deviationPct != null) {
                deviations.add(Math.abs(deviationPct));
            }
            Severity severity = Severity.MEDIUM;
            if (deviationPct != null) {
                if (spike && deviationPct > settings.getSpikeHighPct()) {
                    severity = Severity.HIGH;
                } else if (!spike && deviationPct < settings.getDropHighPct()) {
                    severity = Severity.HIGH;
                }
            }

            findings.add(AnomalyFinding.builder()
                    .method(DetectionMethod.FORECAST)
                    .identifier(date.toString())
                    .label(date.toString())
                    .date(date)
                    .observedValue(actual)
                    .expectedValue(predicted)
                    .deviation(actual - predicted)
                    .deviationPct(deviationPct)
                    .lowerBound(lower)
                    .upperBound(upper)
                    .trend(model.trend(date))
                    .recordCount(series.get(i).recordCount())
                    .type(spike ? AnomalyType.SPIKE : AnomalyType.DROP)
                    .severity(severity)
                    .rule(spike ? ThresholdRule.above("value", upper, actual) : ThresholdRule.below("value", lower, actual))
                    .description(describe(date, metric, spike, severity, actual, predicted, deviationPct, lower, upper,
                            model.trend(date)))
                    .build());
        }
        findings.sort(Comparator.comparing(AnomalyFinding::getDate).reversed());

        List<ForecastPoint> forecast = new ArrayList<>();
        LocalDate last = dates.get(dates.size() - 1);
        for (int d = 1; d <= forecastDays; d++) {
            LocalDate date = last.plusDays(d);
            double predicted = model.predict(date);
            double halfWidth = model.intervalHalfWidth(date, z);
            forecast.add(new ForecastPoint(date, predicted, predicted - halfWidth, predicted + halfWidth, model.trend(date)));
        }

        long spikes = findings.stream().filter(f -> f.getType() == AnomalyType.SPIKE).count();
        double[] absDeviations = Statistics.finite(deviations);
        log.debug("Forecast on {}: {} days, slope {}/day, residual std {}, {} anomalies",
                metric, values.length, model.getSlope(), model.getResidualStd(), findings.size());

        return DetectionResult.builder()
                .method(DetectionMethod.FORECAST)
                .parameters(parameters)
                .findings(findings)
                .forecast(forecast)
                .statistics(DetectionStatistics.from(Statistics.describe(values))
                        .threshold("interval_z", z)
                        .threshold("spike_high_pct", settings.getSpikeHighPct())
                        .threshold("drop_high_pct", settings.getDropHighPct())
                        .extra("lookback_days", lookbackDays)
                        .extra("forecast_days", forecastDays)
                        .extra("anomaly_rate_pct", 100.0 * findings.size() / values.length)
                        .extra("spike_count", spikes)
                        .extra("drop_count", findings.size() - spikes)
                        .extra("avg_abs_deviation_pct", Statistics.mean(absDeviations))
                        .extra("trend_slope_per_day", model.getSlope())
                        .extra("residual_std", model.getResidualStd())
                        .extra("weekly_seasonality", model.isWeeklySeasonality())
                        .extra("yearly_seasonality", model.isYearlySeasonality())
                        .build())
                .build();
    }

    private static String describe(LocalDate date, String metric, boolean spike, Severity severity, double actual,
                                   double predicted, Double deviationPct, double lower, double upper, double trend) {
        String magnitude = deviationPct == null ? "" : String.format(Locale.US, " by %.1f%%", Math.abs(deviationPct));
        return String.format(Locale.US,
                "%s severity %s detected on %s. The %s %s%s. Actual: %,.2f, Forecasted: %,.2f (prediction interval: %,.2f - %,.2f). Current trend: %,.2f.",
                severity.getDisplayText(), spike ? "spike" : "drop", date, metric,
                spike ? "exceeded forecast" : "fell below forecast", magnitude, actual, predicted, lower, upper, trend);
    }
}
