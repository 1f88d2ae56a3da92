package org.carball.lbs.detector;

import lombok.Getter;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.Month;
import java.time.temporal.ChronoUnit;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Additive daily model: least-squares linear trend plus day-of-week effects, and month-of-year
 * effects when the history covers a full year. Prediction intervals combine the residual spread
 * with the leverage of the trend at the predicted point.
 */
@Getter
public class SeasonalTrendModel {

    private final LocalDate origin;
    private final int points;
    private final double intercept;
    private final double slope;
    private final double meanT;
    private final double sxx;
    private final double residualStd;
    private final boolean weeklySeasonality;
    private final boolean yearlySeasonality;
    private final Map<DayOfWeek, Double> weeklyEffects;
    private final Map<Month, Double> monthlyEffects;

    private SeasonalTrendModel(LocalDate origin, int points, double intercept, double slope, double meanT,
                               double sxx, double residualStd, boolean weeklySeasonality, boolean yearlySeasonality,
                               Map<DayOfWeek, Double> weeklyEffects, Map<Month, Double> monthlyEffects) {
        this.origin = origin;
        this.points = points;
        this.intercept = intercept;
        this.slope = slope;
        this.meanT = meanT;
        this.sxx = sxx;
        this.residualStd = residualStd;
        this.weeklySeasonality = weeklySeasonality;
        this.yearlySeasonality = yearlySeasonality;
        this.weeklyEffects = weeklyEffects;
        this.monthlyEffects = monthlyEffects;
    }

    /**
     * Fits the model on a date-ordered series of at least three points.
     */
    public static SeasonalTrendModel fit(List<LocalDate> dates, double[] values) {
        int n = values.length;
        if (n < 3 || dates.size() != n) {
            throw new IllegalArgumentException("Need at least 3 aligned points to fit a trend, got " + n);
        }
        LocalDate origin = dates.get(0);
        double[] t = new double[n];
        for (int i = 0; i < n; i++) {
            t[i] = ChronoUnit.DAYS.between(origin, dates.get(i));
        }

        double meanT = 0.0;
        double meanY = 0.0;
        for (int i = 0; i < n; i++) {
            meanT += t[i];
            meanY += values[i];
        }
        meanT /= n;
        meanY /= n;
        double sxx = 0.0;
        double sxy = 0.0;
        for (int i = 0; i < n; i++) {
            sxx += (t[i] - meanT) * (t[i] - meanT);
            sxy += (t[i] - meanT) * (values[i] - meanY);
        }
        double slope = sxx == 0 ? 0.0 : sxy / sxx;
        double intercept = meanY - slope * meanT;

        double[] residuals = new double[n];
        for (int i = 0; i < n; i++) {
            residuals[i] = values[i] - (intercept + slope * t[i]);
        }

        long span = ChronoUnit.DAYS.between(origin, dates.get(n - 1));
        boolean weekly = n >= 14;
        Map<DayOfWeek, Double> weeklyEffects = new EnumMap<>(DayOfWeek.class);
        if (weekly) {
            Map<DayOfWeek, double[]> sums = new EnumMap<>(DayOfWeek.class);
            for (int i = 0; i < n; i++) {
                double[] acc = sums.computeIfAbsent(dates.get(i).getDayOfWeek(), d -> new double[2]);
                acc[0] += residuals[i];
                acc[1]++;
            }
            centerEffects(sums, weeklyEffects);
            for (int i = 0; i < n; i++) {
                residuals[i] -= weeklyEffects.getOrDefault(dates.get(i).getDayOfWeek(), 0.0);
            }
        }

        boolean yearly = span >= 365;
        Map<Month, Double> monthlyEffects = new EnumMap<>(Month.class);
        if (yearly) {
            Map<Month, double[]> sums = new EnumMap<>(Month.class);
            for (int i = 0; i < n; i++) {
                double[] acc = sums.computeIfAbsent(dates.get(i).getMonth(), m -> new double[2]);
                acc[0] += residuals[i];
                acc[1]++;
            }
            centerEffects(sums, monthlyEffects);
            for (int i = 0; i < n; i++) {
                residuals[i] -= monthlyEffects.getOrDefault(dates.get(i).getMonth(), 0.0);
            }
        }

        int parameters = 2 + (weekly ? weeklyEffects.size() - 1 : 0) + (yearly ? monthlyEffects.size() - 1 : 0);
        int dof = Math.max(1, n - parameters);
        double sse = 0.0;
        for (double r : residuals) {
            sse += r * r;
        }
        double residualStd = Math.sqrt(sse / dof);

        return new SeasonalTrendModel(origin, n, intercept, slope, meanT, sxx, residualStd,
                weekly, yearly, weeklyEffects, monthlyEffects);
    }

    public double trend(LocalDate date) {
        return intercept + slope * ChronoUnit.DAYS.between(origin, date);
    }

    public double predict(LocalDate date) {
        double value = trend(date);
        value += weeklyEffects.getOrDefault(date.getDayOfWeek(), 0.0);
        value += monthlyEffects.getOrDefault(date.getMonth(), 0.0);
        return value;
    }

    /**
     * Half-width of the prediction interval at {@code date} for the given two-sided z.
     */
    public double intervalHalfWidth(LocalDate date, double z) {
        double t = ChronoUnit.DAYS.between(origin, date);
        double leverage = sxx == 0 ? 0.0 : (t - meanT) * (t - meanT) / sxx;
        return z * residualStd * Math.sqrt(1.0 + 1.0 / points + leverage);
    }

    private static <K extends Enum<K>> void centerEffects(Map<K, double[]> sums, Map<K, Double> effects) {
        double total = 0.0;
        for (Map.Entry<K, double[]> entry : sums.entrySet()) {
            double mean = entry.getValue()[0] / entry.getValue()[1];
            effects.put(entry.getKey(), mean);
            total += mean;
        }
        double offset = total / sums.size();
        effects.replaceAll((key, value) -> value - offset);
    }
}
