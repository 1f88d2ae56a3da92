package org.carball.lbs.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Thresholds and defaults for every detection strategy.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Slf4j
public class DetectionConfig {

    // Cross-sectional
    @Builder.Default
    @JsonProperty("zscore_threshold")
    private double zscoreThreshold = 3.0;

    @Builder.Default
    @JsonProperty("zscore_high_severity")
    private double zscoreHighSeverity = 4.0;

    @Builder.Default
    @JsonProperty("iqr_multiplier")
    private double iqrMultiplier = 1.5;

    @Builder.Default
    @JsonProperty("min_records_per_group")
    private long minRecordsPerGroup = 5;

    // Time series
    @Builder.Default
    @JsonProperty("time_series_band_multiplier")
    private double timeSeriesBandMultiplier = 2.0;

    @Builder.Default
    @JsonProperty("time_series_max_window")
    private int timeSeriesMaxWindow = 7;

    @Builder.Default
    @JsonProperty("time_series_high_zscore")
    private double timeSeriesHighZscore = 3.0;

    @Builder.Default
    @JsonProperty("time_series_lookback_days")
    private int timeSeriesLookbackDays = 30;

    // Period comparison
    @Builder.Default
    @JsonProperty("comparative_threshold_pct")
    private double comparativeThresholdPct = 20.0;

    // Day on day
    @Builder.Default
    @JsonProperty("day_on_day_threshold_pct")
    private double dayOnDayThresholdPct = 20.0;

    @Builder.Default
    @JsonProperty("day_on_day_high_pct")
    private double dayOnDayHighPct = 50.0;

    @Builder.Default
    @JsonProperty("day_on_day_medium_pct")
    private double dayOnDayMediumPct = 30.0;

    @Builder.Default
    @JsonProperty("day_on_day_top_n")
    private int dayOnDayTopN = 50;

    @Builder.Default
    @JsonProperty("day_on_day_lookback_days")
    private int dayOnDayLookbackDays = 30;

    // Composite battery
    @Builder.Default
    @JsonProperty("primary_dimension")
    private String primaryDimension = "ProductKey";

    @Builder.Default
    @JsonProperty("secondary_dimension")
    private String secondaryDimension = "CustomerKey";

    @Builder.Default
    @JsonProperty("isolation_forest")
    private IsolationForestSettings isolationForest = new IsolationForestSettings();

    @Builder.Default
    @JsonProperty("forecast")
    private ForecastSettings forecast = new ForecastSettings();

    @Builder.Default
    @JsonProperty("profile_name")
    private String profileName = "default";

    public static DetectionConfig defaults() {
        return new DetectionConfig();
    }

    /**
     * Validates the configuration and logs warnings for values that are likely to misbehave.
     */
    public void validate() {
        if (zscoreThreshold <= 0) {
            log.warn("Z-score threshold ({}) should be positive", zscoreThreshold);
        }
        if (zscoreHighSeverity < zscoreThreshold) {
            log.warn("High severity z-score ({}) should not be below the detection threshold ({})",
                    zscoreHighSeverity, zscoreThreshold);
        }
        if (iqrMultiplier <= 0) {
            log.warn("IQR multiplier ({}) should be positive", iqrMultiplier);
        }
        if (timeSeriesMaxWindow < 2) {
            log.warn("Time series window ({}) below 2 disables the moving window", timeSeriesMaxWindow);
        }
        if (dayOnDayHighPct <= dayOnDayMediumPct) {
            log.warn("Day-on-day high severity ({}) should be greater than medium severity ({})",
                    dayOnDayHighPct, dayOnDayMediumPct);
        }
        if (dayOnDayThresholdPct > dayOnDayMediumPct) {
            log.warn("Day-on-day threshold ({}) is above the medium severity cut ({}); low severity will never be reported",
                    dayOnDayThresholdPct, dayOnDayMediumPct);
        }
        if (isolationForest.getContamination() <= 0 || isolationForest.getContamination() >= 0.5) {
            log.warn("Isolation forest contamination ({}) should be in (0, 0.5)", isolationForest.getContamination());
        }
        if (forecast.getMinPoints() < 14) {
            log.warn("Forecast minimum points ({}) below 14 cannot estimate weekly seasonality", forecast.getMinPoints());
        }

        log.debug("Using detection thresholds - zscore: {}, iqr: {}, comparative: {}%, day-on-day: {}%, profile: {}",
                zscoreThreshold, iqrMultiplier, comparativeThresholdPct, dayOnDayThresholdPct, profileName);
    }

    @JsonIgnore
    public String getConfigurationSummary() {
        return String.format("Profile: %s | Z-score: %.2f | IQR: %.2f | Comparative: %.0f%% | Day-on-day: %.0f%% | IF seed: %d",
                profileName, zscoreThreshold, iqrMultiplier, comparativeThresholdPct,
                dayOnDayThresholdPct, isolationForest.getSeed());
    }

    @Data
    @Builder(toBuilder = true)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class IsolationForestSettings {

        @Builder.Default
        @JsonProperty("trees")
        private int trees = 100;

        @Builder.Default
        @JsonProperty("sample_size")
        private int sampleSize = 256;

        @Builder.Default
        @JsonProperty("contamination")
        private double contamination = 0.1;

        @Builder.Default
        @JsonProperty("seed")
        private long seed = 42L;

        @Builder.Default
        @JsonProperty("min_samples")
        private int minSamples = 10;
    }

    @Data
    @Builder(toBuilder = true)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ForecastSettings {

        @Builder.Default
        @JsonProperty("enabled")
        private boolean enabled = true;

        @Builder.Default
        @JsonProperty("min_points")
        private int minPoints = 14;

        @Builder.Default
        @JsonProperty("lookback_days")
        private int lookbackDays = 90;

        @Builder.Default
        @JsonProperty("forecast_days")
        private int forecastDays = 30;

        /** Two-sided z for the prediction band (1.96 is a 95% interval). */
        @Builder.Default
        @JsonProperty("interval_z")
        private double intervalZ = 1.96;

        @Builder.Default
        @JsonProperty("spike_high_pct")
        private double spikeHighPct = 100.0;

        @Builder.Default
        @JsonProperty("drop_high_pct")
        private double dropHighPct = -50.0;
    }
}
