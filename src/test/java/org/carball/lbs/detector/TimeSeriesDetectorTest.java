package org.carball.lbs.detector;

import org.carball.lbs.config.DetectionConfig;
import org.carball.lbs.model.anomaly.AnomalyFinding;
import org.carball.lbs.model.anomaly.AnomalyType;
import org.carball.lbs.model.anomaly.DetectionResult;
import org.carball.lbs.model.anomaly.DetectionStatus;
import org.carball.lbs.model.anomaly.Granularity;
import org.carball.lbs.model.anomaly.Severity;
import org.carball.lbs.model.data.AggregateRow;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class TimeSeriesDetectorTest {

    private static final LocalDate START = LocalDate.of(2013, 6, 1);

    private final TimeSeriesDetector detector = new TimeSeriesDetector(DetectionConfig.defaults());

    @Test
    void shouldFlagSingleSpikeInFlatSeries() {
        // Given
        List<AggregateRow> rows = flatSeries(30, 100.0);
        rows.set(14, AggregateRow.ofBucket(START.plusDays(14), 500.0, 40));

        // When
        DetectionResult result = detector.detect(rows, "sales", Granularity.DAILY, 30, Map.of());

        // Then
        assertThat(result.getStatus()).isEqualTo(DetectionStatus.COMPLETED);
        assertThat(result.getFindings()).hasSize(1);
        AnomalyFinding finding = result.getFindings().get(0);
        assertThat(finding.getDate()).isEqualTo(START.plusDays(14));
        assertThat(finding.getType()).isEqualTo(AnomalyType.SPIKE);
        assertThat(finding.getSeverity()).isEqualTo(Severity.HIGH);
        assertThat(finding.getExpectedValue()).isCloseTo(100.0, within(1e-9));
        assertThat(finding.getDeviation()).isCloseTo(400.0, within(1e-9));
        assertThat(finding.getUpperBound()).isLessThan(500.0);
        assertThat(result.getStatistics().getThresholds()).containsEntry("window", 7.0);
    }

    @Test
    void shouldNotFlagConstantSeries() {
        // When
        DetectionResult result = detector.detect(flatSeries(30, 250.0), "sales", Granularity.DAILY, 30, Map.of());

        // Then
        assertThat(result.getFindings()).isEmpty();
        assertThat(result.getStatistics().getStd()).isZero();
    }

    @Test
    void shouldIgnoreRowsWithoutMetricAndSortByBucket() {
        // Given
        List<AggregateRow> rows = new ArrayList<>(flatSeries(12, 100.0));
        rows.add(0, AggregateRow.ofBucket(START.plusDays(40), null, 0));
        rows.add(AggregateRow.ofBucket(START.plusDays(41), Double.NaN, 0));

        // When
        DetectionResult result = detector.detect(rows, "sales", Granularity.DAILY, 60, Map.of());

        // Then
        assertThat(result.getStatistics().getCount()).isEqualTo(12);
        assertThat(result.getStatistics().getExtras()).containsEntry("excluded_points", 2);
    }

    @Test
    void shouldExplainEmptyHistory() {
        // When
        DetectionResult result = detector.detect(List.of(), "sales", Granularity.MONTHLY, 365, Map.of());

        // Then
        assertThat(result.getStatus()).isEqualTo(DetectionStatus.INSUFFICIENT_DATA);
        assertThat(result.getReason()).isEqualTo("No monthly data found in the last 365 days");
        assertThat(result.getFindings()).isEmpty();
        assertThat(result.getStatistics().getMean()).isZero();
    }

    @Test
    void shouldUseWholeSeriesBandForShortHistory() {
        // Given - five points give a window below two, so one global band applies
        List<AggregateRow> rows = List.of(
                AggregateRow.ofBucket(START, 100.0, 1),
                AggregateRow.ofBucket(START.plusMonths(1), 101.0, 1),
                AggregateRow.ofBucket(START.plusMonths(2), 99.0, 1),
                AggregateRow.ofBucket(START.plusMonths(3), 100.0, 1),
                AggregateRow.ofBucket(START.plusMonths(4), 100.0, 1));

        // When
        DetectionResult result = detector.detect(rows, "sales", Granularity.MONTHLY, 365, Map.of());

        // Then
        assertThat(result.getFindings()).isEmpty();
        assertThat(result.getStatistics().getExtras()).containsEntry("rolling_window", false);
        assertThat(result.getStatistics().getThresholds()).containsEntry("window", 5.0);
    }

    private static List<AggregateRow> flatSeries(int days, double value) {
        List<AggregateRow> rows = new ArrayList<>();
        for (int i = 0; i < days; i++) {
            rows.add(AggregateRow.ofBucket(START.plusDays(i), value, 40));
        }
        return rows;
    }
}
