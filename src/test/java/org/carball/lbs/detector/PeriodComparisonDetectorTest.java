package org.carball.lbs.detector;

import org.carball.lbs.model.anomaly.AnomalyFinding;
import org.carball.lbs.model.anomaly.AnomalyType;
import org.carball.lbs.model.anomaly.ComparisonType;
import org.carball.lbs.model.anomaly.DetectionResult;
import org.carball.lbs.model.anomaly.DetectionStatus;
import org.carball.lbs.model.anomaly.Severity;
import org.carball.lbs.model.data.AggregateRow;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class PeriodComparisonDetectorTest {

    private final PeriodComparisonDetector detector = new PeriodComparisonDetector();

    @Test
    void shouldCompareMonthsWithSameMonthOfPreviousYear() {
        // Given
        List<AggregateRow> rows = List.of(
                month(2012, 1, 100.0), month(2012, 2, 100.0),
                month(2013, 1, 150.0), month(2013, 2, 105.0));

        // When
        DetectionResult result = detector.detect(rows, "sales", ComparisonType.YOY, 20.0, Map.of());

        // Then
        assertThat(result.getStatus()).isEqualTo(DetectionStatus.COMPLETED);
        assertThat(result.getFindings()).hasSize(1);
        AnomalyFinding finding = result.getFindings().get(0);
        assertThat(finding.getIdentifier()).isEqualTo("2013-01");
        assertThat(finding.getLabel()).isEqualTo("January 2013");
        assertThat(finding.getPreviousDate()).isEqualTo(LocalDate.of(2012, 1, 1));
        assertThat(finding.getDeviationPct()).isCloseTo(50.0, within(1e-9));
        assertThat(finding.getType()).isEqualTo(AnomalyType.INCREASE);
        assertThat(finding.getSeverity()).isEqualTo(Severity.HIGH);
        assertThat(finding.getDescription()).isEqualTo("January 2013 sales increased by 50.0% year over year (100.00 to 150.00)");
        assertThat(result.getStatistics().getExtras())
                .containsEntry("periods", 4)
                .containsEntry("excluded_periods", 2);
    }

    @Test
    void shouldExcludePeriodsWithZeroOrMissingCounterpart() {
        // Given - April has no March and February compares against a zero January
        List<AggregateRow> rows = List.of(
                month(2013, 1, 0.0), month(2013, 2, 500.0), month(2013, 4, 100.0), month(2013, 5, 70.0));

        // When
        DetectionResult result = detector.detect(rows, "sales", ComparisonType.MOM, 20.0, Map.of());

        // Then
        assertThat(result.getFindings()).singleElement().satisfies(finding -> {
            assertThat(finding.getIdentifier()).isEqualTo("2013-05");
            assertThat(finding.getType()).isEqualTo(AnomalyType.DECREASE);
            assertThat(finding.getSeverity()).isEqualTo(Severity.MEDIUM);
        });
        assertThat(result.getStatistics().getExtras()).containsEntry("excluded_periods", 3);
    }

    @Test
    void shouldRollMonthsUpIntoQuarters() {
        // Given
        List<AggregateRow> rows = List.of(
                month(2013, 1, 50.0), month(2013, 2, 30.0), month(2013, 3, 20.0),
                month(2013, 4, 100.0), month(2013, 5, 100.0), month(2013, 6, 100.0));

        // When
        DetectionResult result = detector.detect(rows, "sales", ComparisonType.QOQ, 20.0, Map.of());

        // Then
        assertThat(result.getFindings()).singleElement().satisfies(finding -> {
            assertThat(finding.getIdentifier()).isEqualTo("2013-Q2");
            assertThat(finding.getLabel()).isEqualTo("Q2 2013");
            assertThat(finding.getObservedValue()).isEqualTo(300.0);
            assertThat(finding.getPreviousValue()).isEqualTo(100.0);
            assertThat(finding.getDeviationPct()).isCloseTo(200.0, within(1e-9));
        });
    }

    @Test
    void shouldListFindingsNewestFirst() {
        // Given
        List<AggregateRow> rows = List.of(
                month(2013, 1, 100.0), month(2013, 2, 200.0), month(2013, 3, 400.0), month(2013, 4, 800.0));

        // When
        DetectionResult result = detector.detect(rows, "sales", ComparisonType.MOM, 20.0, Map.of());

        // Then
        assertThat(result.getFindings()).extracting(AnomalyFinding::getIdentifier)
                .containsExactly("2013-04", "2013-03", "2013-02");
    }

    @Test
    void shouldReportInsufficientDataWithoutAnyCounterpart() {
        // Given
        List<AggregateRow> rows = List.of(month(2013, 1, 100.0), month(2013, 2, 120.0));

        // When
        DetectionResult result = detector.detect(rows, "sales", ComparisonType.YOY, 20.0, Map.of());

        // Then
        assertThat(result.getStatus()).isEqualTo(DetectionStatus.INSUFFICIENT_DATA);
        assertThat(result.getReason()).isEqualTo("No period has a prior year over year counterpart to compare with");
        assertThat(result.getFindings()).isEmpty();
    }

    @Test
    void shouldReportInsufficientDataForEmptyInput() {
        // When
        DetectionResult result = detector.detect(List.of(), "sales", ComparisonType.MOM, 20.0, Map.of());

        // Then
        assertThat(result.getStatus()).isEqualTo(DetectionStatus.INSUFFICIENT_DATA);
        assertThat(result.getReason()).isEqualTo("No periods with data to compare");
    }

    private static AggregateRow month(int year, int month, double value) {
        return AggregateRow.ofBucket(LocalDate.of(year, month, 1), value, 10);
    }
}
