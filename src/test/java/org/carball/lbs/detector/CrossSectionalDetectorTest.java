package org.carball.lbs.detector;

import org.carball.lbs.config.DetectionConfig;
import org.carball.lbs.model.anomaly.AnomalyFinding;
import org.carball.lbs.model.anomaly.AnomalyType;
import org.carball.lbs.model.anomaly.DetectionResult;
import org.carball.lbs.model.anomaly.DetectionStatus;
import org.carball.lbs.model.anomaly.Severity;
import org.carball.lbs.model.data.AggregateRow;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.assertj.core.api.Assertions.within;

class CrossSectionalDetectorTest {

    private static final String DIMENSION = "ProductKey";

    private DetectionConfig config;
    private CrossSectionalDetector detector;

    @BeforeEach
    void setUp() {
        config = DetectionConfig.defaults();
        detector = new CrossSectionalDetector(config);
    }

    @Test
    void shouldFlagOnlyTheExtremeGroupWithZScore() {
        // Given
        List<AggregateRow> rows = List.of(
                group("A", 10), group("B", 12), group("C", 11), group("D", 9), group("E", 1000));

        // When
        DetectionResult result = detector.detectZScore(rows, DIMENSION, 3.0, Map.of());

        // Then
        assertThat(result.getStatus()).isEqualTo(DetectionStatus.COMPLETED);
        assertThat(result.getFindings()).extracting(AnomalyFinding::getIdentifier).containsExactly("E");
        AnomalyFinding finding = result.getFindings().get(0);
        assertThat(finding.getType()).isEqualTo(AnomalyType.SPIKE);
        assertThat(finding.getSeverity()).isEqualTo(Severity.HIGH);
        assertThat(finding.getExpectedValue()).isCloseTo(10.5, within(1e-9));
        assertThat(finding.getRule().statistic()).isEqualTo("|zscore|");
    }

    @Test
    void shouldReturnFindingsThatCannotBeModified() {
        // Given
        List<AggregateRow> rows = List.of(
                group("A", 10), group("B", 12), group("C", 11), group("D", 9), group("E", 1000));

        // When
        DetectionResult result = detector.detectZScore(rows, DIMENSION, 3.0, Map.of());

        // Then
        assertThatThrownBy(() -> result.getFindings().clear()).isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> result.getParameters().put("threshold", 1.0))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThat(result.getFindings()).hasSize(1);
    }

    @Test
    void shouldFlagTenSigmaOutlierAndNothingInsideOneSigma() {
        // Given - 20 background samples with mean 100
        List<AggregateRow> rows = new ArrayList<>();
        double[] offsets = {-2, -1, 0, 1, 2};
        for (int i = 0; i < 20; i++) {
            rows.add(group("G" + i, 100 + offsets[i % 5]));
        }
        double std = Math.sqrt(40.0 / 19.0);
        rows.add(group("OUT", 100 + 10 * std));

        // When
        DetectionResult result = detector.detectZScore(rows, DIMENSION, 3.0, Map.of());

        // Then
        assertThat(result.getFindings()).hasSize(1);
        assertThat(result.getFindings().get(0).getIdentifier()).isEqualTo("OUT");
        assertThat(result.getFindings().get(0).getZscore()).isCloseTo(10.0, within(1e-6));
    }

    @Test
    void shouldNotFlagAnythingWithFewerThanThreeGroups() {
        // Given
        List<AggregateRow> rows = List.of(group("A", 10), group("B", 10_000));

        // When
        DetectionResult result = detector.detectZScore(rows, DIMENSION, 3.0, Map.of());

        // Then
        assertThat(result.getFindings()).isEmpty();
        assertThat(result.getStatistics().getCount()).isEqualTo(2);
    }

    @Test
    void shouldDropGroupsBelowMinimumRecordsAndMissingMetrics() {
        // Given
        List<AggregateRow> rows = List.of(
                group("A", 10),
                AggregateRow.ofGroup(DIMENSION, "B", "B", 50.0, 2),
                AggregateRow.ofGroup(DIMENSION, "C", "C", null, 20),
                AggregateRow.ofGroup(DIMENSION, "A", "A", Double.NaN, 20));

        // When
        List<CrossSectionalDetector.Group> groups = detector.aggregate(rows);

        // Then
        assertThat(groups).extracting(g -> g.key).containsExactly("A");
        assertThat(groups.get(0).total).isEqualTo(10.0);
    }

    @Test
    void shouldReturnInsufficientDataForEmptyInput() {
        // When
        DetectionResult result = detector.detectIqr(List.of(), DIMENSION, 1.5, Map.of());

        // Then
        assertThat(result.getStatus()).isEqualTo(DetectionStatus.INSUFFICIENT_DATA);
        assertThat(result.getReason()).isEqualTo("No ProductKey groups with at least 5 records");
        assertThat(result.getFindings()).isEmpty();
        assertThat(result.getStatistics().getCount()).isZero();
        assertThat(result.getStatistics().getMean()).isZero();
    }

    @Test
    void shouldFlagValuesJustOutsideTheIqrFence() {
        // Given - nine groups, so Q1 and Q3 do not depend on the largest value
        // Q1 = 12, Q3 = 16, IQR = 4, upper fence = 16 + 1.5 * 4 = 22
        DetectionResult above = detector.detectIqr(iqrGroups(22.001), DIMENSION, 1.5, Map.of());
        DetectionResult below = detector.detectIqr(iqrGroups(21.999), DIMENSION, 1.5, Map.of());

        // Then
        assertThat(above.getStatistics().getThresholds())
                .containsEntry("q1", 12.0)
                .containsEntry("q3", 16.0)
                .containsEntry("lower_bound", 6.0)
                .containsEntry("upper_bound", 22.0);
        assertThat(above.getFindings()).extracting(AnomalyFinding::getIdentifier).containsExactly("X");
        assertThat(above.getFindings().get(0).getExpectedValue()).isEqualTo(16.0);
        assertThat(above.getFindings().get(0).getSeverity()).isEqualTo(Severity.MEDIUM);
        assertThat(below.getFindings()).isEmpty();
    }

    @Test
    void shouldRateIqrOutlierHighBeyondAnotherFullRange() {
        // When - 26 is the upper fence plus one IQR
        DetectionResult result = detector.detectIqr(iqrGroups(26.5), DIMENSION, 1.5, Map.of());

        // Then
        assertThat(result.getFindings()).singleElement()
                .satisfies(finding -> assertThat(finding.getSeverity()).isEqualTo(Severity.HIGH));
    }

    @Test
    void shouldRequireTenGroupsForIsolationForest() {
        // Given
        List<AggregateRow> rows = new ArrayList<>();
        for (int i = 0; i < 9; i++) {
            rows.add(group("G" + i, 100 + i));
        }

        // When
        DetectionResult result = detector.detectIsolationForest(rows, DIMENSION, Map.of());

        // Then
        assertThat(result.getStatus()).isEqualTo(DetectionStatus.INSUFFICIENT_DATA);
        assertThat(result.getReason()).isEqualTo("Isolation forest needs at least 10 groups, got 9");
        assertThat(result.getFindings()).isEmpty();
    }

    @Test
    void shouldFindIsolatedGroupReproducibly() {
        // Given
        List<AggregateRow> rows = new ArrayList<>();
        for (int i = 0; i < 19; i++) {
            rows.add(group("G" + i, 100 + i));
        }
        rows.add(group("FAR", 10_000));

        // When
        DetectionResult first = detector.detectIsolationForest(rows, DIMENSION, Map.of());
        DetectionResult second = new CrossSectionalDetector(config).detectIsolationForest(rows, DIMENSION, Map.of());

        // Then
        assertThat(first.getFindings()).isNotEmpty();
        assertThat(first.getFindings().get(0).getIdentifier()).isEqualTo("FAR");
        assertThat(first.getFindings().get(0).getType()).isEqualTo(AnomalyType.OUTLIER);
        assertThat(first.getFindings().get(0).getExpectedValue()).isCloseTo(109.5, within(1e-9));
        assertThat(second.getFindings())
                .extracting(AnomalyFinding::getIdentifier, AnomalyFinding::getAnomalyScore)
                .containsExactlyElementsOf(first.getFindings().stream()
                        .map(f -> tuple(f.getIdentifier(), f.getAnomalyScore()))
                        .toList());
    }

    private static List<AggregateRow> iqrGroups(double candidate) {
        List<AggregateRow> rows = new ArrayList<>();
        for (int value = 10; value <= 17; value++) {
            rows.add(group("V" + value, value));
        }
        rows.add(group("X", candidate));
        return rows;
    }

    private static AggregateRow group(String key, double total) {
        return AggregateRow.ofGroup(DIMENSION, key, key, total, 10);
    }
}
