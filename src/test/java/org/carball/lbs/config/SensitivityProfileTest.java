package org.carball.lbs.config;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

public class SensitivityProfileTest {

    @Test
    void shouldLeaveBalancedThresholdsUnchanged() {
        // When
        DetectionConfig config = SensitivityProfile.BALANCED.applyTo(DetectionConfig.defaults());

        // Then
        assertThat(config.getZscoreThreshold()).isEqualTo(3.0);
        assertThat(config.getIqrMultiplier()).isEqualTo(1.5);
        assertThat(config.getProfileName()).isEqualTo("balanced");
    }

    @Test
    void shouldRaiseThresholdsForStrictProfile() {
        // When
        DetectionConfig config = SensitivityProfile.STRICT.applyTo(DetectionConfig.defaults());

        // Then
        assertThat(config.getZscoreThreshold()).isCloseTo(4.05, within(1e-9));
        assertThat(config.getZscoreHighSeverity()).isCloseTo(5.4, within(1e-9));
        assertThat(config.getIqrMultiplier()).isCloseTo(2.25, within(1e-9));
        assertThat(config.getComparativeThresholdPct()).isCloseTo(30.0, within(1e-9));
        assertThat(config.getDayOnDayThresholdPct()).isCloseTo(30.0, within(1e-9));
    }

    @Test
    void shouldLowerThresholdsAndRecordFloorForDiscovery() {
        // When
        DetectionConfig config = SensitivityProfile.DISCOVERY.applyTo(DetectionConfig.defaults());

        // Then
        assertThat(config.getZscoreThreshold()).isCloseTo(1.8, within(1e-9));
        assertThat(config.getMinRecordsPerGroup()).isEqualTo(1);
        assertThat(config.getIsolationForest().getContamination()).isEqualTo(0.15);
        assertThat(config.getIsolationForest().getSeed()).isEqualTo(42L);
        assertThat(config.getProfileName()).isEqualTo("discovery");
    }

    @Test
    void shouldNotModifyBaseConfiguration() {
        // Given
        DetectionConfig base = DetectionConfig.defaults();

        // When
        SensitivityProfile.SENSITIVE.applyTo(base);

        // Then
        assertThat(base.getZscoreThreshold()).isEqualTo(3.0);
        assertThat(base.getProfileName()).isEqualTo("default");
    }

    @Test
    void shouldFindProfileIgnoringCase() {
        assertThat(SensitivityProfile.fromName("Sensitive")).isEqualTo(SensitivityProfile.SENSITIVE);
        assertThatThrownBy(() -> SensitivityProfile.fromName("lenient"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Unknown sensitivity profile: lenient. Available profiles: strict, balanced, sensitive, discovery");
    }

    @Test
    void shouldListProfilesInHelp() {
        assertThat(SensitivityProfile.getProfileHelp())
                .contains("strict")
                .contains("Surface every candidate for manual review")
                .contains("--profile <name>");
    }
}
