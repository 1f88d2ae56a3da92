package org.carball.lbs.config;

import lombok.Getter;

/**
 * Named presets that scale the detection thresholds. Lower multipliers flag more.
 */
@Getter
public enum SensitivityProfile {

    STRICT("strict", "Only report pronounced anomalies", 1.35, 1.5, 1.5),

    BALANCED("balanced", "Default thresholds suitable for most warehouses", 1.0, 1.0, 1.0),

    SENSITIVE("sensitive", "Report moderate deviations as well", 0.8, 0.75, 0.75),

    DISCOVERY("discovery", "Surface every candidate for manual review", 0.6, 0.5, 0.5) {
        @Override
        public DetectionConfig applyTo(DetectionConfig base) {
            return super.applyTo(base).toBuilder()
                    .minRecordsPerGroup(1)
                    .isolationForest(base.getIsolationForest().toBuilder().contamination(0.15).build())
                    .build();
        }
    };

    private final String name;
    private final String description;
    private final double zscoreMultiplier;
    private final double iqrMultiplier;
    private final double percentMultiplier;

    SensitivityProfile(String name, String description,
                       double zscoreMultiplier, double iqrMultiplier, double percentMultiplier) {
        this.name = name;
        this.description = description;
        this.zscoreMultiplier = zscoreMultiplier;
        this.iqrMultiplier = iqrMultiplier;
        this.percentMultiplier = percentMultiplier;
    }

    /**
     * Returns a copy of {@code base} with this profile's multipliers applied.
     */
    public DetectionConfig applyTo(DetectionConfig base) {
        return base.toBuilder()
                .profileName(name)
                .zscoreThreshold(base.getZscoreThreshold() * zscoreMultiplier)
                .zscoreHighSeverity(base.getZscoreHighSeverity() * zscoreMultiplier)
                .iqrMultiplier(base.getIqrMultiplier() * iqrMultiplier)
                .comparativeThresholdPct(base.getComparativeThresholdPct() * percentMultiplier)
                .dayOnDayThresholdPct(base.getDayOnDayThresholdPct() * percentMultiplier)
                .build();
    }

    /**
     * Finds profile by name (case-insensitive).
     */
    public static SensitivityProfile fromName(String name) {
        for (SensitivityProfile profile : values()) {
            if (profile.getName().equalsIgnoreCase(name)) {
                return profile;
            }
        }
        throw new IllegalArgumentException("Unknown sensitivity profile: " + name +
                ". Available profiles: " + getAvailableProfiles());
    }

    public static String getAvailableProfiles() {
        StringBuilder sb = new StringBuilder();
        for (SensitivityProfile profile : values()) {
            if (!sb.isEmpty()) sb.append(", ");
            sb.append(profile.getName());
        }
        return sb.toString();
    }

    public static String getProfileHelp() {
        StringBuilder help = new StringBuilder("Available Sensitivity Profiles:\n\n");
        for (SensitivityProfile profile : values()) {
            help.append(String.format("  %-12s %s%n", profile.getName(), profile.getDescription()));
        }
        help.append("\nUse --profile <name> to select a profile.\n");
        return help.toString();
    }
}
