package org.carball.lbs.output;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.carball.lbs.model.anomaly.AnomalyFinding;
import org.carball.lbs.model.anomaly.CompositeDetectionResult;
import org.carball.lbs.model.anomaly.DetectionResult;
import org.carball.lbs.model.anomaly.DetectionStatistics;
import org.carball.lbs.model.anomaly.ForecastPoint;
import org.carball.lbs.model.anomaly.Severity;

import java.io.UncheckedIOException;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Renders detection results as JSON or Markdown.
 */
@Slf4j
public class DetectionReport {

    private static final int MAX_FINDINGS_IN_MARKDOWN = 50;
    private static final int MAX_FORECAST_ROWS = 14;

    private final Map<String, DetectionResult> results;
    private final Map<String, String> errors;
    private final String status;
    private final Object payload;
    private final Instant timestamp;
    private final ObjectMapper objectMapper;

    public DetectionReport(DetectionResult result) {
        this(Map.of(result.getMethod().getLabel(), result), Map.of(), null, result);
    }

    public DetectionReport(CompositeDetectionResult composite) {
        this(composite.getResults(), composite.getErrors(), composite.getStatus(), composite);
    }

    private DetectionReport(Map<String, DetectionResult> results, Map<String, String> errors, String status,
                            Object payload) {
        this.results = new LinkedHashMap<>(results);
        this.errors = errors;
        this.status = status;
        this.payload = payload;
        this.timestamp = Instant.now();
        this.objectMapper = JsonSupport.newPrettyObjectMapper();
    }

    public String toJson() {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            log.error("Error generating JSON report", e);
            throw new UncheckedIOException("Failed to generate JSON report", e);
        }
    }

    public String toMarkdown() {
        StringBuilder md = new StringBuilder();

        md.append("# Anomaly Detection Report\n\n");
        md.append("**Generated:** ")
                .append(DateTimeFormatter.ISO_LOCAL_DATE_TIME.format(timestamp.atOffset(ZoneOffset.UTC).toLocalDateTime()))
                .append(" UTC  \n");
        if (status != null) {
            md.append("**Status:** ").append(status).append("  \n");
        }
        md.append("\n");

        md.append("## Summary\n\n");
        md.append("| Detector | Status | Anomalies | High / Critical |\n");
        md.append("|----------|--------|-----------|-----------------|\n");
        results.forEach((name, result) -> md.append("| ").append(name)
                .append(" | ").append(result.getStatus().getLabel())
                .append(result.isCached() ? " (cached)" : "")
                .append(" | ").append(result.getAnomalyCount())
                .append(" | ").append(countSevere(result))
                .append(" |\n"));
        errors.forEach((name, error) -> md.append("| ").append(name)
                .append(" | error | - | - |\n"));
        md.append("\n");

        if (!errors.isEmpty()) {
            md.append("## Errors\n\n");
            errors.forEach((name, error) -> md.append("- **").append(name).append(":** ").append(error).append("\n"));
            md.append("\n");
        }

        results.forEach((name, result) -> appendResult(md, name, result));
        return md.toString();
    }

    private void appendResult(StringBuilder md, String name, DetectionResult result) {
        md.append("## ").append(name).append("\n\n");
        if (result.getReason() != null) {
            md.append("_").append(result.getReason()).append("_\n\n");
        }

        DetectionStatistics stats = result.getStatistics();
        if (stats != null && stats.getCount() > 0) {
            md.append("- **Observations:** ").append(stats.getCount()).append("\n");
            md.append("- **Mean:** ").append(number(stats.getMean())).append("\n");
            md.append("- **Std:** ").append(number(stats.getStd())).append("\n");
            md.append("- **Range:** ").append(number(stats.getMin())).append(" to ").append(number(stats.getMax())).append("\n");
            stats.getThresholds().forEach((key, value) ->
                    md.append("- **").append(key).append(":** ").append(number(value)).append("\n"));
            md.append("\n");
        }

        if (result.getFindings().isEmpty()) {
            md.append("No anomalies found.\n\n");
        } else {
            md.append("| Severity | Type | Item | Observed | Expected | Deviation % | Rule |\n");
            md.append("|----------|------|------|----------|----------|-------------|------|\n");
            result.getFindings().stream().limit(MAX_FINDINGS_IN_MARKDOWN).forEach(finding -> md.append("| ")
                    .append(finding.getSeverity().getDisplayText())
                    .append(" | ").append(finding.getType().getLabel())
                    .append(" | ").append(item(finding))
                    .append(" | ").append(number(finding.getObservedValue()))
                    .append(" | ").append(number(finding.getExpectedValue()))
                    .append(" | ").append(number(finding.getDeviationPct()))
                    .append(" | `").append(finding.getRule().describe()).append("`")
                    .append(" |\n"));
            if (result.getFindings().size() > MAX_FINDINGS_IN_MARKDOWN) {
                md.append("\n_").append(result.getFindings().size() - MAX_FINDINGS_IN_MARKDOWN)
                        .append(" more findings in the JSON report._\n");
            }
            md.append("\n");
        }

        if (result.getForecast() != null && !result.getForecast().isEmpty()) {
            md.append("### Forecast\n\n");
            md.append("| Date | Forecast | Lower | Upper |\n");
            md.append("|------|----------|-------|-------|\n");
            for (ForecastPoint point : result.getForecast().subList(0, Math.min(MAX_FORECAST_ROWS, result.getForecast().size()))) {
                md.append("| ").append(point.date())
                        .append(" | ").append(number(point.forecast()))
                        .append(" | ").append(number(point.lower()))
                        .append(" | ").append(number(point.upper()))
                        .append(" |\n");
            }
            md.append("\n");
        }
    }

    private static long countSevere(DetectionResult result) {
        return result.getFindings().stream()
                .filter(f -> f.getSeverity() == Severity.HIGH || f.getSeverity() == Severity.CRITICAL)
                .count();
    }

    private static String item(AnomalyFinding finding) {
        String name = finding.getLabel() != null ? finding.getLabel() : finding.getIdentifier();
        if (finding.getDate() != null && (name == null || !name.equals(finding.getDate().toString()))) {
            return name == null ? finding.getDate().toString() : name + " (" + finding.getDate() + ")";
        }
        return name == null ? "-" : name;
    }

    private static String number(Double value) {
        if (value == null || !Double.isFinite(value)) {
            return "-";
        }
        return String.format(Locale.US, "%,.2f", value);
    }
}
