package org.carball.lbs.warehouse;

import org.carball.lbs.config.DimensionSpec;
import org.carball.lbs.config.WarehouseConfig;
import org.carball.lbs.model.anomaly.ComparisonType;
import org.carball.lbs.model.anomaly.Granularity;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.regex.Pattern;

/**
 * Renders the T-SQL aggregate queries behind each detector from the configured star schema.
 * Metric and dimension names are checked against the configuration before they reach SQL.
 */
public class WarehouseQueries {

    public static final String COLUMN_BUCKET = "Bucket";
    public static final String COLUMN_DIMENSION_VALUE = "DimensionValue";
    public static final String COLUMN_DIMENSION_NAME = "DimensionName";
    public static final String COLUMN_CATEGORY = "Category";
    public static final String COLUMN_METRIC = "MetricValue";
    public static final String COLUMN_RECORD_COUNT = "RecordCount";

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final WarehouseConfig config;

    public WarehouseQueries(WarehouseConfig config) {
        this.config = config;
    }

    public AggregateQuery timeSeries(String metric, Granularity granularity, int lookbackDays) {
        String bucket = bucketExpression(granularity);
        String sql = """
            SELECT %s AS Bucket,
                   SUM(CAST(%s AS FLOAT)) AS MetricValue,
                   %s AS RecordCount
            %s
            WHERE %s
            GROUP BY %s
            ORDER BY Bucket
            """.formatted(bucket, metricColumn(metric), config.getRecordCountExpression(),
                fromFactAndDate(), lookbackPredicate(lookbackDays), bucket);
        return AggregateQuery.ofSeries(sql);
    }

    public AggregateQuery dimensionTotals(String dimension, String metric) {
        DimensionSpec spec = dimension(dimension);
        String key = factColumn(spec.getKey());
        String sql = """
            SELECT CAST(%s AS VARCHAR(50)) AS DimensionValue,
                   %s AS DimensionName,
                   SUM(CAST(%s AS FLOAT)) AS MetricValue,
                   %s AS RecordCount
            FROM %s %s
            %s
            GROUP BY %s, %s
            """.formatted(key, spec.getNameExpression(), metricColumn(metric), config.getRecordCountExpression(),
                config.getFactTable(), config.getFactAlias(), dimensionJoins(spec),
                key, spec.getNameExpression());
        return new AggregateQuery(sql, dimension);
    }

    public AggregateQuery periodTotals(String metric, ComparisonType type) {
        String date = dateColumn();
        String bucket = type.isQuarterly()
                ? "DATEFROMPARTS(YEAR(%s), (DATEPART(QUARTER, %s) - 1) * 3 + 1, 1)".formatted(date, date)
                : "DATEFROMPARTS(YEAR(%s), MONTH(%s), 1)".formatted(date, date);
        String sql = """
            SELECT %s AS Bucket,
                   SUM(CAST(%s AS FLOAT)) AS MetricValue,
                   %s AS RecordCount
            %s
            GROUP BY %s
            ORDER BY Bucket
            """.formatted(bucket, metricColumn(metric), config.getRecordCountExpression(), fromFactAndDate(), bucket);
        return AggregateQuery.ofSeries(sql);
    }

    public AggregateQuery dailyByEntity(String dimension, String metric, int lookbackDays, int topN) {
        DimensionSpec spec = dimension(dimension);
        String key = factColumn(spec.getKey());
        String day = "CAST(%s AS DATE)".formatted(dateColumn());
        String category = spec.getCategoryExpression() != null ? spec.getCategoryExpression() : "CAST(NULL AS VARCHAR(100))";
        String categoryGroup = spec.getCategoryExpression() != null ? ", " + spec.getCategoryExpression() : "";
        String sql = """
            WITH TopEntities AS (
                SELECT TOP %d %s AS EntityKey
                %s
                WHERE %s
                GROUP BY %s
                ORDER BY SUM(CAST(%s AS FLOAT)) DESC
            )
            SELECT %s AS Bucket,
                   CAST(%s AS VARCHAR(50)) AS DimensionValue,
                   %s AS DimensionName,
                   %s AS Category,
                   SUM(CAST(%s AS FLOAT)) AS MetricValue,
                   %s AS RecordCount
            %s
            %s
            WHERE %s
              AND %s IN (SELECT EntityKey FROM TopEntities)
            GROUP BY %s, %s, %s%s
            ORDER BY DimensionValue, Bucket
            """.formatted(topN, key, fromFactAndDate(), lookbackPredicate(lookbackDays), key, metricColumn(metric),
                day, key, spec.getNameExpression(), category, metricColumn(metric), config.getRecordCountExpression(),
                fromFactAndDate(), dimensionJoins(spec), lookbackPredicate(lookbackDays), key,
                day, key, spec.getNameExpression(), categoryGroup);
        return new AggregateQuery(sql, dimension);
    }

    public AggregateQuery dailyTotals(String metric, int lookbackDays) {
        return timeSeries(metric, Granularity.DAILY, lookbackDays);
    }

    /**
     * Resolves a configured dimension.
     *
     * @throws IllegalArgumentException for dimensions that are not configured
     */
    public DimensionSpec dimension(String name) {
        DimensionSpec spec = name == null ? null : config.getDimensions().get(name);
        if (spec == null) {
            throw new IllegalArgumentException("Unknown dimension: " + name +
                    ". Available dimensions: " + String.join(", ", config.getDimensions().keySet()));
        }
        return spec;
    }

    /**
     * Checks that a metric is configured and is a plain column name.
     *
     * @throws IllegalArgumentException for unknown metrics
     */
    public String metric(String name) {
        if (name == null || !config.getMetrics().contains(name) || !IDENTIFIER.matcher(name).matches()) {
            throw new IllegalArgumentException("Unknown metric: " + name +
                    ". Available metrics: " + String.join(", ", config.getMetrics()));
        }
        return name;
    }

    private String metricColumn(String metric) {
        return factColumn(metric(metric));
    }

    private String factColumn(String column) {
        return config.getFactAlias() + "." + column;
    }

    private String dateColumn() {
        return config.getDateAlias() + "." + config.getDateColumn();
    }

    private String fromFactAndDate() {
        return "FROM %s %s\nINNER JOIN %s %s ON %s.%s = %s".formatted(
                config.getFactTable(), config.getFactAlias(),
                config.getDateTable(), config.getDateAlias(), config.getDateAlias(), config.getDateKey(),
                factColumn(config.getFactDateKey()));
    }

    private String dimensionJoins(DimensionSpec spec) {
        StringBuilder joins = new StringBuilder("INNER JOIN %s %s ON %s.%s = %s".formatted(
                spec.getTable(), spec.getAlias(), spec.getAlias(), spec.getKey(), factColumn(spec.getKey())));
        if (spec.getExtraJoins() != null && !spec.getExtraJoins().isBlank()) {
            joins.append('\n').append(spec.getExtraJoins());
        }
        return joins.toString();
    }

    private String bucketExpression(Granularity granularity) {
        String date = dateColumn();
        return switch (granularity) {
            case DAILY -> "CAST(%s AS DATE)".formatted(date);
            case WEEKLY -> "DATEADD(DAY, 1 - DATEPART(WEEKDAY, %s), CAST(%s AS DATE))".formatted(date, date);
            case MONTHLY -> "DATEFROMPARTS(YEAR(%s), MONTH(%s), 1)".formatted(date, date);
        };
    }

    private String lookbackPredicate(int lookbackDays) {
        String anchor = anchorExpression();
        return "%s >= DATEADD(DAY, -%d, %s) AND %s <= %s".formatted(dateColumn(), lookbackDays, anchor, dateColumn(), anchor);
    }

    String anchorExpression() {
        String anchor = config.getAnchorDate();
        if (anchor == null || anchor.isBlank()) {
            return "CAST(GETDATE() AS DATE)";
        }
        try {
            return "CAST('%s' AS DATE)".formatted(LocalDate.parse(anchor.trim()));
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Anchor date must be yyyy-MM-dd: " + anchor, e);
        }
    }
}
