package org.carball.lbs.warehouse;

import lombok.extern.slf4j.Slf4j;
import org.carball.lbs.config.WarehouseConfig;
import org.carball.lbs.exception.DataProviderException;
import org.carball.lbs.model.data.AggregateRow;
import org.carball.lbs.model.query.TabularResult;

import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Runs warehouse queries over plain JDBC. Each call opens its own connection.
 */
@Slf4j
public class JdbcWarehouseDataProvider implements WarehouseDataProvider, SqlExecutor {

    private final String jdbcUrl;
    private final String username;
    private final String password;
    private final int queryTimeoutSeconds;

    public JdbcWarehouseDataProvider(WarehouseConfig config) {
        this(config.getJdbcUrl(), config.getUsername(), config.getPassword(), config.getQueryTimeoutSeconds());
    }

    public JdbcWarehouseDataProvider(String jdbcUrl, String username, String password, int queryTimeoutSeconds) {
        if (jdbcUrl == null || jdbcUrl.isBlank()) {
            throw new IllegalArgumentException("Warehouse JDBC URL is required");
        }
        this.jdbcUrl = jdbcUrl;
        this.username = username;
        this.password = password;
        this.queryTimeoutSeconds = queryTimeoutSeconds;
    }

    @Override
    public List<AggregateRow> runAggregate(AggregateQuery query) {
        log.trace("Aggregate query:\n{}", query.sql());
        long start = System.currentTimeMillis();

        try (Connection conn = connect();
             PreparedStatement stmt = conn.prepareStatement(query.sql())) {
            stmt.setQueryTimeout(queryTimeoutSeconds);
            try (ResultSet rs = stmt.executeQuery()) {
                Set<String> columns = columnLabels(rs.getMetaData());
                List<AggregateRow> rows = new ArrayList<>();
                while (rs.next()) {
                    rows.add(mapRow(rs, columns, query.dimension()));
                }
                log.debug("Aggregate query returned {} rows in {} ms", rows.size(), System.currentTimeMillis() - start);
                return rows;
            }
        } catch (SQLException e) {
            log.error("Aggregate query failed: {}", e.getMessage());
            throw new DataProviderException("Warehouse query failed: " + e.getMessage(), e);
        }
    }

    @Override
    public TabularResult execute(String sql) {
        log.trace("Executing SQL:\n{}", sql);
        try (Connection conn = connect();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setQueryTimeout(queryTimeoutSeconds);
            try (ResultSet rs = stmt.executeQuery()) {
                ResultSetMetaData meta = rs.getMetaData();
                List<String> columns = new ArrayList<>();
                for (int i = 1; i <= meta.getColumnCount(); i++) {
                    columns.add(meta.getColumnLabel(i));
                }
                List<Map<String, Object>> rows = new ArrayList<>();
                while (rs.next()) {
                    Map<String, Object> row = new LinkedHashMap<>();
                    for (int i = 1; i <= columns.size(); i++) {
                        row.put(columns.get(i - 1), toJsonValue(rs.getObject(i)));
                    }
                    rows.add(row);
                }
                return TabularResult.success(columns, rows);
            }
        } catch (SQLException e) {
            log.warn("SQL execution failed: {}", e.getMessage());
            return TabularResult.failure(e.getMessage());
        }
    }

    /**
     * Verifies that the warehouse is reachable.
     */
    public boolean testConnection() {
        try (Connection conn = connect()) {
            return conn.isValid(5);
        } catch (SQLException e) {
            log.warn("Warehouse connection failed: {}", e.getMessage());
            return false;
        }
    }

    private Connection connect() throws SQLException {
        if (username == null) {
            return DriverManager.getConnection(jdbcUrl);
        }
        return DriverManager.getConnection(jdbcUrl, username, password);
    }

    private static AggregateRow mapRow(ResultSet rs, Set<String> columns, String dimension) throws SQLException {
        LocalDate bucket = null;
        if (columns.contains(WarehouseQueries.COLUMN_BUCKET.toLowerCase(Locale.ROOT))) {
            java.sql.Date date = rs.getDate(WarehouseQueries.COLUMN_BUCKET);
            bucket = date == null ? null : date.toLocalDate();
        }
        double metric = rs.getDouble(WarehouseQueries.COLUMN_METRIC);
        Double metricValue = rs.wasNull() ? null : metric;
        long count = columns.contains(WarehouseQueries.COLUMN_RECORD_COUNT.toLowerCase(Locale.ROOT))
                ? Math.max(0, rs.getLong(WarehouseQueries.COLUMN_RECORD_COUNT)) : 0;

        return new AggregateRow(
                dimension,
                optionalString(rs, columns, WarehouseQueries.COLUMN_DIMENSION_VALUE),
                optionalString(rs, columns, WarehouseQueries.COLUMN_DIMENSION_NAME),
                optionalString(rs, columns, WarehouseQueries.COLUMN_CATEGORY),
                bucket,
                metricValue,
                count);
    }

    private static String optionalString(ResultSet rs, Set<String> columns, String column) throws SQLException {
        return columns.contains(column.toLowerCase(Locale.ROOT)) ? rs.getString(column) : null;
    }

    private static Set<String> columnLabels(ResultSetMetaData meta) throws SQLException {
        Set<String> labels = new HashSet<>();
        for (int i = 1; i <= meta.getColumnCount(); i++) {
            labels.add(meta.getColumnLabel(i).toLowerCase(Locale.ROOT));
        }
        return labels;
    }

    private static Object toJsonValue(Object value) {
        if (value instanceof BigDecimal decimal) {
            return decimal.doubleValue();
        }
        if (value instanceof java.sql.Date date) {
            return date.toLocalDate().toString();
        }
        if (value instanceof Timestamp timestamp) {
            return timestamp.toLocalDateTime().toString();
        }
        if (value instanceof Double d && !Double.isFinite(d)) {
            return null;
        }
        return value;
    }
}
