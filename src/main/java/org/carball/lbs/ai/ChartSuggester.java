package org.carball.lbs.ai;

import org.carball.lbs.model.query.ChartSuggestion;

import java.util.List;
import java.util.Locale;

/**
 * Picks a chart for a query result from its intent and column names.
 */
public final class ChartSuggester {

    private static final List<String> VALUE_COLUMNS = List.of("sales", "revenue", "amount", "total");

    private ChartSuggester() {
    }

    public static ChartSuggestion suggest(String intent, List<String> columns, int rowCount) {
        if (columns == null || columns.isEmpty() || rowCount == 0 || intent == null) {
            return null;
        }
        return switch (intent) {
            case "time_series" -> new ChartSuggestion("line",
                    findColumn(columns, List.of("year", "month", "date", "quarter")),
                    findColumn(columns, VALUE_COLUMNS), null);
            case "ranking" -> new ChartSuggestion("bar",
                    findColumn(columns, List.of("name", "product", "customer", "country", "region")),
                    findColumn(columns, List.of("sales", "revenue", "amount", "total", "count", "quantity")), null);
            case "geographic" -> new ChartSuggestion("bar",
                    findColumn(columns, List.of("country", "region", "territory")),
                    findColumn(columns, VALUE_COLUMNS), null);
            case "aggregation" -> new ChartSuggestion("metric", null,
                    findColumn(columns, List.of("total", "sales", "amount", "revenue")), null);
            default -> null;
        };
    }

    static String findColumn(List<String> columns, List<String> keywords) {
        for (String column : columns) {
            String lower = column.toLowerCase(Locale.ROOT);
            if (keywords.stream().anyMatch(lower::contains)) {
                return column;
            }
        }
        return columns.get(0);
    }
}
