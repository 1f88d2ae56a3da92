package org.carball.lbs.warehouse;

/**
 * A rendered aggregate query. Result columns follow the {@code COLUMN_*} aliases of
 * {@link WarehouseQueries}; the dimension name describes which dimension the rows belong to.
 */
public record AggregateQuery(String sql, String dimension) {

    public static AggregateQuery ofSeries(String sql) {
        return new AggregateQuery(sql, null);
    }
}
