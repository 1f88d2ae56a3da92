package org.carball.lbs.warehouse;

import org.carball.lbs.exception.DataProviderException;
import org.carball.lbs.model.data.AggregateRow;

import java.util.List;

/**
 * Source of aggregate rows for the detectors.
 */
public interface WarehouseDataProvider {

    /**
     * Runs an aggregate query and maps every row.
     *
     * @throws DataProviderException when the query cannot be executed; partial rows are never returned
     */
    List<AggregateRow> runAggregate(AggregateQuery query);
}
