package org.carball.lbs.warehouse;

import org.carball.lbs.model.query.TabularResult;

/**
 * Executes free-form SQL, reporting failures inside the result instead of throwing.
 */
public interface SqlExecutor {

    TabularResult execute(String sql);
}
