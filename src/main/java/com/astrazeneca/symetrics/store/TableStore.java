package com.astrazeneca.symetrics.store;

import com.astrazeneca.symetrics.exception.StoreUnavailableException;

import java.util.List;

/**
 * Keyed table store holding the precomputed score tables. Implementations acquire their resources for the
 * duration of one query and release them before returning.
 */
public interface TableStore {

    /**
     * Executes the exact-match query.
     * @param query table, selected columns and equality predicates
     * @return matched rows in the store's order, empty list if nothing matched
     * @throws StoreUnavailableException if the store can't be opened or the query fails
     */
    List<Row> select(TableQuery query);

    /**
     * @return descriptor of the store used in messages (e.g. JDBC URL)
     */
    String getDescriptor();
}
