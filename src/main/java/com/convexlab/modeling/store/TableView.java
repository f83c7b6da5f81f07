package com.convexlab.modeling.store;

import java.util.Map;
import java.util.Optional;

import com.convexlab.modeling.model.Coordinate;

/**
 * Read access to table values keyed by full coordinates over the table domain.
 */
public interface TableView {

    Optional<Double> value(String table, Coordinate coordinate);

    /**
     * All values of {@code table} whose coordinates agree with {@code filter}
     * on every set of the filter. An empty filter selects the whole table.
     */
    Map<Coordinate, Double> read(String table, Coordinate filter);

    default Map<Coordinate, Double> read(String table) {
        return read(table, Coordinate.empty());
    }
}
