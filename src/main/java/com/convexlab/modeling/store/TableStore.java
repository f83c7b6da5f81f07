package com.convexlab.modeling.store;

import java.util.Map;
import java.util.Set;

import com.convexlab.modeling.model.Coordinate;

/**
 * Authoritative storage of table values.
 */
public interface TableStore extends TableView {

    /**
     * Inserts or replaces the given values.
     */
    void write(String table, Map<Coordinate, Double> values);

    /**
     * Opens an isolated write area for one solve unit. Nothing written there is
     * visible to other readers of this store until {@link StagingArea#promote()}.
     */
    StagingArea openStaging(String unitKey);

    Set<String> tables();
}
