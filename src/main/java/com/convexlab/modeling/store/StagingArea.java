package com.convexlab.modeling.store;

import java.util.Map;

import com.convexlab.modeling.model.Coordinate;

/**
 * Overlay of uncommitted writes on a {@link TableStore}. Reads see staged
 * values first, then the store.
 */
public interface StagingArea extends TableView {

    String getUnitKey();

    void write(String table, Map<Coordinate, Double> values);

    /**
     * Values written to this area for {@code table} only.
     */
    Map<Coordinate, Double> staged(String table);

    /**
     * Copies every staged value to the store atomically and clears the area.
     */
    void promote();

    /**
     * Drops every staged value.
     */
    void discard();
}
