package com.convexlab.modeling.model;

/**
 * Scalar type of the values held by a data table.
 */
public enum ValueType {
    REAL,
    INTEGER,
    BINARY;

    public boolean isIntegral() {
        return this != REAL;
    }
}
