package com.convexlab.modeling.convergence;

/**
 * How per-table changes combine into the iteration norm.
 */
public enum NormAggregation {
    /** One norm over the entries of all shared tables together. */
    GLOBAL,
    /** The worst per-table norm. */
    PER_TABLE
}
