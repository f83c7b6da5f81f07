package com.convexlab.modeling.binding;

/**
 * What to use for an exogenous entry that has no stored value and no blank fill.
 */
public enum MissingValuePolicy {
    /** Raise {@link com.convexlab.modeling.exception.MissingDataException}. */
    FAIL,
    /** Use 0. */
    ZERO
}
