package com.convexlab.modeling.model;

/**
 * Concrete role of a table inside one problem.
 */
public enum ResolvedRole {
    EXOGENOUS,
    ENDOGENOUS,
    CONSTANT
}
