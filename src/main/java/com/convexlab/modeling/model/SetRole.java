package com.convexlab.modeling.model;

/**
 * How a set participates in the model.
 */
public enum SetRole {
    /** Shape or intra-problem dimension of variables. */
    DIMENSION,
    /** Enumerates independent problem instances (scenarios). */
    INTER_PROBLEM
}
