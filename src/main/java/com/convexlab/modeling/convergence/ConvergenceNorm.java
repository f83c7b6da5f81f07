package com.convexlab.modeling.convergence;

/**
 * Change measure between two successive values of the shared tables.
 */
public enum ConvergenceNorm {
    /** {@code max |after - before|}. */
    MAX_ABSOLUTE,
    /** {@code max |after - before| / |before|}. */
    MAX_RELATIVE,
    /** {@code ||after - before||_2 / ||before||_2}. */
    RELATIVE_L2
}
