package com.convexlab.modeling.solver;

/**
 * Outcome of one solver call.
 */
public enum SolveStatus {
    OPTIMAL,
    INFEASIBLE,
    UNBOUNDED,
    SOLVER_ERROR;

    public boolean isSuccess() {
        return this == OPTIMAL;
    }
}
