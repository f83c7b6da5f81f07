package com.convexlab.modeling.exception;

import com.convexlab.modeling.solver.SolveStatus;

import lombok.Getter;

/**
 * The numeric solver did not return an optimal solution.
 */
@Getter
public class SolverException extends ModelException {

    private static final long serialVersionUID = 1L;

    private final SolveStatus status;

    public SolverException(SolveStatus status, String message) {
        super(message);
        this.status = status;
    }

    public SolverException(String message, Throwable cause) {
        super(message, cause);
        this.status = SolveStatus.SOLVER_ERROR;
    }
}
