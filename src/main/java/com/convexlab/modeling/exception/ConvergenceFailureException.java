package com.convexlab.modeling.exception;

import lombok.Getter;

/**
 * The Gauss-Seidel loop of a coupling group hit its iteration or time bound.
 */
@Getter
public class ConvergenceFailureException extends ModelException {

    private static final long serialVersionUID = 1L;

    private final int iterations;
    private final double lastNorm;

    public ConvergenceFailureException(int iterations, double lastNorm, String message) {
        super(message);
        this.iterations = iterations;
        this.lastNorm = lastNorm;
    }
}
