package com.convexlab.modeling.exception;

/**
 * A variable allocation does not partition its table domain, or an expression
 * composes operands whose shapes do not agree.
 */
public class DimensionMismatchException extends ModelException {

    private static final long serialVersionUID = 1L;

    public DimensionMismatchException(String message) {
        super(message);
    }
}
