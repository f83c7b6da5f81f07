package com.convexlab.modeling.exception;

/**
 * A required exogenous domain tuple has no stored value.
 */
public class MissingDataException extends ModelException {

    private static final long serialVersionUID = 1L;

    public MissingDataException(String message) {
        super(message);
    }
}
