package com.convexlab.modeling.exception;

/**
 * Root of all errors raised while validating, expanding or solving a model.
 */
public class ModelException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ModelException(String message) {
        super(message);
    }

    public ModelException(String message, Throwable cause) {
        super(message, cause);
    }
}
