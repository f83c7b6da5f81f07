package com.convexlab.modeling.exception;

/**
 * Broken model definition: unknown references, duplicates, unsupported values.
 */
public class ModelDefinitionException extends ModelException {

    private static final long serialVersionUID = 1L;

    public ModelDefinitionException(String message) {
        super(message);
    }

    public ModelDefinitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
