package com.convexlab.modeling.exception;

import java.util.List;

/**
 * Single exception that can hold every error found while loading or
 * validating a model definition.
 */
public class ModelValidationException extends ModelDefinitionException {

    private static final long serialVersionUID = 1L;
    private final List<String> errors;

    public ModelValidationException(List<String> errors) {
        super(String.join(System.lineSeparator(), errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
