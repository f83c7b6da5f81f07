package com.convexlab.cli.exception;

import java.util.List;

/**
 * Carries every problem found in the command-line options of one invocation.
 */
public class OptionsValidationException extends RuntimeException {

    private static final long serialVersionUID = 1L;
    private final List<String> errors;

    public OptionsValidationException(List<String> errors) {
        super(errors.size() + " invalid option(s): " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
