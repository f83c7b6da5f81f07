package com.convexlab.modeling.exception;

/**
 * The resolved table roles of a coupling group cannot be iterated: a shared
 * table is written by more than one member.
 */
public class CircularDependencyException extends ModelException {

    private static final long serialVersionUID = 1L;

    public CircularDependencyException(String message) {
        super(message);
    }
}
