package com.convexlab.modeling.exception;

/**
 * A problem is flagged for optimization but declares no objective.
 */
public class MissingObjectiveException extends ModelException {

    private static final long serialVersionUID = 1L;

    public MissingObjectiveException(String problemName) {
        super("Problem '" + problemName + "' is meant to be optimized but declares no objective");
    }
}
