package com.convexlab.modeling.exception;

import lombok.Getter;

/**
 * Syntax error in a symbolic expression.
 */
@Getter
public class ExpressionParseException extends ModelDefinitionException {

    private static final long serialVersionUID = 1L;

    private final String expression;
    private final int position;

    public ExpressionParseException(String expression, int position, String message) {
        super(message + " at position " + position + " in '" + expression + "'");
        this.expression = expression;
        this.position = position;
    }
}
