package com.convexlab.modeling.expression;

/**
 * Kind of a parsed expression: a constraint relation or an objective term.
 */
public enum ExpressionKind {
    EQUALITY("=="),
    LESS_EQUAL("<="),
    GREATER_EQUAL(">="),
    MINIMIZE("Minimize"),
    MAXIMIZE("Maximize");

    private final String symbol;

    ExpressionKind(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    public boolean isObjective() {
        return this == MINIMIZE || this == MAXIMIZE;
    }
}
