package com.convexlab.modeling.expression;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Represents a token of the symbolic expression language.
 */
@Data
@AllArgsConstructor
public class ExpressionToken {
    private TokenType type;
    private String value;
    private int position;

    public enum TokenType {
        NUMBER,
        IDENTIFIER,
        PLUS,
        MINUS,
        STAR,
        AT,
        SLASH,
        COMMA,
        LPAREN,
        RPAREN,
        EQUAL,
        LESS_EQUAL,
        GREATER_EQUAL,
        EOF
    }

    public boolean isRelation() {
        return type == TokenType.EQUAL || type == TokenType.LESS_EQUAL || type == TokenType.GREATER_EQUAL;
    }
}
