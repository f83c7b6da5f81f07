package com.convexlab.modeling.expression;

import java.util.ArrayList;
import java.util.List;

import com.convexlab.modeling.exception.ExpressionParseException;
import com.convexlab.modeling.expression.ExpressionToken.TokenType;

/**
 * Tokenizer for symbolic expressions such as {@code sum(supply) >= demand}.
 */
public class ExpressionTokenizer {

    private final String source;
    private int pos = 0;

    public ExpressionTokenizer(String source) {
        this.source = source;
    }

    /**
     * Tokenize the entire expression. The last token is always {@link TokenType#EOF}.
     */
    public List<ExpressionToken> tokenize() {
        List<ExpressionToken> tokens = new ArrayList<>();
        while (true) {
            skipWhitespace();
            if (pos >= source.length()) {
                break;
            }
            tokens.add(nextToken());
        }
        tokens.add(new ExpressionToken(TokenType.EOF, "", source.length()));
        return tokens;
    }

    private void skipWhitespace() {
        while (pos < source.length() && Character.isWhitespace(source.charAt(pos))) {
            pos++;
        }
    }

    private ExpressionToken nextToken() {
        char c = source.charAt(pos);
        int start = pos;

        switch (c) {
            case '+':
                pos++;
                return new ExpressionToken(TokenType.PLUS, "+", start);
            case '-':
                pos++;
                return new ExpressionToken(TokenType.MINUS, "-", start);
            case '*':
                pos++;
                return new ExpressionToken(TokenType.STAR, "*", start);
            case '@':
                pos++;
                return new ExpressionToken(TokenType.AT, "@", start);
            case '/':
                pos++;
                return new ExpressionToken(TokenType.SLASH, "/", start);
            case ',':
                pos++;
                return new ExpressionToken(TokenType.COMMA, ",", start);
            case '(':
                pos++;
                return new ExpressionToken(TokenType.LPAREN, "(", start);
            case ')':
                pos++;
                return new ExpressionToken(TokenType.RPAREN, ")", start);
            case '=':
            case '<':
            case '>':
                return readRelation(c, start);
            default:
                break;
        }

        if (Character.isDigit(c) || (c == '.' && pos + 1 < source.length() && Character.isDigit(source.charAt(pos + 1)))) {
            return readNumber(start);
        }
        if (Character.isLetter(c) || c == '_') {
            return readIdentifier(start);
        }
        throw new ExpressionParseException(source, start, "Unexpected character '" + c + "'");
    }

    private ExpressionToken readRelation(char c, int start) {
        if (pos + 1 >= source.length() || source.charAt(pos + 1) != '=') {
            throw new ExpressionParseException(source, start, "Expected '" + c + "=' (only ==, <= and >= are supported)");
        }
        pos += 2;
        TokenType type = switch (c) {
            case '=' -> TokenType.EQUAL;
            case '<' -> TokenType.LESS_EQUAL;
            default -> TokenType.GREATER_EQUAL;
        };
        return new ExpressionToken(type, c + "=", start);
    }

    private ExpressionToken readNumber(int start) {
        while (pos < source.length() && (Character.isDigit(source.charAt(pos)) || source.charAt(pos) == '.')) {
            pos++;
        }
        // exponent part, e.g. 1e-3
        if (pos < source.length() && (source.charAt(pos) == 'e' || source.charAt(pos) == 'E')) {
            int mark = pos;
            pos++;
            if (pos < source.length() && (source.charAt(pos) == '+' || source.charAt(pos) == '-')) {
                pos++;
            }
            if (pos < source.length() && Character.isDigit(source.charAt(pos))) {
                while (pos < source.length() && Character.isDigit(source.charAt(pos))) {
                    pos++;
                }
            } else {
                pos = mark;
            }
        }
        String text = source.substring(start, pos);
        try {
            Double.parseDouble(text);
        } catch (NumberFormatException e) {
            throw new ExpressionParseException(source, start, "Malformed number '" + text + "'");
        }
        return new ExpressionToken(TokenType.NUMBER, text, start);
    }

    private ExpressionToken readIdentifier(int start) {
        while (pos < source.length()
                && (Character.isLetterOrDigit(source.charAt(pos)) || source.charAt(pos) == '_')) {
            pos++;
        }
        return new ExpressionToken(TokenType.IDENTIFIER, source.substring(start, pos), start);
    }
}
