package com.convexlab.modeling.expression;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.convexlab.modeling.exception.ExpressionParseException;
import com.convexlab.modeling.expression.ExpressionToken.TokenType;
import com.convexlab.modeling.expression.ast.BinaryOperationNode;
import com.convexlab.modeling.expression.ast.BinaryOperationNode.Operator;
import com.convexlab.modeling.expression.ast.ExpressionNode;
import com.convexlab.modeling.expression.ast.FunctionCallNode;
import com.convexlab.modeling.expression.ast.NegationNode;
import com.convexlab.modeling.expression.ast.NumberNode;
import com.convexlab.modeling.expression.ast.VariableNode;

/**
 * Recursive-descent parser for the expression language.
 *
 * <pre>
 * expression := objective | relation
 * objective  := ("Minimize" | "Maximize") "(" sum ")"
 * relation   := sum ("==" | "&lt;=" | "&gt;=") sum
 * sum        := term (("+" | "-") term)*
 * term       := unary (("*" | "@" | "/") unary)*
 * unary      := "-" unary | primary
 * primary    := NUMBER | IDENT | IDENT "(" args ")" | "(" sum ")"
 * </pre>
 *
 * Parsing only: names are resolved against variables and operators later.
 */
public class ExpressionParser {
    private static final Logger log = LoggerFactory.getLogger(ExpressionParser.class);

    public static final String MINIMIZE = "Minimize";
    public static final String MAXIMIZE = "Maximize";

    private String source;
    private List<ExpressionToken> tokens;
    private int pos;

    public SymbolicExpression parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new ExpressionParseException(String.valueOf(expression), 0, "Empty expression");
        }
        this.source = expression;
        this.tokens = new ExpressionTokenizer(expression).tokenize();
        this.pos = 0;

        SymbolicExpression parsed = isObjectiveStart() ? parseObjective() : parseRelation();
        log.debug("Parsed '{}' as {}: {} {}", expression, parsed.getKind(), parsed.getLeft(),
                parsed.getRight() == null ? "" : parsed.getRight());
        return parsed;
    }

    private boolean isObjectiveStart() {
        ExpressionToken first = peek();
        return first.getType() == TokenType.IDENTIFIER
                && (MINIMIZE.equals(first.getValue()) || MAXIMIZE.equals(first.getValue()))
                && tokens.get(pos + 1).getType() == TokenType.LPAREN;
    }

    private SymbolicExpression parseObjective() {
        ExpressionKind kind = MINIMIZE.equals(advance().getValue()) ? ExpressionKind.MINIMIZE : ExpressionKind.MAXIMIZE;
        expect(TokenType.LPAREN);
        ExpressionNode body = parseSum();
        expect(TokenType.RPAREN);
        expect(TokenType.EOF);
        return new SymbolicExpression(source, kind, body, null);
    }

    private SymbolicExpression parseRelation() {
        ExpressionNode left = parseSum();
        ExpressionToken relation = peek();
        if (!relation.isRelation()) {
            throw error(relation, "Expected '==', '<=' or '>=' but found " + describe(relation));
        }
        advance();
        ExpressionNode right = parseSum();
        if (peek().isRelation()) {
            throw error(peek(), "Chained relations are not supported");
        }
        expect(TokenType.EOF);
        ExpressionKind kind = switch (relation.getType()) {
            case EQUAL -> ExpressionKind.EQUALITY;
            case LESS_EQUAL -> ExpressionKind.LESS_EQUAL;
            default -> ExpressionKind.GREATER_EQUAL;
        };
        return new SymbolicExpression(source, kind, left, right);
    }

    private ExpressionNode parseSum() {
        ExpressionNode node = parseTerm();
        while (check(TokenType.PLUS) || check(TokenType.MINUS)) {
            Operator operator = advance().getType() == TokenType.PLUS ? Operator.ADD : Operator.SUBTRACT;
            node = new BinaryOperationNode(operator, node, parseTerm());
        }
        return node;
    }

    private ExpressionNode parseTerm() {
        ExpressionNode node = parseUnary();
        while (check(TokenType.STAR) || check(TokenType.AT) || check(TokenType.SLASH)) {
            Operator operator = switch (advance().getType()) {
                case STAR -> Operator.MULTIPLY;
                case AT -> Operator.MATMUL;
                default -> Operator.DIVIDE;
            };
            node = new BinaryOperationNode(operator, node, parseUnary());
        }
        return node;
    }

    private ExpressionNode parseUnary() {
        if (check(TokenType.MINUS)) {
            advance();
            return new NegationNode(parseUnary());
        }
        return parsePrimary();
    }

    private ExpressionNode parsePrimary() {
        ExpressionToken token = peek();
        switch (token.getType()) {
            case NUMBER:
                advance();
                return new NumberNode(Double.parseDouble(token.getValue()));
            case IDENTIFIER:
                advance();
                if (check(TokenType.LPAREN)) {
                    return parseCall(token);
                }
                return new VariableNode(token.getValue());
            case LPAREN:
                advance();
                ExpressionNode inner = parseSum();
                expect(TokenType.RPAREN);
                return inner;
            default:
                throw error(token, "Unexpected " + describe(token));
        }
    }

    private ExpressionNode parseCall(ExpressionToken name) {
        if (MINIMIZE.equals(name.getValue()) || MAXIMIZE.equals(name.getValue())) {
            throw error(name, "'" + name.getValue() + "' is only allowed as the outermost term of an objective");
        }
        expect(TokenType.LPAREN);
        List<ExpressionNode> arguments = new ArrayList<>();
        if (!check(TokenType.RPAREN)) {
            arguments.add(parseSum());
            while (check(TokenType.COMMA)) {
                advance();
                arguments.add(parseSum());
            }
        }
        expect(TokenType.RPAREN);
        return new FunctionCallNode(name.getValue(), arguments);
    }

    private ExpressionToken peek() {
        return tokens.get(pos);
    }

    private boolean check(TokenType type) {
        return peek().getType() == type;
    }

    private ExpressionToken advance() {
        ExpressionToken token = peek();
        if (token.getType() != TokenType.EOF) {
            pos++;
        }
        return token;
    }

    private ExpressionToken expect(TokenType type) {
        if (check(type)) {
            return advance();
        }
        throw error(peek(), "Expected " + type + " but found " + describe(peek()));
    }

    private ExpressionParseException error(ExpressionToken token, String message) {
        return new ExpressionParseException(source, token.getPosition(), message);
    }

    private static String describe(ExpressionToken token) {
        return token.getType() == TokenType.EOF ? "end of expression" : "'" + token.getValue() + "'";
    }
}
