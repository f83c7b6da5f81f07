package com.convexlab.modeling.expression;

import com.convexlab.modeling.exception.ExpressionParseException;
import com.convexlab.modeling.expression.ast.BinaryOperationNode;
import com.convexlab.modeling.expression.ast.FunctionCallNode;
import com.convexlab.modeling.expression.ast.NegationNode;
import com.convexlab.modeling.expression.ast.NumberNode;
import com.convexlab.modeling.expression.ast.VariableNode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ExpressionTokenizer and ExpressionParser.
 */
class ExpressionParserTest {

    private SymbolicExpression parse(String text) {
        return new ExpressionParser().parse(text);
    }

    @ParameterizedTest
    @CsvSource({
            "'x == 1', EQUALITY",
            "'x <= y', LESS_EQUAL",
            "'2 * x >= y - 3', GREATER_EQUAL",
            "'Minimize(tran(c) @ x)', MINIMIZE",
            "'Maximize(sum(x))', MAXIMIZE"
    })
    void testExpressionKinds(String text, ExpressionKind kind) {
        assertThat(parse(text).getKind()).isEqualTo(kind);
    }

    @Test
    void testMultiplicationBindsTighterThanAddition() {
        SymbolicExpression expression = parse("a + b * c == 0");

        BinaryOperationNode sum = (BinaryOperationNode) expression.getLeft();
        assertThat(sum.getOperator()).isEqualTo(BinaryOperationNode.Operator.ADD);
        assertThat(sum.getLeft()).isEqualTo(new VariableNode("a"));
        BinaryOperationNode product = (BinaryOperationNode) sum.getRight();
        assertThat(product.getOperator()).isEqualTo(BinaryOperationNode.Operator.MULTIPLY);
    }

    @Test
    void testSubtractionIsLeftAssociative() {
        SymbolicExpression expression = parse("a - b - c == 0");

        BinaryOperationNode outer = (BinaryOperationNode) expression.getLeft();
        assertThat(outer.getRight()).isEqualTo(new VariableNode("c"));
        assertThat(outer.getLeft()).isInstanceOf(BinaryOperationNode.class);
    }

    @Test
    void testUnaryMinusAndParentheses() {
        SymbolicExpression expression = parse("-(x + 1) <= 2.5e1");

        assertThat(expression.getLeft()).isInstanceOf(NegationNode.class);
        assertThat(expression.getRight()).isEqualTo(new NumberNode(25.0));
    }

    @Test
    void testFunctionCallWithSeveralArguments() {
        SymbolicExpression expression = parse("shift(x, k) @ y == z");

        BinaryOperationNode matmul = (BinaryOperationNode) expression.getLeft();
        assertThat(matmul.getOperator()).isEqualTo(BinaryOperationNode.Operator.MATMUL);
        FunctionCallNode call = (FunctionCallNode) matmul.getLeft();
        assertThat(call.getFunction()).isEqualTo("shift");
        assertThat(call.getArguments()).containsExactly(new VariableNode("x"), new VariableNode("k"));
    }

    @Test
    void testVariableNamesInOrderOfFirstAppearance() {
        SymbolicExpression expression = parse("diag(cap) @ y + cap >= demand - y");

        assertThat(expression.variableNames()).containsExactly("cap", "y", "demand");
    }

    @Test
    void testObjectiveHasNoRightHandSide() {
        SymbolicExpression expression = parse("Minimize(cost * x)");

        assertThat(expression.isObjective()).isTrue();
        assertThat(expression.getRight()).isNull();
        assertThat(expression.variableNames()).containsExactly("cost", "x");
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "x + y",
            "a <= b <= c",
            "x = 1",
            "x < 1",
            "x + (y == 1",
            "x == 1 + Minimize(y)",
            "Minimize(x) + 1",
            "x == 1 2",
            "x == $",
            ""
    })
    void testMalformedExpressionsAreRejected(String text) {
        assertThatThrownBy(() -> parse(text)).isInstanceOf(ExpressionParseException.class);
    }

    @Test
    void testParseErrorReportsPosition() {
        assertThatThrownBy(() -> parse("x + y"))
                .isInstanceOf(ExpressionParseException.class)
                .hasMessageContaining("x + y");
    }
}
