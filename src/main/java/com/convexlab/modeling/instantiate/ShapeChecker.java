package com.convexlab.modeling.instantiate;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.convexlab.modeling.algebra.Shape;
import com.convexlab.modeling.exception.DimensionMismatchException;
import com.convexlab.modeling.exception.ModelDefinitionException;
import com.convexlab.modeling.expression.SymbolicExpression;
import com.convexlab.modeling.expression.ast.BinaryOperationNode;
import com.convexlab.modeling.expression.ast.ExpressionNode;
import com.convexlab.modeling.expression.ast.ExpressionNodeVisitor;
import com.convexlab.modeling.expression.ast.FunctionCallNode;
import com.convexlab.modeling.expression.ast.NegationNode;
import com.convexlab.modeling.expression.ast.NumberNode;
import com.convexlab.modeling.expression.ast.VariableNode;
import com.convexlab.modeling.operator.OperatorRegistry;

/**
 * Symbolic shape pass over an expression. Validates dimensional consistency
 * and linearity once per expression definition, independently of the
 * coordinates the expression is later instantiated at.
 */
public class ShapeChecker {
    private static final Logger log = LoggerFactory.getLogger(ShapeChecker.class);

    private final OperatorRegistry operators;

    public ShapeChecker(OperatorRegistry operators) {
        this.operators = operators;
    }

    /**
     * @param variableShapes shape of every variable the expression may reference
     * @return shape of the relation ({@code left - right}) or of the objective term
     * @throws DimensionMismatchException on incompatible shapes or a non-scalar objective
     * @throws ModelDefinitionException on unknown names or non-linear terms
     */
    public Shape check(SymbolicExpression expression, Map<String, Shape> variableShapes) {
        ShapeVisitor visitor = new ShapeVisitor(variableShapes);
        Shape left = evaluate(expression.getLeft(), visitor, expression);
        if (expression.isObjective()) {
            if (!left.isScalar()) {
                throw new DimensionMismatchException("Objective '" + expression.getText()
                        + "' must evaluate to a 1x1 value, got " + left.describe());
            }
            log.debug("Objective '{}' has shape {}", expression.getText(), left);
            return left;
        }
        Shape right = evaluate(expression.getRight(), visitor, expression);
        Shape result;
        try {
            result = Shape.broadcast(expression.getKind().getSymbol(), left, right,
                    left.isConstant() && right.isConstant());
        } catch (DimensionMismatchException e) {
            throw new DimensionMismatchException(e.getMessage() + " in expression '" + expression.getText() + "'");
        }
        if (result.isConstant()) {
            log.warn("Expression '{}' does not depend on any decision variable", expression.getText());
        }
        log.debug("Expression '{}' has shape {}", expression.getText(), result);
        return result;
    }

    private static Shape evaluate(ExpressionNode node, ShapeVisitor visitor, SymbolicExpression expression) {
        try {
            return node.accept(visitor);
        } catch (DimensionMismatchException e) {
            throw new DimensionMismatchException(e.getMessage() + " in expression '" + expression.getText() + "'");
        }
    }

    private final class ShapeVisitor implements ExpressionNodeVisitor<Shape> {
        private final Map<String, Shape> variableShapes;

        private ShapeVisitor(Map<String, Shape> variableShapes) {
            this.variableShapes = variableShapes;
        }

        @Override
        public Shape visit(NumberNode number) {
            return Shape.scalar();
        }

        @Override
        public Shape visit(VariableNode variable) {
            Shape shape = variableShapes.get(variable.getName());
            if (shape == null) {
                throw new ModelDefinitionException("Unknown variable '" + variable.getName() + "'");
            }
            return shape;
        }

        @Override
        public Shape visit(NegationNode negation) {
            return negation.getOperand().accept(this);
        }

        @Override
        public Shape visit(BinaryOperationNode operation) {
            Shape left = operation.getLeft().accept(this);
            Shape right = operation.getRight().accept(this);
            boolean constant = left.isConstant() && right.isConstant();
            String symbol = operation.getOperator().getSymbol();
            switch (operation.getOperator()) {
                case ADD:
                case SUBTRACT:
                    return Shape.broadcast(symbol, left, right, constant);
                case MULTIPLY:
                    requireLinear(symbol, left, right);
                    return Shape.broadcast(symbol, left, right, constant);
                case MATMUL:
                    requireLinear(symbol, left, right);
                    return Shape.matmul(left, right, constant);
                case DIVIDE:
                    if (!right.isConstant()) {
                        throw new ModelDefinitionException("Non-linear term: divisor of '" + operation
                                + "' depends on decision variables");
                    }
                    return Shape.broadcast(symbol, left, right, constant);
                default:
                    throw new IllegalStateException("Unhandled operator " + operation.getOperator());
            }
        }

        @Override
        public Shape visit(FunctionCallNode call) {
            List<Shape> arguments = new ArrayList<>();
            List<Double> literals = new ArrayList<>();
            for (ExpressionNode argument : call.getArguments()) {
                arguments.add(argument.accept(this));
                literals.add(argument instanceof NumberNode ? ((NumberNode) argument).getValue() : null);
            }
            return operators.get(call.getFunction()).inferShape(arguments, literals);
        }

        private void requireLinear(String symbol, Shape left, Shape right) {
            if (!left.isConstant() && !right.isConstant()) {
                throw new ModelDefinitionException("Non-linear term: operator '" + symbol
                        + "' applied to two decision-dependent operands");
            }
        }
    }
}
