package com.convexlab.modeling.instantiate;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.convexlab.modeling.algebra.AffineMatrix;
import com.convexlab.modeling.binding.VariableAccessor;
import com.convexlab.modeling.exception.ModelDefinitionException;
import com.convexlab.modeling.expression.ast.BinaryOperationNode;
import com.convexlab.modeling.expression.ast.ExpressionNode;
import com.convexlab.modeling.expression.ast.ExpressionNodeVisitor;
import com.convexlab.modeling.expression.ast.FunctionCallNode;
import com.convexlab.modeling.expression.ast.NegationNode;
import com.convexlab.modeling.expression.ast.NumberNode;
import com.convexlab.modeling.expression.ast.VariableNode;
import com.convexlab.modeling.model.Coordinate;
import com.convexlab.modeling.operator.OperatorRegistry;

/**
 * Evaluates an expression tree to affine matrices at one intra-problem coordinate.
 */
class AffineEvaluator implements ExpressionNodeVisitor<AffineMatrix> {

    private final Map<String, VariableAccessor> accessors;
    private final OperatorRegistry operators;
    private final Coordinate coordinate;

    AffineEvaluator(Map<String, VariableAccessor> accessors, OperatorRegistry operators, Coordinate coordinate) {
        this.accessors = accessors;
        this.operators = operators;
        this.coordinate = coordinate;
    }

    @Override
    public AffineMatrix visit(NumberNode number) {
        return AffineMatrix.scalar(number.getValue());
    }

    @Override
    public AffineMatrix visit(VariableNode variable) {
        VariableAccessor accessor = accessors.get(variable.getName());
        if (accessor == null) {
            throw new ModelDefinitionException("Unknown variable '" + variable.getName() + "'");
        }
        return accessor.valueAt(coordinate);
    }

    @Override
    public AffineMatrix visit(NegationNode negation) {
        return negation.getOperand().accept(this).negate();
    }

    @Override
    public AffineMatrix visit(BinaryOperationNode operation) {
        AffineMatrix left = operation.getLeft().accept(this);
        AffineMatrix right = operation.getRight().accept(this);
        return switch (operation.getOperator()) {
            case ADD -> left.plus(right);
            case SUBTRACT -> left.minus(right);
            case MULTIPLY -> left.multiplyElementwise(right);
            case MATMUL -> left.matmul(right);
            case DIVIDE -> left.divideElementwise(right);
        };
    }

    @Override
    public AffineMatrix visit(FunctionCallNode call) {
        List<AffineMatrix> arguments = new ArrayList<>();
        for (ExpressionNode argument : call.getArguments()) {
            arguments.add(argument.accept(this));
        }
        return operators.get(call.getFunction()).apply(arguments);
    }
}
