package com.convexlab.modeling.instantiate;

import com.convexlab.modeling.algebra.AffineMatrix;
import com.convexlab.modeling.expression.ExpressionKind;
import com.convexlab.modeling.expression.SymbolicExpression;
import com.convexlab.modeling.model.Coordinate;

import lombok.NonNull;
import lombok.Value;

/**
 * Numeric expansion of a symbolic expression at one intra-problem coordinate.
 */
@Value
public class ExpressionInstance {

    @NonNull
    SymbolicExpression expression;

    @NonNull
    Coordinate coordinate;

    @NonNull
    AffineMatrix left;

    /**
     * {@code null} for objective instances.
     */
    AffineMatrix right;

    public ExpressionKind getKind() {
        return expression.getKind();
    }

    /**
     * {@code left - right} for relations, the objective term otherwise.
     */
    public AffineMatrix residual() {
        return right == null ? left : left.minus(right);
    }
}
