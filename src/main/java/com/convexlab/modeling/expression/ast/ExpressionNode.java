package com.convexlab.modeling.expression.ast;

/**
 * Base class for all expression tree nodes.
 */
public abstract class ExpressionNode {

    public abstract <T> T accept(ExpressionNodeVisitor<T> visitor);
}
