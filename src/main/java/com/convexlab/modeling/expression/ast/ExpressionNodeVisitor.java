package com.convexlab.modeling.expression.ast;

/**
 * Visitor pattern interface for evaluating an expression tree.
 *
 * @param <T> the value computed per node
 */
public interface ExpressionNodeVisitor<T> {
    T visit(NumberNode number);
    T visit(VariableNode variable);
    T visit(NegationNode negation);
    T visit(BinaryOperationNode operation);
    T visit(FunctionCallNode call);
}
