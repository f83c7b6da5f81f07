package com.convexlab.modeling.expression;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.convexlab.modeling.expression.ast.BinaryOperationNode;
import com.convexlab.modeling.expression.ast.ExpressionNode;
import com.convexlab.modeling.expression.ast.ExpressionNodeVisitor;
import com.convexlab.modeling.expression.ast.FunctionCallNode;
import com.convexlab.modeling.expression.ast.NegationNode;
import com.convexlab.modeling.expression.ast.NumberNode;
import com.convexlab.modeling.expression.ast.VariableNode;

import lombok.NonNull;
import lombok.Value;

/**
 * Parsed expression: a relation {@code left <op> right} or an objective
 * {@code Minimize(left)} / {@code Maximize(left)} with no right-hand side.
 */
@Value
public class SymbolicExpression {

    @NonNull
    String text;

    @NonNull
    ExpressionKind kind;

    @NonNull
    ExpressionNode left;

    /**
     * {@code null} for objectives.
     */
    ExpressionNode right;

    public boolean isObjective() {
        return kind.isObjective();
    }

    /**
     * Variable names in order of first appearance, left to right.
     */
    public List<String> variableNames() {
        Set<String> names = new LinkedHashSet<>();
        VariableCollector collector = new VariableCollector(names);
        left.accept(collector);
        if (right != null) {
            right.accept(collector);
        }
        return List.copyOf(names);
    }

    private static final class VariableCollector implements ExpressionNodeVisitor<Void> {
        private final Set<String> names;

        private VariableCollector(Set<String> names) {
            this.names = names;
        }

        @Override
        public Void visit(NumberNode number) {
            return null;
        }

        @Override
        public Void visit(VariableNode variable) {
            names.add(variable.getName());
            return null;
        }

        @Override
        public Void visit(NegationNode negation) {
            return negation.getOperand().accept(this);
        }

        @Override
        public Void visit(BinaryOperationNode operation) {
            operation.getLeft().accept(this);
            return operation.getRight().accept(this);
        }

        @Override
        public Void visit(FunctionCallNode call) {
            call.getArguments().forEach(arg -> arg.accept(this));
            return null;
        }
    }

    @Override
    public String toString() {
        return text;
    }
}
