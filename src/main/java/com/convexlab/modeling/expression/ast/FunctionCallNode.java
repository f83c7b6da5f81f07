package com.convexlab.modeling.expression.ast;

import java.util.List;
import java.util.stream.Collectors;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Call of a registered operator, e.g. {@code tran(cost)}.
 */
@Getter
@EqualsAndHashCode(callSuper = false)
public class FunctionCallNode extends ExpressionNode {
    private final String function;
    private final List<ExpressionNode> arguments;

    public FunctionCallNode(String function, List<ExpressionNode> arguments) {
        this.function = function;
        this.arguments = List.copyOf(arguments);
    }

    @Override
    public <T> T accept(ExpressionNodeVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String toString() {
        return function + arguments.stream().map(String::valueOf).collect(Collectors.joining(", ", "(", ")"));
    }
}
