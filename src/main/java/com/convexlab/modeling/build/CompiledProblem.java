package com.convexlab.modeling.build;

import java.util.List;

import com.convexlab.modeling.expression.SymbolicExpression;
import com.convexlab.modeling.model.ProblemDefinition;

import lombok.NonNull;
import lombok.Value;

/**
 * Problem whose expressions have been parsed and validated.
 */
@Value
public class CompiledProblem {

    @NonNull
    ProblemDefinition definition;

    @NonNull
    List<SymbolicExpression> constraints;

    @NonNull
    List<SymbolicExpression> objectives;

    /**
     * {@code null} for feasibility problems.
     */
    ObjectiveSense sense;

    /**
     * Variables referenced by the problem, in order of first appearance.
     */
    @NonNull
    List<String> variableNames;

    public String getName() {
        return definition.getName();
    }

    public boolean isOptimized() {
        return sense != null;
    }
}
