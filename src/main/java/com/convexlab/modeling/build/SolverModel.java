package com.convexlab.modeling.build;

import java.util.List;

import com.convexlab.modeling.algebra.AffineExpression;
import com.convexlab.modeling.binding.DecisionSpace;
import com.convexlab.modeling.binding.DecisionVariable;
import com.convexlab.modeling.scenario.Scenario;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Solver-ready linear model of one problem in one scenario.
 */
@Value
@Builder
public class SolverModel {

    @NonNull
    String problemName;

    @NonNull
    Scenario scenario;

    @NonNull
    DecisionSpace decisionSpace;

    @NonNull
    @Singular
    List<LinearConstraint> constraints;

    /**
     * {@code null} for feasibility problems.
     */
    ObjectiveSense sense;

    @NonNull
    @Builder.Default
    AffineExpression objective = AffineExpression.ZERO;

    /**
     * Rows without decision variables whose constant side is violated.
     */
    @NonNull
    @Singular
    List<String> violatedConstantRows;

    public List<DecisionVariable> getVariables() {
        return decisionSpace.getVariables();
    }

    public boolean isOptimized() {
        return sense != null;
    }

    public boolean isTriviallyInfeasible() {
        return !violatedConstantRows.isEmpty();
    }
}
