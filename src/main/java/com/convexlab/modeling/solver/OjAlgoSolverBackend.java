package com.convexlab.modeling.solver;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import org.ojalgo.optimisation.Expression;
import org.ojalgo.optimisation.ExpressionsBasedModel;
import org.ojalgo.optimisation.Optimisation;
import org.ojalgo.optimisation.Variable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.convexlab.modeling.binding.DecisionVariable;
import com.convexlab.modeling.build.LinearConstraint;
import com.convexlab.modeling.build.ObjectiveSense;
import com.convexlab.modeling.build.SolverModel;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * {@link SolverBackend} over the ojAlgo {@link ExpressionsBasedModel} LP/MIP solver.
 */
public class OjAlgoSolverBackend implements SolverBackend {
    private static final Logger log = LoggerFactory.getLogger(OjAlgoSolverBackend.class);

    @Getter
    @RequiredArgsConstructor
    static final class OjAlgoModelHandle implements ModelHandle {
        private final SolverModel model;
        private final ExpressionsBasedModel ojModel;
    }

    @Override
    public ModelHandle buildModel(SolverModel model) {
        ExpressionsBasedModel ojModel = new ExpressionsBasedModel();
        List<DecisionVariable> decisions = model.getVariables();
        Variable[] variables = new Variable[decisions.size()];

        Map<Integer, Double> weights = model.isOptimized() ? model.getObjective().getCoefficients() : Map.of();
        for (DecisionVariable decision : decisions) {
            Variable variable = ojModel.newVariable(decision.label());
            switch (decision.getValueType()) {
                case INTEGER:
                    variable.integer();
                    break;
                case BINARY:
                    variable.binary();
                    break;
                default:
                    break;
            }
            Double weight = weights.get(decision.getIndex());
            if (weight != null) {
                variable.weight(BigDecimal.valueOf(weight));
            }
            variables[decision.getIndex()] = variable;
        }

        for (LinearConstraint constraint : model.getConstraints()) {
            Expression expression = ojModel.newExpression(constraint.getName());
            constraint.getCoefficients().forEach((index, coefficient) ->
                    expression.set(variables[index], BigDecimal.valueOf(coefficient)));
            BigDecimal rhs = BigDecimal.valueOf(constraint.getRhs());
            switch (constraint.getType()) {
                case EQUAL:
                    expression.level(rhs);
                    break;
                case LESS_EQUAL:
                    expression.upper(rhs);
                    break;
                default:
                    expression.lower(rhs);
                    break;
            }
        }
        return new OjAlgoModelHandle(model, ojModel);
    }

    @Override
    public SolverResult solve(ModelHandle handle, SolverOptions options) {
        OjAlgoModelHandle ojHandle = (OjAlgoModelHandle) handle;
        SolverModel model = ojHandle.getModel();
        ExpressionsBasedModel ojModel = ojHandle.getOjModel();
        if (options.hasTimeout()) {
            ojModel.options.time_abort = options.getTimeoutMillis();
        }

        Optimisation.Result result;
        try {
            result = model.getSense() == ObjectiveSense.MAXIMIZE ? ojModel.maximise() : ojModel.minimise();
        } catch (RuntimeException e) {
            log.error("Solver failed on problem '{}', scenario {}: {}", model.getProblemName(), model.getScenario(),
                    e.getMessage());
            return SolverResult.failure(SolveStatus.SOLVER_ERROR, "Solver failure: " + e.getMessage());
        }

        Optimisation.State state = result.getState();
        SolveStatus status = toStatus(state, model.isOptimized());
        log.debug("Problem '{}', scenario {}: ojAlgo state {} -> {}", model.getProblemName(), model.getScenario(),
                state, status);
        if (status != SolveStatus.OPTIMAL) {
            return SolverResult.failure(status, "Solver state " + state);
        }

        double[] values = new double[model.getVariables().size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = result.get(i).doubleValue();
        }
        double objectiveValue = model.isOptimized()
                ? model.getObjective().evaluate(values)
                : 0.0;
        return SolverResult.builder()
                .status(SolveStatus.OPTIMAL)
                .objectiveValue(objectiveValue)
                .values(values)
                .message(state.toString())
                .build();
    }

    static SolveStatus toStatus(Optimisation.State state, boolean optimized) {
        if (state == Optimisation.State.UNBOUNDED) {
            return SolveStatus.UNBOUNDED;
        }
        if (state == Optimisation.State.INFEASIBLE) {
            return SolveStatus.INFEASIBLE;
        }
        if (optimized ? state.isOptimal() : state.isFeasible()) {
            return SolveStatus.OPTIMAL;
        }
        return SolveStatus.SOLVER_ERROR;
    }
}
