package com.convexlab.modeling.build;

import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.convexlab.modeling.algebra.AffineExpression;
import com.convexlab.modeling.algebra.AffineMatrix;
import com.convexlab.modeling.binding.BindingContext;
import com.convexlab.modeling.binding.DecisionSpace;
import com.convexlab.modeling.binding.VariableAccessor;
import com.convexlab.modeling.binding.VariableBinder;
import com.convexlab.modeling.expression.SymbolicExpression;
import com.convexlab.modeling.instantiate.ExpressionInstance;
import com.convexlab.modeling.instantiate.ExpressionInstantiator;
import com.convexlab.modeling.model.ModelDefinition;
import com.convexlab.modeling.scenario.Scenario;
import com.convexlab.modeling.store.TableView;

/**
 * Assembles the instantiated constraints and objective of one problem in one
 * scenario into a {@link SolverModel}.
 */
public class ProblemBuilder {
    private static final Logger log = LoggerFactory.getLogger(ProblemBuilder.class);

    private static final double CONSTANT_ROW_TOLERANCE = 1e-9;

    private final ModelDefinition model;
    private final VariableBinder binder;
    private final ExpressionInstantiator instantiator;

    public ProblemBuilder(ModelDefinition model, VariableBinder binder, ExpressionInstantiator instantiator) {
        this.model = model;
        this.binder = binder;
        this.instantiator = instantiator;
    }

    /**
     * @param dataView values visible to this build, usually the unit's staging area
     * @throws com.convexlab.modeling.exception.MissingDataException if a required exogenous value is absent
     */
    public SolverModel build(CompiledProblem problem, Scenario scenario, TableView dataView) {
        DecisionSpace decisions = new DecisionSpace();
        BindingContext context = BindingContext.builder()
                .problemName(problem.getName())
                .dataView(dataView)
                .decisionSpace(decisions)
                .build();

        Map<String, VariableAccessor> accessors = new LinkedHashMap<>();
        for (String name : problem.getVariableNames()) {
            accessors.put(name, binder.bind(model.variable(name), scenario, context));
        }

        SolverModel.SolverModelBuilder builder = SolverModel.builder()
                .problemName(problem.getName())
                .scenario(scenario)
                .decisionSpace(decisions)
                .sense(problem.getSense());

        int expressionIndex = 0;
        for (SymbolicExpression expression : problem.getConstraints()) {
            for (ExpressionInstance instance : instantiator.instantiate(expression, accessors)) {
                addRows(builder, problem.getName() + "#" + expressionIndex, instance);
            }
            expressionIndex++;
        }

        AffineExpression objective = AffineExpression.ZERO;
        for (SymbolicExpression expression : problem.getObjectives()) {
            for (ExpressionInstance instance : instantiator.instantiate(expression, accessors)) {
                objective = objective.plus(instance.getLeft().get(0, 0));
            }
        }
        builder.objective(objective);

        SolverModel solverModel = builder.build();
        log.debug("Built problem '{}' for scenario {}: {} variable(s), {} constraint(s)", problem.getName(),
                scenario, decisions.size(), solverModel.getConstraints().size());
        return solverModel;
    }

    private static void addRows(SolverModel.SolverModelBuilder builder, String prefix, ExpressionInstance instance) {
        AffineMatrix residual = instance.residual();
        LinearConstraint.Type type = switch (instance.getKind()) {
            case EQUALITY -> LinearConstraint.Type.EQUAL;
            case LESS_EQUAL -> LinearConstraint.Type.LESS_EQUAL;
            case GREATER_EQUAL -> LinearConstraint.Type.GREATER_EQUAL;
            default -> throw new IllegalStateException("Not a relation: " + instance.getKind());
        };
        for (int i = 0; i < residual.getRows(); i++) {
            for (int j = 0; j < residual.getCols(); j++) {
                AffineExpression entry = residual.get(i, j);
                String name = prefix + instance.getCoordinate() + "[" + i + "," + j + "]";
                if (entry.isConstant()) {
                    if (isViolated(entry.getConstant(), type)) {
                        builder.violatedConstantRow(name + " '" + instance.getExpression().getText() + "'");
                    }
                    continue;
                }
                builder.constraint(new LinearConstraint(name, entry.getCoefficients(), type, -entry.getConstant()));
            }
        }
    }

    private static boolean isViolated(double residual, LinearConstraint.Type type) {
        return switch (type) {
            case EQUAL -> Math.abs(residual) > CONSTANT_ROW_TOLERANCE;
            case LESS_EQUAL -> residual > CONSTANT_ROW_TOLERANCE;
            case GREATER_EQUAL -> residual < -CONSTANT_ROW_TOLERANCE;
        };
    }
}
