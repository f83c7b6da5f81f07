package com.convexlab.modeling.build;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.convexlab.modeling.algebra.Shape;
import com.convexlab.modeling.binding.VariableBinder;
import com.convexlab.modeling.binding.VariableLayout;
import com.convexlab.modeling.exception.MissingObjectiveException;
import com.convexlab.modeling.exception.ModelDefinitionException;
import com.convexlab.modeling.expression.ExpressionKind;
import com.convexlab.modeling.expression.ExpressionParser;
import com.convexlab.modeling.expression.SymbolicExpression;
import com.convexlab.modeling.instantiate.ShapeChecker;
import com.convexlab.modeling.model.ModelDefinition;
import com.convexlab.modeling.model.ProblemDefinition;
import com.convexlab.modeling.operator.OperatorRegistry;

/**
 * Parses and validates every problem of a model before any numeric work:
 * names, allocations, objectives, shapes and linearity.
 *
 * Fails fast with the first structural error.
 */
public class ModelValidator {
    private static final Logger log = LoggerFactory.getLogger(ModelValidator.class);

    private final ModelDefinition model;
    private final VariableBinder binder;
    private final OperatorRegistry operators;
    private final ShapeChecker shapeChecker;

    public ModelValidator(ModelDefinition model, VariableBinder binder, OperatorRegistry operators) {
        this.model = model;
        this.binder = binder;
        this.operators = operators;
        this.shapeChecker = new ShapeChecker(operators);
    }

    /**
     * @return compiled problems in declaration order
     */
    public Map<String, CompiledProblem> validate() {
        model.getVariables().forEach((key, variable) -> {
            if (!key.equals(variable.getName())) {
                throw new ModelDefinitionException("Variable '" + variable.getName() + "' is registered under name '"
                        + key + "'");
            }
            if (!model.getTables().containsKey(variable.getTable())) {
                throw new ModelDefinitionException("Variable '" + key + "' refers to unknown table '"
                        + variable.getTable() + "'");
            }
            if (operators.contains(key)) {
                throw new ModelDefinitionException("Variable name '" + key + "' collides with an operator");
            }
        });
        Map<String, CompiledProblem> compiled = new LinkedHashMap<>();
        for (ProblemDefinition problem : model.getProblems().values()) {
            compiled.put(problem.getName(), compile(problem));
        }
        log.info("Validated {} problem(s)", compiled.size());
        return compiled;
    }

    public CompiledProblem compile(ProblemDefinition problem) {
        ExpressionParser parser = new ExpressionParser();
        if (problem.getExpressions().isEmpty() && problem.getObjectives().isEmpty()) {
            throw new ModelDefinitionException("Problem '" + problem.getName() + "' declares no expression");
        }

        List<SymbolicExpression> constraints = new ArrayList<>();
        for (String text : problem.getExpressions()) {
            SymbolicExpression expression = parser.parse(text);
            if (expression.isObjective()) {
                throw new ModelDefinitionException("Problem '" + problem.getName() + "': objective '" + text
                        + "' declared among constraint expressions");
            }
            constraints.add(expression);
        }

        List<SymbolicExpression> objectives = new ArrayList<>();
        for (String text : problem.getObjectives()) {
            SymbolicExpression expression = parser.parse(text);
            if (!expression.isObjective()) {
                throw new ModelDefinitionException("Problem '" + problem.getName() + "': objective '" + text
                        + "' must be wrapped in Minimize(...) or Maximize(...)");
            }
            objectives.add(expression);
        }

        ObjectiveSense sense = null;
        if (problem.isOptimized()) {
            if (objectives.isEmpty()) {
                throw new MissingObjectiveException(problem.getName());
            }
            sense = senseOf(problem, objectives);
        } else if (!objectives.isEmpty()) {
            log.warn("Problem '{}' is not optimized, its {} objective(s) are ignored", problem.getName(),
                    objectives.size());
            objectives = List.of();
        }

        Set<String> variableNames = new LinkedHashSet<>();
        constraints.forEach(e -> variableNames.addAll(e.variableNames()));
        objectives.forEach(e -> variableNames.addAll(e.variableNames()));

        Map<String, Shape> shapes = new LinkedHashMap<>();
        for (String name : variableNames) {
            VariableLayout layout = binder.layout(model.variable(name), problem.getName());
            shapes.put(name, layout.getShape());
        }
        for (SymbolicExpression expression : constraints) {
            shapeChecker.check(expression, shapes);
        }
        for (SymbolicExpression expression : objectives) {
            shapeChecker.check(expression, shapes);
        }

        log.debug("Problem '{}': {} constraint(s), {} objective(s), variables {}", problem.getName(),
                constraints.size(), objectives.size(), variableNames);
        return new CompiledProblem(problem, constraints, objectives, sense, List.copyOf(variableNames));
    }

    private static ObjectiveSense senseOf(ProblemDefinition problem, List<SymbolicExpression> objectives) {
        Set<ExpressionKind> kinds = new LinkedHashSet<>();
        objectives.forEach(o -> kinds.add(o.getKind()));
        if (kinds.size() > 1) {
            throw new ModelDefinitionException("Problem '" + problem.getName()
                    + "' mixes Minimize and Maximize objectives");
        }
        return kinds.contains(ExpressionKind.MAXIMIZE) ? ObjectiveSense.MAXIMIZE : ObjectiveSense.MINIMIZE;
    }
}
