package com.convexlab.modeling.instantiate;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.convexlab.modeling.algebra.AffineMatrix;
import com.convexlab.modeling.binding.VariableAccessor;
import com.convexlab.modeling.domain.CartesianProduct;
import com.convexlab.modeling.exception.ModelDefinitionException;
import com.convexlab.modeling.expression.SymbolicExpression;
import com.convexlab.modeling.model.Coordinate;
import com.convexlab.modeling.operator.OperatorRegistry;

/**
 * Expands a symbolic expression into one numeric instance per combination of
 * the intra-problem sets of the variables it references.
 *
 * The sets are taken in order of first introduction, left to right through
 * the expression. When several variables share an intra-problem set, only the
 * items all of them select are enumerated.
 */
public class ExpressionInstantiator {
    private static final Logger log = LoggerFactory.getLogger(ExpressionInstantiator.class);

    private final OperatorRegistry operators;

    public ExpressionInstantiator(OperatorRegistry operators) {
        this.operators = operators;
    }

    public List<ExpressionInstance> instantiate(SymbolicExpression expression, Map<String, VariableAccessor> accessors) {
        Map<String, List<String>> intraItems = intraItems(expression, accessors);
        List<Coordinate> coordinates = CartesianProduct.of(intraItems);

        List<ExpressionInstance> instances = new ArrayList<>(coordinates.size());
        for (Coordinate pi : coordinates) {
            AffineEvaluator evaluator = new AffineEvaluator(accessors, operators, pi);
            AffineMatrix left = expression.getLeft().accept(evaluator);
            AffineMatrix right = expression.getRight() == null ? null : expression.getRight().accept(evaluator);
            instances.add(new ExpressionInstance(expression, pi, left, right));
        }
        log.debug("Expression '{}' expanded to {} instance(s) over {}", expression.getText(), instances.size(),
                intraItems.keySet());
        return instances;
    }

    /**
     * Union of the referenced variables' intra-problem sets with the items to enumerate.
     */
    Map<String, List<String>> intraItems(SymbolicExpression expression, Map<String, VariableAccessor> accessors) {
        Map<String, List<String>> items = new LinkedHashMap<>();
        for (String name : expression.variableNames()) {
            VariableAccessor accessor = accessors.get(name);
            if (accessor == null) {
                throw new ModelDefinitionException("Unknown variable '" + name + "' in expression '"
                        + expression.getText() + "'");
            }
            Map<String, List<String>> own = accessor.getLayout().getIntraDomain().getItems();
            own.forEach((set, selected) -> items.merge(set, selected,
                    (current, other) -> current.stream().filter(other::contains).toList()));
        }
        return items;
    }
}
