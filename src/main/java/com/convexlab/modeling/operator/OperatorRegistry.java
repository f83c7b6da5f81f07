package com.convexlab.modeling.operator;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.convexlab.modeling.exception.ModelDefinitionException;
import com.convexlab.modeling.expression.ExpressionParser;

/**
 * Name to {@link MatrixOperator} lookup used by shape checking and instantiation.
 *
 * Register custom operators before building models; the registry is read
 * concurrently afterwards.
 */
public class OperatorRegistry {
    private static final Logger log = LoggerFactory.getLogger(OperatorRegistry.class);

    private final Map<String, MatrixOperator> operators = new LinkedHashMap<>();

    /**
     * Registry holding the built-in operators.
     */
    public static OperatorRegistry withDefaults() {
        OperatorRegistry registry = new OperatorRegistry();
        registry.register(new TransposeOperator());
        registry.register(new DiagonalOperator());
        registry.register(new SumOperator());
        registry.register(new ElementwiseMultiplyOperator());
        registry.register(ConstantElementwiseOperator.power());
        registry.register(new MatrixInverseOperator());
        registry.register(new ShiftOperator());
        registry.register(ConstantElementwiseOperator.annuity());
        registry.register(new WeibullOperator());
        return registry;
    }

    public synchronized OperatorRegistry register(MatrixOperator operator) {
        String name = operator.getName();
        if (ExpressionParser.MINIMIZE.equals(name) || ExpressionParser.MAXIMIZE.equals(name)) {
            throw new ModelDefinitionException("'" + name + "' is reserved for objectives");
        }
        MatrixOperator previous = operators.put(name, operator);
        if (previous != null) {
            log.warn("Operator '{}' replaced by {}", name, operator.getClass().getSimpleName());
        } else {
            log.debug("Registered operator '{}'", name);
        }
        return this;
    }

    public synchronized Optional<MatrixOperator> find(String name) {
        return Optional.ofNullable(operators.get(name));
    }

    public MatrixOperator get(String name) {
        return find(name).orElseThrow(() -> new ModelDefinitionException("Unknown operator '" + name
                + "'. Available operators: " + names()));
    }

    public synchronized boolean contains(String name) {
        return operators.containsKey(name)
                || ExpressionParser.MINIMIZE.equals(name) || ExpressionParser.MAXIMIZE.equals(name);
    }

    public synchronized Set<String> names() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(operators.keySet()));
    }
}
