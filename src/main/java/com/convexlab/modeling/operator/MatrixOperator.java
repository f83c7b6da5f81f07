package com.convexlab.modeling.operator;

import java.util.List;

import com.convexlab.modeling.algebra.AffineMatrix;
import com.convexlab.modeling.algebra.Shape;

/**
 * Named function usable in symbolic expressions, e.g. {@code tran(x)}.
 *
 * Implementations are stateless and thread-safe.
 */
public interface MatrixOperator {

    /**
     * Name the operator is called by in expressions.
     */
    String getName();

    /**
     * Validates argument shapes and returns the result shape. Called once per
     * expression definition, before any numeric work.
     *
     * @throws com.convexlab.modeling.exception.DimensionMismatchException on incompatible shapes
     * @throws com.convexlab.modeling.exception.ModelDefinitionException on a wrong argument count
     *         or a decision-dependent argument where a constant is required
     */
    Shape inferShape(List<Shape> arguments);

    /**
     * Shape pass variant that also sees numeric literal arguments; {@code literals}
     * holds the literal value per argument position, {@code null} elsewhere.
     */
    default Shape inferShape(List<Shape> arguments, List<Double> literals) {
        return inferShape(arguments);
    }

    AffineMatrix apply(List<AffineMatrix> arguments);
}
