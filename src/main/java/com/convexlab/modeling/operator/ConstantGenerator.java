package com.convexlab.modeling.operator;

import com.convexlab.modeling.algebra.Shape;

/**
 * Produces the values of a constant table from the shape of the variable
 * that references it. The generated shape may differ from the variable shape
 * (e.g. {@code identity} turns a vector into a square matrix).
 */
public interface ConstantGenerator {

    String getName();

    /**
     * Shape of the generated values for a variable of {@code rows x cols}.
     *
     * @throws com.convexlab.modeling.exception.ModelDefinitionException if the
     *         variable shape is not supported
     */
    Shape outputShape(int rows, int cols);

    double[][] generate(int rows, int cols);
}
