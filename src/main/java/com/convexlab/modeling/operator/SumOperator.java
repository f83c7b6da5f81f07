package com.convexlab.modeling.operator;

import java.util.List;

import com.convexlab.modeling.algebra.AffineMatrix;
import com.convexlab.modeling.algebra.Shape;

/**
 * {@code sum(x)}: sum of all entries as a 1x1 value.
 */
public class SumOperator extends AbstractMatrixOperator {

    public SumOperator() {
        super("sum", 1);
    }

    @Override
    protected Shape resultShape(List<Shape> arguments) {
        return Shape.of(1, 1, arguments.get(0).isConstant());
    }

    @Override
    protected AffineMatrix evaluate(List<AffineMatrix> arguments) {
        return arguments.get(0).sum();
    }
}
