package com.convexlab.modeling.operator;

import java.util.List;

import com.convexlab.modeling.algebra.AffineMatrix;
import com.convexlab.modeling.algebra.Shape;

public class TransposeOperator extends AbstractMatrixOperator {

    public TransposeOperator() {
        super("tran", 1);
    }

    @Override
    protected Shape resultShape(List<Shape> arguments) {
        Shape x = arguments.get(0);
        return Shape.of(x.getCols(), x.getRows(), x.isConstant());
    }

    @Override
    protected AffineMatrix evaluate(List<AffineMatrix> arguments) {
        return arguments.get(0).transpose();
    }
}
