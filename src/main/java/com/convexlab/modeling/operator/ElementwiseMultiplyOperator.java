package com.convexlab.modeling.operator;

import java.util.List;

import com.convexlab.modeling.algebra.AffineMatrix;
import com.convexlab.modeling.algebra.Shape;
import com.convexlab.modeling.exception.ModelDefinitionException;

/**
 * {@code mult(a, b)}: element-wise product, at most one operand decision-dependent.
 */
public class ElementwiseMultiplyOperator extends AbstractMatrixOperator {

    public ElementwiseMultiplyOperator() {
        super("mult", 2);
    }

    @Override
    protected Shape resultShape(List<Shape> arguments) {
        Shape a = arguments.get(0);
        Shape b = arguments.get(1);
        if (!a.isConstant() && !b.isConstant()) {
            throw new ModelDefinitionException("Non-linear term: 'mult' of two decision-dependent operands");
        }
        return Shape.broadcast(getName(), a, b, a.isConstant() && b.isConstant());
    }

    @Override
    protected AffineMatrix evaluate(List<AffineMatrix> arguments) {
        return arguments.get(0).multiplyElementwise(arguments.get(1));
    }
}
