package com.convexlab.modeling.operator;

import java.util.List;

import com.convexlab.modeling.algebra.AffineMatrix;
import com.convexlab.modeling.algebra.Shape;
import com.convexlab.modeling.exception.ModelDefinitionException;

import lombok.Getter;

/**
 * Base class handling arity and constant-argument checks.
 */
@Getter
public abstract class AbstractMatrixOperator implements MatrixOperator {

    private final String name;
    private final int arity;

    protected AbstractMatrixOperator(String name, int arity) {
        this.name = name;
        this.arity = arity;
    }

    @Override
    public final Shape inferShape(List<Shape> arguments) {
        checkArity(arguments.size());
        return resultShape(arguments);
    }

    @Override
    public final AffineMatrix apply(List<AffineMatrix> arguments) {
        checkArity(arguments.size());
        return evaluate(arguments);
    }

    protected abstract Shape resultShape(List<Shape> arguments);

    protected abstract AffineMatrix evaluate(List<AffineMatrix> arguments);

    protected void requireConstant(List<Shape> arguments) {
        for (int i = 0; i < arguments.size(); i++) {
            if (!arguments.get(i).isConstant()) {
                throw new ModelDefinitionException("Operator '" + name + "' requires constant arguments, argument "
                        + (i + 1) + " depends on decision variables");
            }
        }
    }

    private void checkArity(int count) {
        if (count != arity) {
            throw new ModelDefinitionException("Operator '" + name + "' expects " + arity + " argument(s), got " + count);
        }
    }

    @Override
    public String toString() {
        return name + "/" + arity;
    }
}
