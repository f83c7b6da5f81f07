package com.convexlab.modeling.operator;

import java.util.Arrays;
import java.util.List;

import com.convexlab.modeling.algebra.AffineExpression;
import com.convexlab.modeling.algebra.AffineMatrix;
import com.convexlab.modeling.algebra.Shape;
import com.convexlab.modeling.exception.DimensionMismatchException;

/**
 * {@code diag(v)}: a vector becomes a square diagonal matrix; a square matrix
 * yields its diagonal as a column vector.
 */
public class DiagonalOperator extends AbstractMatrixOperator {

    public DiagonalOperator() {
        super("diag", 1);
    }

    @Override
    protected Shape resultShape(List<Shape> arguments) {
        Shape x = arguments.get(0);
        if (x.isVector()) {
            int n = Math.max(x.getRows(), x.getCols());
            return Shape.of(n, n, x.isConstant());
        }
        if (x.isSquare()) {
            return Shape.of(x.getRows(), 1, x.isConstant());
        }
        throw new DimensionMismatchException("Operator 'diag' requires a vector or a square matrix, got " + x.describe());
    }

    @Override
    protected AffineMatrix evaluate(List<AffineMatrix> arguments) {
        AffineMatrix x = arguments.get(0);
        if (x.getRows() == 1 || x.getCols() == 1) {
            int n = Math.max(x.getRows(), x.getCols());
            AffineExpression[] entries = new AffineExpression[n * n];
            Arrays.fill(entries, AffineExpression.ZERO);
            for (int i = 0; i < n; i++) {
                entries[i * n + i] = x.getRows() == 1 ? x.get(0, i) : x.get(i, 0);
            }
            return AffineMatrix.of(n, n, entries);
        }
        resultShape(List.of(x.shape()));
        AffineExpression[] diagonal = new AffineExpression[x.getRows()];
        for (int i = 0; i < diagonal.length; i++) {
            diagonal[i] = x.get(i, i);
        }
        return AffineMatrix.of(diagonal.length, 1, diagonal);
    }
}
