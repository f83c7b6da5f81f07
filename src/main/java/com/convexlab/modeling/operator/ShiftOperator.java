package com.convexlab.modeling.operator;

import java.util.List;

import com.convexlab.modeling.algebra.AffineMatrix;
import com.convexlab.modeling.algebra.Shape;
import com.convexlab.modeling.exception.DimensionMismatchException;

/**
 * {@code shift(v, k)}: n x n shifted identity, n being the length of vector {@code v}.
 *
 * A 1x1 shift {@code k} places ones on the k-th diagonal (positive above the
 * main diagonal). A vector shift moves the one of column {@code j} to row
 * {@code j + k[j]}; columns shifted out of range stay empty.
 */
public class ShiftOperator extends AbstractMatrixOperator {

    public ShiftOperator() {
        super("shift", 2);
    }

    @Override
    protected Shape resultShape(List<Shape> arguments) {
        requireConstant(arguments);
        Shape reference = arguments.get(0);
        Shape shift = arguments.get(1);
        if (!reference.isVector()) {
            throw new DimensionMismatchException("Operator 'shift' requires a vector as first argument, got "
                    + reference.describe());
        }
        int n = Math.max(reference.getRows(), reference.getCols());
        if (!shift.isScalar() && !(shift.isVector() && Math.max(shift.getRows(), shift.getCols()) == n)) {
            throw new DimensionMismatchException("Operator 'shift' requires a 1x1 shift or a vector of length " + n
                    + ", got " + shift.describe());
        }
        return Shape.of(n, n, true);
    }

    @Override
    protected AffineMatrix evaluate(List<AffineMatrix> arguments) {
        Shape result = resultShape(List.of(arguments.get(0).shape(), arguments.get(1).shape()));
        int n = result.getRows();
        double[][] matrix = new double[n][n];
        AffineMatrix shift = arguments.get(1);
        if (shift.isScalar()) {
            int k = (int) Math.round(shift.scalarValue());
            for (int i = 0; i < n; i++) {
                int j = i + k;
                if (j >= 0 && j < n) {
                    matrix[i][j] = 1.0;
                }
            }
        } else {
            double[][] values = shift.toArray();
            for (int j = 0; j < n; j++) {
                double k = shift.getRows() == 1 ? values[0][j] : values[j][0];
                int row = j + (int) Math.round(k);
                if (row >= 0 && row < n) {
                    matrix[row][j] = 1.0;
                }
            }
        }
        return AffineMatrix.constant(matrix);
    }
}
