package com.convexlab.modeling.operator;

import java.util.List;

import com.convexlab.modeling.algebra.AffineMatrix;
import com.convexlab.modeling.algebra.Shape;
import com.convexlab.modeling.exception.DimensionMismatchException;
import com.convexlab.modeling.exception.ModelDefinitionException;

/**
 * {@code minv(A)}: inverse of a constant square matrix (Gauss-Jordan with partial pivoting).
 */
public class MatrixInverseOperator extends AbstractMatrixOperator {

    private static final double SINGULARITY_THRESHOLD = 1e-12;

    public MatrixInverseOperator() {
        super("minv", 1);
    }

    @Override
    protected Shape resultShape(List<Shape> arguments) {
        requireConstant(arguments);
        Shape a = arguments.get(0);
        if (!a.isSquare()) {
            throw new DimensionMismatchException("Operator 'minv' requires a square matrix, got " + a.describe());
        }
        return a;
    }

    @Override
    protected AffineMatrix evaluate(List<AffineMatrix> arguments) {
        resultShape(List.of(arguments.get(0).shape()));
        return AffineMatrix.constant(invert(arguments.get(0).toArray()));
    }

    static double[][] invert(double[][] matrix) {
        int n = matrix.length;
        double[][] a = new double[n][2 * n];
        for (int i = 0; i < n; i++) {
            System.arraycopy(matrix[i], 0, a[i], 0, n);
            a[i][n + i] = 1.0;
        }
        for (int col = 0; col < n; col++) {
            int pivot = col;
            for (int row = col + 1; row < n; row++) {
                if (Math.abs(a[row][col]) > Math.abs(a[pivot][col])) {
                    pivot = row;
                }
            }
            if (Math.abs(a[pivot][col]) < SINGULARITY_THRESHOLD) {
                throw new ModelDefinitionException("Operator 'minv': matrix is singular");
            }
            double[] swap = a[col];
            a[col] = a[pivot];
            a[pivot] = swap;

            double p = a[col][col];
            for (int j = 0; j < 2 * n; j++) {
                a[col][j] /= p;
            }
            for (int row = 0; row < n; row++) {
                if (row != col && a[row][col] != 0.0) {
                    double factor = a[row][col];
                    for (int j = 0; j < 2 * n; j++) {
                        a[row][j] -= factor * a[col][j];
                    }
                }
            }
        }
        double[][] inverse = new double[n][n];
        for (int i = 0; i < n; i++) {
            System.arraycopy(a[i], n, inverse[i], 0, n);
        }
        return inverse;
    }
}
