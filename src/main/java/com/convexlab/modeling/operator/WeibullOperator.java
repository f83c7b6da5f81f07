package com.convexlab.modeling.operator;

import java.util.List;

import com.convexlab.modeling.algebra.AffineMatrix;
import com.convexlab.modeling.algebra.Shape;
import com.convexlab.modeling.exception.DimensionMismatchException;
import com.convexlab.modeling.exception.ModelDefinitionException;

/**
 * {@code weib(scale, shape, range, dimensions)}: Weibull lifetime distribution
 * over the periods of {@code range}.
 *
 * Entry i is the Weibull density at i + 1, normalised so the entries sum to
 * one. With {@code dimensions} 1 the result is an n x 1 vector; with 2 it is
 * an n x n matrix whose column j holds the distribution starting at row j,
 * truncated at the last period.
 */
public class WeibullOperator extends AbstractMatrixOperator {

    public WeibullOperator() {
        super("weib", 4);
    }

    /**
     * The result shape depends on {@code dimensions}, which must be a numeric literal.
     */
    @Override
    public Shape inferShape(List<Shape> arguments, List<Double> literals) {
        inferShape(arguments);
        Double dimensions = literals.size() == 4 ? literals.get(3) : null;
        if (dimensions == null) {
            throw new ModelDefinitionException("Operator 'weib' requires a numeric literal as dimensions argument");
        }
        return shapeFor(arguments.get(2), dimensions(dimensions));
    }

    @Override
    protected Shape resultShape(List<Shape> arguments) {
        requireConstant(arguments);
        if (!arguments.get(0).isScalar() || !arguments.get(1).isScalar() || !arguments.get(3).isScalar()) {
            throw new DimensionMismatchException("Operator 'weib' requires 1x1 scale, shape and dimensions");
        }
        Shape range = arguments.get(2);
        if (!range.isVector()) {
            throw new DimensionMismatchException("Operator 'weib' requires a vector range, got " + range.describe());
        }
        return shapeFor(range, 2);
    }

    @Override
    protected AffineMatrix evaluate(List<AffineMatrix> arguments) {
        resultShape(List.of(arguments.get(0).shape(), arguments.get(1).shape(), arguments.get(2).shape(),
                arguments.get(3).shape()));
        double scale = arguments.get(0).scalarValue();
        double shape = arguments.get(1).scalarValue();
        int dimensions = dimensions(arguments.get(3).scalarValue());
        if (scale <= 0 || shape <= 0) {
            throw new ModelDefinitionException("Operator 'weib' requires positive scale and shape, got "
                    + scale + " and " + shape);
        }

        AffineMatrix range = arguments.get(2);
        int n = Math.max(range.getRows(), range.getCols());
        double[] distribution = distribution(scale, shape, n);

        if (dimensions == 1) {
            double[][] vector = new double[n][1];
            for (int i = 0; i < n; i++) {
                vector[i][0] = distribution[i];
            }
            return AffineMatrix.constant(vector);
        }
        double[][] matrix = new double[n][n];
        for (int j = 0; j < n; j++) {
            for (int i = j; i < n; i++) {
                matrix[i][j] = distribution[i - j];
            }
        }
        return AffineMatrix.constant(matrix);
    }

    private static Shape shapeFor(Shape range, int dimensions) {
        int n = Math.max(range.getRows(), range.getCols());
        return Shape.of(n, dimensions == 1 ? 1 : n, true);
    }

    private static int dimensions(double value) {
        int dimensions = (int) Math.round(value);
        if (dimensions != 1 && dimensions != 2) {
            throw new ModelDefinitionException("Operator 'weib' supports 1 or 2 dimensions, got " + value);
        }
        return dimensions;
    }

    static double[] distribution(double scale, double shape, int periods) {
        double[] values = new double[periods];
        double total = 0.0;
        for (int i = 0; i < periods; i++) {
            double x = (i + 1) / scale;
            values[i] = shape / scale * Math.pow(x, shape - 1) * Math.exp(-Math.pow(x, shape));
            total += values[i];
        }
        if (total > 0) {
            for (int i = 0; i < periods; i++) {
                values[i] /= total;
            }
        }
        return values;
    }
}
