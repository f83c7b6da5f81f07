package com.convexlab.modeling.algebra;

import java.util.Arrays;
import java.util.function.BinaryOperator;
import java.util.function.UnaryOperator;

import com.convexlab.modeling.exception.DimensionMismatchException;
import com.convexlab.modeling.exception.ModelDefinitionException;

/**
 * Dense matrix of {@link AffineExpression}s. Constant matrices (no decision
 * variable anywhere) are the numeric values of exogenous and constant
 * variables; mixed matrices come from slices of endogenous tables.
 *
 * Immutable. All arithmetic keeps the result affine: products and divisions
 * require a constant operand.
 */
public final class AffineMatrix {

    private final int rows;
    private final int cols;
    private final AffineExpression[] entries;

    private AffineMatrix(int rows, int cols, AffineExpression[] entries) {
        this.rows = rows;
        this.cols = cols;
        this.entries = entries;
    }

    public static AffineMatrix of(int rows, int cols, AffineExpression[] rowMajorEntries) {
        if (rowMajorEntries.length != rows * cols) {
            throw new DimensionMismatchException("Expected " + rows * cols + " entries, got " + rowMajorEntries.length);
        }
        return new AffineMatrix(rows, cols, rowMajorEntries.clone());
    }

    public static AffineMatrix constant(double[][] values) {
        int r = values.length;
        int c = r == 0 ? 0 : values[0].length;
        AffineExpression[] entries = new AffineExpression[r * c];
        for (int i = 0; i < r; i++) {
            if (values[i].length != c) {
                throw new DimensionMismatchException("Ragged matrix: row " + i + " has " + values[i].length
                        + " columns, expected " + c);
            }
            for (int j = 0; j < c; j++) {
                entries[i * c + j] = AffineExpression.constant(values[i][j]);
            }
        }
        return new AffineMatrix(r, c, entries);
    }

    public static AffineMatrix scalar(double value) {
        return new AffineMatrix(1, 1, new AffineExpression[] { AffineExpression.constant(value) });
    }

    public static AffineMatrix filled(int rows, int cols, double value) {
        AffineExpression[] entries = new AffineExpression[rows * cols];
        Arrays.fill(entries, AffineExpression.constant(value));
        return new AffineMatrix(rows, cols, entries);
    }

    public int getRows() {
        return rows;
    }

    public int getCols() {
        return cols;
    }

    public AffineExpression get(int row, int col) {
        return entries[row * cols + col];
    }

    public boolean isScalar() {
        return rows == 1 && cols == 1;
    }

    public boolean isConstant() {
        for (AffineExpression entry : entries) {
            if (!entry.isConstant()) {
                return false;
            }
        }
        return true;
    }

    public Shape shape() {
        return Shape.of(rows, cols, isConstant());
    }

    /**
     * Numeric values of a constant matrix.
     */
    public double[][] toArray() {
        requireConstant("toArray");
        double[][] values = new double[rows][cols];
        for (int i = 0; i < rows; i++) {
            for (int j = 0; j < cols; j++) {
                values[i][j] = get(i, j).getConstant();
            }
        }
        return values;
    }

    public double scalarValue() {
        if (!isScalar()) {
            throw new DimensionMismatchException("Expected a 1x1 value, got " + shape().describe());
        }
        requireConstant("scalarValue");
        return entries[0].getConstant();
    }

    public AffineMatrix plus(AffineMatrix other) {
        return combine("+", other, AffineExpression::plus);
    }

    public AffineMatrix minus(AffineMatrix other) {
        return combine("-", other, AffineExpression::minus);
    }

    public AffineMatrix negate() {
        return map(e -> e.negate());
    }

    public AffineMatrix scale(double factor) {
        return map(e -> e.times(factor));
    }

    /**
     * Element-wise (Hadamard) product; 1x1 operands broadcast.
     */
    public AffineMatrix multiplyElementwise(AffineMatrix other) {
        if (!isConstant() && !other.isConstant()) {
            throw new ModelDefinitionException("Non-linear term: element-wise product of two decision-dependent operands");
        }
        boolean leftConstant = isConstant();
        return combine("*", other, (a, b) -> leftConstant ? b.times(a.getConstant()) : a.times(b.getConstant()));
    }

    public AffineMatrix divideElementwise(AffineMatrix divisor) {
        divisor.requireConstant("/");
        return combine("/", divisor, (a, b) -> {
            if (b.getConstant() == 0.0) {
                throw new ModelDefinitionException("Division by zero");
            }
            return a.times(1.0 / b.getConstant());
        });
    }

    /**
     * Matrix product; when one side is 1x1 and the inner extents differ it
     * degrades to a scalar product.
     */
    public AffineMatrix matmul(AffineMatrix other) {
        if (cols != other.rows) {
            if (isScalar() || other.isScalar()) {
                return multiplyElementwise(other);
            }
            throw new DimensionMismatchException("Operator '@' cannot multiply shapes "
                    + shape().describe() + " and " + other.shape().describe());
        }
        boolean leftConstant = isConstant();
        if (!leftConstant && !other.isConstant()) {
            throw new ModelDefinitionException("Non-linear term: matrix product of two decision-dependent operands");
        }
        AffineExpression[] result = new AffineExpression[rows * other.cols];
        for (int i = 0; i < rows; i++) {
            for (int j = 0; j < other.cols; j++) {
                AffineExpression acc = AffineExpression.ZERO;
                for (int k = 0; k < cols; k++) {
                    AffineExpression a = get(i, k);
                    AffineExpression b = other.get(k, j);
                    acc = acc.plus(leftConstant ? b.times(a.getConstant()) : a.times(b.getConstant()));
                }
                result[i * other.cols + j] = acc;
            }
        }
        return new AffineMatrix(rows, other.cols, result);
    }

    public AffineMatrix transpose() {
        AffineExpression[] result = new AffineExpression[entries.length];
        for (int i = 0; i < rows; i++) {
            for (int j = 0; j < cols; j++) {
                result[j * rows + i] = get(i, j);
            }
        }
        return new AffineMatrix(cols, rows, result);
    }

    public AffineMatrix sum() {
        AffineExpression acc = AffineExpression.ZERO;
        for (AffineExpression entry : entries) {
            acc = acc.plus(entry);
        }
        return new AffineMatrix(1, 1, new AffineExpression[] { acc });
    }

    /**
     * Broadcasts a 1x1 matrix to the given extents; other matrices must already match.
     */
    public AffineMatrix broadcastTo(int targetRows, int targetCols) {
        if (rows == targetRows && cols == targetCols) {
            return this;
        }
        if (!isScalar()) {
            throw new DimensionMismatchException("Cannot broadcast " + shape().describe() + " to ("
                    + targetRows + "x" + targetCols + ")");
        }
        AffineExpression[] result = new AffineExpression[targetRows * targetCols];
        Arrays.fill(result, entries[0]);
        return new AffineMatrix(targetRows, targetCols, result);
    }

    public AffineMatrix map(UnaryOperator<AffineExpression> function) {
        AffineExpression[] result = new AffineExpression[entries.length];
        for (int i = 0; i < entries.length; i++) {
            result[i] = function.apply(entries[i]);
        }
        return new AffineMatrix(rows, cols, result);
    }

    private AffineMatrix combine(String operator, AffineMatrix other, BinaryOperator<AffineExpression> function) {
        Shape target = Shape.broadcast(operator, shape(), other.shape(), false);
        AffineMatrix left = broadcastTo(target.getRows(), target.getCols());
        AffineMatrix right = other.broadcastTo(target.getRows(), target.getCols());
        AffineExpression[] result = new AffineExpression[left.entries.length];
        for (int i = 0; i < result.length; i++) {
            result[i] = function.apply(left.entries[i], right.entries[i]);
        }
        return new AffineMatrix(target.getRows(), target.getCols(), result);
    }

    private void requireConstant(String operation) {
        if (!isConstant()) {
            throw new ModelDefinitionException("Operation '" + operation + "' requires a constant operand");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AffineMatrix)) {
            return false;
        }
        AffineMatrix that = (AffineMatrix) o;
        return rows == that.rows && cols == that.cols && Arrays.equals(entries, that.entries);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * rows + cols) + Arrays.hashCode(entries);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < rows; i++) {
            if (i > 0) {
                sb.append("; ");
            }
            for (int j = 0; j < cols; j++) {
                if (j > 0) {
                    sb.append(", ");
                }
                sb.append(get(i, j));
            }
        }
        return sb.append(']').toString();
    }
}
