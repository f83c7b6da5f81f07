package com.convexlab.modeling.algebra;

import com.convexlab.modeling.exception.DimensionMismatchException;

import lombok.Value;

/**
 * Symbolic shape of an expression node: row and column extents plus whether the
 * node depends on decision variables. Used to validate an expression once,
 * independently of the coordinates it is later instantiated at.
 */
@Value
public class Shape {

    int rows;
    int cols;
    boolean constant;

    public static Shape of(int rows, int cols, boolean constant) {
        return new Shape(rows, cols, constant);
    }

    public static Shape scalar() {
        return new Shape(1, 1, true);
    }

    public boolean isScalar() {
        return rows == 1 && cols == 1;
    }

    public boolean isVector() {
        return rows == 1 || cols == 1;
    }

    public boolean isSquare() {
        return rows == cols;
    }

    public Shape withConstant(boolean constant) {
        return new Shape(rows, cols, constant);
    }

    /**
     * Shape of an element-wise combination ({@code +}, {@code -}, {@code *},
     * {@code /}); 1x1 operands broadcast to the other operand.
     */
    public static Shape broadcast(String operator, Shape left, Shape right, boolean constant) {
        if (left.rows == right.rows && left.cols == right.cols) {
            return new Shape(left.rows, left.cols, constant);
        }
        if (left.isScalar()) {
            return new Shape(right.rows, right.cols, constant);
        }
        if (right.isScalar()) {
            return new Shape(left.rows, left.cols, constant);
        }
        throw new DimensionMismatchException("Operator '" + operator + "' cannot combine shapes "
                + left.describe() + " and " + right.describe());
    }

    /**
     * Shape of a matrix product; a 1x1 operand is treated as a scalar factor.
     */
    public static Shape matmul(Shape left, Shape right, boolean constant) {
        if (left.cols == right.rows) {
            return new Shape(left.rows, right.cols, constant);
        }
        if (left.isScalar() || right.isScalar()) {
            return broadcast("@", left, right, constant);
        }
        throw new DimensionMismatchException("Operator '@' cannot multiply shapes "
                + left.describe() + " and " + right.describe());
    }

    public String describe() {
        return "(" + rows + "x" + cols + ")";
    }

    @Override
    public String toString() {
        return describe() + (constant ? " const" : " var");
    }
}
