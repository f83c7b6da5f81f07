package com.convexlab.modeling.operator;

import java.util.List;
import java.util.function.DoubleBinaryOperator;

import com.convexlab.modeling.algebra.AffineMatrix;
import com.convexlab.modeling.algebra.Shape;

/**
 * Element-wise function of two constant operands; 1x1 operands broadcast.
 */
public class ConstantElementwiseOperator extends AbstractMatrixOperator {

    private final DoubleBinaryOperator function;

    public ConstantElementwiseOperator(String name, DoubleBinaryOperator function) {
        super(name, 2);
        this.function = function;
    }

    /**
     * {@code pow(base, exponent)}.
     */
    public static ConstantElementwiseOperator power() {
        return new ConstantElementwiseOperator("pow", Math::pow);
    }

    /**
     * {@code annuity(rate, periods)}: capital recovery factor
     * {@code r(1+r)^n / ((1+r)^n - 1)}, {@code 1/n} when the rate is zero.
     */
    public static ConstantElementwiseOperator annuity() {
        return new ConstantElementwiseOperator("annuity", (rate, periods) -> {
            if (periods <= 0) {
                return 0.0;
            }
            if (rate == 0.0) {
                return 1.0 / periods;
            }
            double growth = Math.pow(1.0 + rate, periods);
            return rate * growth / (growth - 1.0);
        });
    }

    @Override
    protected Shape resultShape(List<Shape> arguments) {
        requireConstant(arguments);
        return Shape.broadcast(getName(), arguments.get(0), arguments.get(1), true);
    }

    @Override
    protected AffineMatrix evaluate(List<AffineMatrix> arguments) {
        Shape target = resultShape(List.of(arguments.get(0).shape(), arguments.get(1).shape()));
        double[][] left = arguments.get(0).broadcastTo(target.getRows(), target.getCols()).toArray();
        double[][] right = arguments.get(1).broadcastTo(target.getRows(), target.getCols()).toArray();
        double[][] result = new double[target.getRows()][target.getCols()];
        for (int i = 0; i < target.getRows(); i++) {
            for (int j = 0; j < target.getCols(); j++) {
                result[i][j] = function.applyAsDouble(left[i][j], right[i][j]);
            }
        }
        return AffineMatrix.constant(result);
    }
}
