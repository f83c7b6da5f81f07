package com.convexlab.modeling.algebra;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

import lombok.EqualsAndHashCode;

/**
 * Scalar affine function {@code constant + sum(coefficient_i * x_i)} over the
 * decision variables of one solver model. Immutable.
 */
@EqualsAndHashCode
public final class AffineExpression {

    public static final AffineExpression ZERO = new AffineExpression(0.0, Map.of());

    private final double constant;
    private final Map<Integer, Double> coefficients;

    private AffineExpression(double constant, Map<Integer, Double> coefficients) {
        this.constant = constant;
        this.coefficients = coefficients;
    }

    public static AffineExpression constant(double value) {
        return value == 0.0 ? ZERO : new AffineExpression(value, Map.of());
    }

    public static AffineExpression variable(int index) {
        return new AffineExpression(0.0, Map.of(index, 1.0));
    }

    public double getConstant() {
        return constant;
    }

    /**
     * Coefficients keyed by decision variable index, ascending.
     */
    public Map<Integer, Double> getCoefficients() {
        return coefficients;
    }

    public boolean isConstant() {
        return coefficients.isEmpty();
    }

    public AffineExpression plus(AffineExpression other) {
        if (other.isConstant()) {
            return other.constant == 0.0 ? this : new AffineExpression(constant + other.constant, coefficients);
        }
        if (isConstant()) {
            return new AffineExpression(constant + other.constant, other.coefficients);
        }
        TreeMap<Integer, Double> merged = new TreeMap<>(coefficients);
        other.coefficients.forEach((index, value) -> merged.merge(index, value, Double::sum));
        merged.values().removeIf(v -> v == 0.0);
        return new AffineExpression(constant + other.constant, Collections.unmodifiableMap(merged));
    }

    public AffineExpression minus(AffineExpression other) {
        return plus(other.times(-1.0));
    }

    public AffineExpression times(double factor) {
        if (factor == 0.0) {
            return ZERO;
        }
        if (factor == 1.0) {
            return this;
        }
        TreeMap<Integer, Double> scaled = new TreeMap<>();
        coefficients.forEach((index, value) -> scaled.put(index, value * factor));
        return new AffineExpression(constant * factor, Collections.unmodifiableMap(scaled));
    }

    public AffineExpression negate() {
        return times(-1.0);
    }

    /**
     * Value of the expression for a full assignment of the decision variables.
     */
    public double evaluate(double[] values) {
        double result = constant;
        for (Map.Entry<Integer, Double> entry : coefficients.entrySet()) {
            result += entry.getValue() * values[entry.getKey()];
        }
        return result;
    }

    @Override
    public String toString() {
        if (isConstant()) {
            return Double.toString(constant);
        }
        StringBuilder sb = new StringBuilder();
        coefficients.forEach((index, value) -> {
            if (sb.length() > 0) {
                sb.append(value < 0 ? " - " : " + ");
            } else if (value < 0) {
                sb.append('-');
            }
            sb.append(Math.abs(value)).append("*x").append(index);
        });
        if (constant != 0.0) {
            sb.append(constant < 0 ? " - " : " + ").append(Math.abs(constant));
        }
        return sb.toString();
    }
}
