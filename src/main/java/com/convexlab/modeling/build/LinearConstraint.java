package com.convexlab.modeling.build;

import java.util.Map;

import lombok.NonNull;
import lombok.Value;

/**
 * One constraint row {@code sum(coefficient_i * x_i) <type> rhs}.
 */
@Value
public class LinearConstraint {

    @NonNull
    String name;

    /**
     * Coefficients keyed by decision variable index.
     */
    @NonNull
    Map<Integer, Double> coefficients;

    @NonNull
    Type type;

    double rhs;

    public enum Type {
        EQUAL,
        LESS_EQUAL,
        GREATER_EQUAL
    }
}
