package com.convexlab.modeling.scenario;

import com.convexlab.modeling.model.Coordinate;

import lombok.NonNull;
import lombok.Value;

/**
 * One combination of inter-problem set items; identifies an independent
 * instance of every problem.
 */
@Value
public class Scenario {

    private static final Scenario BASE = new Scenario(Coordinate.empty());

    @NonNull
    Coordinate coordinate;

    /**
     * The single scenario of a model without inter-problem sets.
     */
    public static Scenario base() {
        return BASE;
    }

    public boolean isBase() {
        return coordinate.isEmpty();
    }

    /**
     * Human readable key, {@code "base"} for the empty scenario.
     */
    public String key() {
        return isBase() ? "base" : coordinate.toString();
    }

    @Override
    public String toString() {
        return key();
    }
}
