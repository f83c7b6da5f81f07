package com.convexlab.modeling.runner;

import java.util.List;

import com.convexlab.modeling.model.Coordinate;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Outcome of comparing the endogenous tables with a reference dataset.
 */
@Value
@Builder
public class ResultCheck {

    public static final double DEFAULT_TOLERANCE = 0.02;

    double tolerance;
    int tablesChecked;
    int valuesChecked;

    @Singular
    List<Mismatch> mismatches;

    public boolean isPassed() {
        return mismatches.isEmpty();
    }

    /**
     * One value that differs from its reference by more than the tolerance.
     * A value missing on either side is {@code null} with an infinite difference.
     */
    @Value
    public static class Mismatch {
        String table;
        Coordinate coordinate;
        Double expected;
        Double actual;
        double difference;

        @Override
        public String toString() {
            return table + coordinate + ": expected " + expected + ", got " + actual;
        }
    }
}
