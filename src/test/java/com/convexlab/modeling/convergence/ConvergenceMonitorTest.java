package com.convexlab.modeling.convergence;

import com.convexlab.modeling.model.Coordinate;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class ConvergenceMonitorTest {

    private static final Coordinate A = Coordinate.of("node", "a");
    private static final Coordinate B = Coordinate.of("node", "b");

    private static Map<String, Map<Coordinate, Double>> tables(String name, double a, double b) {
        Map<Coordinate, Double> values = new LinkedHashMap<>();
        values.put(A, a);
        values.put(B, b);
        Map<String, Map<Coordinate, Double>> result = new LinkedHashMap<>();
        result.put(name, values);
        return result;
    }

    private static ConvergenceMonitor monitor(ConvergenceNorm norm, double tolerance) {
        return new ConvergenceMonitor(ConvergenceSettings.builder().norm(norm).tolerance(tolerance).build());
    }

    @Test
    void testFirstIterationNeverConverges() {
        ConvergenceCheck check = monitor(ConvergenceNorm.MAX_ABSOLUTE, 0.01)
                .check(1, tables("price", 1, 2), tables("price", 1, 2));

        assertThat(check.getNorm()).isZero();
        assertThat(check.isConverged()).isFalse();
    }

    @Test
    void testIdenticalValuesConvergeFromSecondIteration() {
        ConvergenceCheck check = monitor(ConvergenceNorm.MAX_RELATIVE, 0.01)
                .check(2, tables("price", 10, 20), tables("price", 10, 20));

        assertThat(check.isConverged()).isTrue();
    }

    @Test
    void testMaxAbsoluteNorm() {
        ConvergenceCheck check = monitor(ConvergenceNorm.MAX_ABSOLUTE, 0.01)
                .check(3, tables("price", 10, 20), tables("price", 10.5, 23));

        assertThat(check.getNorm()).isCloseTo(3.0, within(1e-12));
        assertThat(check.isConverged()).isFalse();
    }

    @Test
    void testMaxRelativeNorm() {
        ConvergenceCheck check = monitor(ConvergenceNorm.MAX_RELATIVE, 0.2)
                .check(3, tables("price", 10, 20), tables("price", 11, 23));

        assertThat(check.getNorm()).isCloseTo(0.15, within(1e-12));
        assertThat(check.isConverged()).isTrue();
    }

    @Test
    void testRelativeNormFallsBackToAbsoluteAtZeroReference() {
        ConvergenceCheck check = monitor(ConvergenceNorm.MAX_RELATIVE, 0.01)
                .check(3, tables("price", 0, 1), tables("price", 0.5, 1));

        assertThat(check.getNorm()).isCloseTo(0.5, within(1e-12));
    }

    @Test
    void testRelativeL2Norm() {
        ConvergenceCheck check = monitor(ConvergenceNorm.RELATIVE_L2, 1.0)
                .check(2, tables("price", 3, 4), tables("price", 3, 5));

        assertThat(check.getNorm()).isCloseTo(0.2, within(1e-12));
    }

    @Test
    void testMissingPriorTableGivesInfiniteNorm() {
        ConvergenceCheck check = monitor(ConvergenceNorm.MAX_ABSOLUTE, 100)
                .check(5, Map.of(), tables("price", 1, 2));

        assertThat(check.getNorm()).isInfinite();
        assertThat(check.getPerTable()).containsEntry("price", Double.POSITIVE_INFINITY);
        assertThat(check.isConverged()).isFalse();
    }

    @Test
    void testMissingPriorCoordinateGivesInfiniteNorm() {
        Map<String, Map<Coordinate, Double>> before = new LinkedHashMap<>();
        before.put("price", Map.of(A, 1.0));

        ConvergenceCheck check = monitor(ConvergenceNorm.MAX_ABSOLUTE, 100).check(5, before, tables("price", 1, 2));

        assertThat(check.getNorm()).isInfinite();
        assertThat(check.isConverged()).isFalse();
    }

    @Test
    void testPerTableAggregationTakesWorstTable() {
        Map<String, Map<Coordinate, Double>> before = tables("price", 10, 10);
        before.putAll(tables("flow", 100, 100));
        Map<String, Map<Coordinate, Double>> after = tables("price", 10, 11);
        after.putAll(tables("flow", 100, 100));

        ConvergenceCheck check = monitor(ConvergenceNorm.MAX_RELATIVE, 0.05).check(2, before, after);

        assertThat(check.getPerTable()).containsEntry("flow", 0.0);
        assertThat(check.getPerTable().get("price")).isCloseTo(0.1, within(1e-12));
        assertThat(check.getNorm()).isCloseTo(0.1, within(1e-12));
        assertThat(check.isConverged()).isFalse();
    }

    @Test
    void testGlobalAggregationPoolsAllValues() {
        Map<String, Map<Coordinate, Double>> before = tables("price", 3, 0);
        before.putAll(tables("flow", 0, 4));
        Map<String, Map<Coordinate, Double>> after = tables("price", 3, 0);
        after.putAll(tables("flow", 0, 9));

        ConvergenceSettings settings = ConvergenceSettings.builder()
                .norm(ConvergenceNorm.RELATIVE_L2)
                .aggregation(NormAggregation.GLOBAL)
                .tolerance(1.0)
                .build();
        ConvergenceCheck check = new ConvergenceMonitor(settings).check(2, before, after);

        assertThat(check.getNorm()).isCloseTo(1.0, within(1e-12));
        assertThat(check.isConverged()).isTrue();
    }
}
