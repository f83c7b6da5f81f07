package com.convexlab.modeling.convergence;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class ConvergenceSettings {

    public static final double DEFAULT_TOLERANCE = 0.01;
    public static final int DEFAULT_MAX_ITERATIONS = 20;

    @NonNull
    @Builder.Default
    ConvergenceNorm norm = ConvergenceNorm.MAX_RELATIVE;

    @NonNull
    @Builder.Default
    NormAggregation aggregation = NormAggregation.PER_TABLE;

    @Builder.Default
    double tolerance = DEFAULT_TOLERANCE;

    @Builder.Default
    int maxIterations = DEFAULT_MAX_ITERATIONS;

    public static ConvergenceSettings defaults() {
        return ConvergenceSettings.builder().build();
    }
}
