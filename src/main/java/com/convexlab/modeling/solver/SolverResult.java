package com.convexlab.modeling.solver;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Status, objective value and variable values returned by a {@link SolverBackend}.
 */
@Value
@Builder
public class SolverResult {

    @NonNull
    SolveStatus status;

    /**
     * Objective value including its constant term; {@code NaN} when not optimal.
     */
    @Builder.Default
    double objectiveValue = Double.NaN;

    /**
     * Values indexed like the model's decision variables; {@code null} when not optimal.
     */
    double[] values;

    String message;

    public boolean isSuccess() {
        return status.isSuccess();
    }

    public static SolverResult failure(SolveStatus status, String message) {
        return SolverResult.builder().status(status).message(message).build();
    }
}
