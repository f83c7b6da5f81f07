package com.convexlab.modeling.convergence;

import java.util.Map;

import lombok.NonNull;
import lombok.Value;

/**
 * Result of one convergence check after a full Gauss-Seidel pass.
 */
@Value
public class ConvergenceCheck {

    int iteration;

    boolean converged;

    /**
     * Aggregated norm; {@code +Infinity} when a table had no prior values.
     */
    double norm;

    @NonNull
    Map<String, Double> perTable;
}
