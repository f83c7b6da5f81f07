package com.convexlab.modeling.solver;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SolverOptions {

    /**
     * Per-call time limit; {@code null} or non-positive means unlimited.
     */
    Long timeoutMillis;

    public static SolverOptions defaults() {
        return SolverOptions.builder().build();
    }

    public boolean hasTimeout() {
        return timeoutMillis != null && timeoutMillis > 0;
    }
}
