package com.convexlab.modeling.orchestration;

import com.convexlab.modeling.binding.MissingValuePolicy;
import com.convexlab.modeling.convergence.ConvergenceSettings;
import com.convexlab.modeling.solver.SolverOptions;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Run-level settings of the solver orchestrator.
 */
@Value
@Builder(toBuilder = true)
public class OrchestratorConfig {

    @NonNull
    @Builder.Default
    ConvergenceSettings convergence = ConvergenceSettings.defaults();

    @NonNull
    @Builder.Default
    MissingValuePolicy missingValues = MissingValuePolicy.FAIL;

    /**
     * Initial value of shared tables without stored values on the first iteration.
     */
    @Builder.Default
    double couplingDefaultValue = 0.0;

    /**
     * Also promote the values of units that hit the iteration or time bound.
     */
    boolean bestEffortExport;

    @Builder.Default
    int parallelism = 1;

    Long solverTimeoutMillis;

    Long runTimeoutMillis;

    @NonNull
    @Builder.Default
    CouplingTieBreak tieBreak = CouplingTieBreak.DECLARATION;

    public static OrchestratorConfig defaults() {
        return OrchestratorConfig.builder().build();
    }

    public SolverOptions solverOptions() {
        return SolverOptions.builder().timeoutMillis(solverTimeoutMillis).build();
    }

    public boolean hasRunTimeout() {
        return runTimeoutMillis != null && runTimeoutMillis > 0;
    }
}
