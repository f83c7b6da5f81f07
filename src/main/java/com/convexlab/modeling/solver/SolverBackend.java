package com.convexlab.modeling.solver;

import com.convexlab.modeling.build.SolverModel;

/**
 * Numeric solver used as a black box. Implementations must be safe to call
 * from several threads with distinct models.
 */
public interface SolverBackend {

    /**
     * Backend-specific form of a model, built once and solved once.
     */
    interface ModelHandle {
        SolverModel getModel();
    }

    ModelHandle buildModel(SolverModel model);

    /**
     * Never throws for solver-side failures: they are reported through
     * {@link SolverResult#getStatus()}.
     */
    SolverResult solve(ModelHandle handle, SolverOptions options);

    default SolverResult solve(SolverModel model, SolverOptions options) {
        return solve(buildModel(model), options);
    }
}
