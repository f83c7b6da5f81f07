package com.convexlab.modeling.orchestration;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of one (scenario, coupling group) unit.
 */
public enum CouplingState {
    INIT,
    ITERATING,
    CONVERGED,
    MAX_ITER_EXCEEDED,
    SOLVER_FAILED;

    public boolean isTerminal() {
        return this == CONVERGED || this == MAX_ITER_EXCEEDED || this == SOLVER_FAILED;
    }

    public boolean canTransitionTo(CouplingState next) {
        return allowedNext().contains(next);
    }

    private Set<CouplingState> allowedNext() {
        return switch (this) {
            case INIT -> EnumSet.of(ITERATING, SOLVER_FAILED);
            case ITERATING -> EnumSet.of(ITERATING, CONVERGED, MAX_ITER_EXCEEDED, SOLVER_FAILED);
            default -> EnumSet.noneOf(CouplingState.class);
        };
    }
}
