package com.convexlab.modeling.orchestration;

public enum SolveMode {
    /** Every problem solved on its own, once per scenario; coupled problems are skipped. */
    INDEPENDENT,
    /** Coupling groups solved by block Gauss-Seidel; other problems as in independent mode. */
    INTEGRATED
}
