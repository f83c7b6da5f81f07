package com.convexlab.modeling.orchestration;

/**
 * Order of coupling-group members that share the same coupling order.
 */
public enum CouplingTieBreak {
    DECLARATION,
    NAME
}
