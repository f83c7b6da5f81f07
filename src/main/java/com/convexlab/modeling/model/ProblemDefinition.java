package com.convexlab.modeling.model;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Named set of symbolic constraints plus optional objective terms.
 */
@Value
@Builder(toBuilder = true)
public class ProblemDefinition {

    @NonNull
    String name;

    /**
     * Equalities and inequalities, in the expression language.
     */
    @NonNull
    @Singular
    List<String> expressions;

    /**
     * {@code Minimize(...)} / {@code Maximize(...)} terms, summed into one objective.
     */
    @NonNull
    @Singular
    List<String> objectives;

    /**
     * Explicit optimize flag; when absent the problem is optimized iff it has objectives.
     */
    Boolean optimize;

    String couplingGroup;

    Integer couplingOrder;

    String description;

    public boolean isOptimized() {
        return optimize != null ? optimize : !objectives.isEmpty();
    }

    public boolean isCoupled() {
        return couplingGroup != null && !couplingGroup.isBlank();
    }
}
