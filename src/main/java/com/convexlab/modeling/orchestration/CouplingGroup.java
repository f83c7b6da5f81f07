package com.convexlab.modeling.orchestration;

import java.util.List;
import java.util.Set;

import com.convexlab.modeling.build.CompiledProblem;

import lombok.NonNull;
import lombok.Value;

/**
 * Problems solved together by block Gauss-Seidel, in coupling order.
 */
@Value
public class CouplingGroup {

    @NonNull
    String name;

    @NonNull
    List<CompiledProblem> members;

    /**
     * Tables produced (endogenous) by one member and read by another.
     */
    @NonNull
    Set<String> sharedTables;

    public List<String> memberNames() {
        return members.stream().map(CompiledProblem::getName).toList();
    }
}
