package com.convexlab.modeling.model;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Table of scalar values indexed by the Cartesian product of its coordinate sets.
 */
@Value
@Builder(toBuilder = true)
public class DataTable {

    @NonNull
    String name;

    /**
     * Set names forming the table domain, in declared order. May include
     * inter-problem sets, which act as the scenario index.
     */
    @NonNull
    @Singular
    List<String> coordinates;

    @NonNull
    @Builder.Default
    ValueType valueType = ValueType.REAL;

    @NonNull
    @Builder.Default
    TableRole role = TableRole.exogenous();

    String description;

    public ResolvedRole roleIn(String problemName) {
        return role.resolve(problemName);
    }
}
