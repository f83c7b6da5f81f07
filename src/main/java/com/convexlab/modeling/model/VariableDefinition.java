package com.convexlab.modeling.model;

import java.util.List;
import java.util.Map;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Symbolic variable: a view on one data table with an explicit allocation of
 * the table's dimension sets to rows, columns and intra-problem sets.
 */
@Value
@Builder(toBuilder = true)
public class VariableDefinition {

    @NonNull
    String name;

    @NonNull
    String table;

    /**
     * Set allocated to rows; {@code null} means a single row.
     */
    String rows;

    /**
     * Set allocated to columns; {@code null} means a single column.
     */
    String cols;

    /**
     * Intra-problem sets; {@code null} means "every remaining dimension set".
     */
    List<String> intra;

    @NonNull
    @Singular
    Map<String, SetFilter> filters;

    /**
     * Value used in place of missing exogenous entries.
     */
    Double blankFill;
}
