package com.convexlab.modeling.domain;

import java.util.List;

import com.convexlab.modeling.model.IndexSet;

import lombok.NonNull;
import lombok.Value;

/**
 * Allocation of a table's sets for one variable: at most one row set, at most
 * one column set, the intra-problem sets and the table's inter-problem sets.
 */
@Value
public class DomainPartition {

    /**
     * {@code null} when the variable has a single row.
     */
    IndexSet rowSet;

    /**
     * {@code null} when the variable has a single column.
     */
    IndexSet colSet;

    @NonNull
    List<IndexSet> intraSets;

    @NonNull
    List<IndexSet> interSets;

    public List<String> intraSetNames() {
        return intraSets.stream().map(IndexSet::getName).toList();
    }

    public List<String> interSetNames() {
        return interSets.stream().map(IndexSet::getName).toList();
    }
}
