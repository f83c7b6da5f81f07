package com.convexlab.modeling.binding;

import java.util.List;

import com.convexlab.modeling.algebra.Shape;
import com.convexlab.modeling.domain.DomainPartition;
import com.convexlab.modeling.domain.SubDomain;
import com.convexlab.modeling.model.DataTable;
import com.convexlab.modeling.model.ResolvedRole;
import com.convexlab.modeling.model.VariableDefinition;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Data-independent structure of a variable inside one problem: resolved role,
 * set partition, filtered items and the shape of its values.
 */
@Value
@Builder
public class VariableLayout {

    @NonNull
    VariableDefinition variable;

    @NonNull
    DataTable table;

    @NonNull
    ResolvedRole role;

    @NonNull
    DomainPartition partition;

    /**
     * Filtered row items; a single {@code null} entry when the variable has no row set.
     */
    @NonNull
    List<String> rowItems;

    @NonNull
    List<String> colItems;

    /**
     * Filtered items of the intra-problem sets.
     */
    @NonNull
    SubDomain intraDomain;

    @NonNull
    Shape shape;

    public String getName() {
        return variable.getName();
    }

    public List<String> intraSetNames() {
        return partition.intraSetNames();
    }
}
