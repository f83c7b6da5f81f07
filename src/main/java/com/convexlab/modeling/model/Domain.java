package com.convexlab.modeling.model;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import com.convexlab.modeling.exception.DimensionMismatchException;

import lombok.NonNull;
import lombok.Value;

/**
 * Ordered sequence of distinct sets. Its Cartesian product indexes a data table.
 */
@Value
public class Domain {

    private static final Domain SCALAR = new Domain(List.of());

    @NonNull
    List<IndexSet> sets;

    public Domain(List<IndexSet> sets) {
        Set<String> seen = new HashSet<>();
        for (IndexSet set : sets) {
            if (!seen.add(set.getName())) {
                throw new DimensionMismatchException("Set '" + set.getName() + "' appears more than once in a domain");
            }
        }
        this.sets = List.copyOf(sets);
    }

    public static Domain of(IndexSet... sets) {
        return new Domain(List.of(sets));
    }

    public static Domain scalar() {
        return SCALAR;
    }

    /**
     * Product of the item counts; the empty domain has cardinality 1.
     */
    public long cardinality() {
        long size = 1;
        for (IndexSet set : sets) {
            size *= set.size();
        }
        return size;
    }

    public List<String> setNames() {
        return sets.stream().map(IndexSet::getName).toList();
    }

    public boolean contains(String setName) {
        return find(setName).isPresent();
    }

    public Optional<IndexSet> find(String setName) {
        return sets.stream().filter(s -> s.getName().equals(setName)).findFirst();
    }

    public Domain dimensionPart() {
        return new Domain(sets.stream().filter(s -> !s.isInterProblem()).toList());
    }

    public Domain interProblemPart() {
        return new Domain(sets.stream().filter(IndexSet::isInterProblem).toList());
    }

    public boolean isScalar() {
        return sets.isEmpty();
    }
}
