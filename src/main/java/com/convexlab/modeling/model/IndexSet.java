package com.convexlab.modeling.model;

import java.util.List;
import java.util.Map;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Named, ordered list of coordinate labels defining one dimension of the model.
 *
 * Pure structure only: filtering lives in {@link SetFilter} and the domain algebra.
 */
@Value
@Builder(toBuilder = true)
public class IndexSet {

    @NonNull
    String name;

    /**
     * Coordinate labels in declared order.
     */
    @NonNull
    @Singular
    List<String> items;

    @NonNull
    @Builder.Default
    SetRole role = SetRole.DIMENSION;

    /**
     * Named subsets of {@link #items}, keyed by filter label.
     */
    @NonNull
    @Singular
    Map<String, List<String>> filters;

    String description;

    /**
     * Name of another set whose items this set reuses.
     */
    String copyFrom;

    public int size() {
        return items.size();
    }

    public boolean isInterProblem() {
        return role == SetRole.INTER_PROBLEM;
    }

    public int indexOf(String item) {
        return items.indexOf(item);
    }

    public boolean contains(String item) {
        return items.contains(item);
    }
}
