package com.convexlab.modeling.model;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.convexlab.modeling.exception.ModelDefinitionException;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Restriction of one set to a subset of its items, expressed as named filter
 * labels of the set and/or explicit items. The selected subset is the union of
 * both, always in the set's declared order.
 */
@Value
@Builder
public class SetFilter {

    @NonNull
    @Singular
    List<String> labels;

    @NonNull
    @Singular
    List<String> items;

    public static SetFilter named(String... labels) {
        return SetFilter.builder().labels(List.of(labels)).build();
    }

    public static SetFilter items(String... items) {
        return SetFilter.builder().items(List.of(items)).build();
    }

    /**
     * Applies the filter to a list of candidate items of {@code set}.
     *
     * @param set the set the filter refers to
     * @param candidates the items still selected, in set order
     * @return the candidates that pass the filter, order preserved
     */
    public List<String> apply(IndexSet set, List<String> candidates) {
        Set<String> allowed = new LinkedHashSet<>();
        for (String label : labels) {
            List<String> subset = set.getFilters().get(label);
            if (subset == null) {
                throw new ModelDefinitionException("Set '" + set.getName() + "' has no filter '" + label
                        + "'. Available filters: " + set.getFilters().keySet());
            }
            allowed.addAll(subset);
        }
        for (String item : items) {
            if (!set.contains(item)) {
                throw new ModelDefinitionException("Item '" + item + "' is not a member of set '" + set.getName() + "'");
            }
            allowed.add(item);
        }
        return candidates.stream().filter(allowed::contains).toList();
    }
}
