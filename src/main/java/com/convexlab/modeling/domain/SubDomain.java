package com.convexlab.modeling.domain;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.convexlab.modeling.model.Coordinate;
import com.convexlab.modeling.model.Domain;

import lombok.NonNull;
import lombok.Value;

/**
 * Domain restricted to a subset of the items of each set. Items keep the
 * declared order of their set.
 */
@Value
public class SubDomain {

    @NonNull
    Domain domain;

    /**
     * Selected items per set, in domain order.
     */
    @NonNull
    Map<String, List<String>> items;

    public static SubDomain full(Domain domain) {
        Map<String, List<String>> items = new LinkedHashMap<>();
        domain.getSets().forEach(set -> items.put(set.getName(), set.getItems()));
        return new SubDomain(domain, items);
    }

    public List<String> itemsOf(String setName) {
        List<String> selected = items.get(setName);
        if (selected == null) {
            throw new IllegalArgumentException("Set '" + setName + "' is not part of " + domain.setNames());
        }
        return selected;
    }

    public long size() {
        long size = 1;
        for (List<String> selected : items.values()) {
            size *= selected.size();
        }
        return size;
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    /**
     * Qualifying coordinate tuples, lexicographic in domain order.
     */
    public List<Coordinate> coordinates() {
        return CartesianProduct.of(items);
    }
}
