package com.convexlab.modeling.domain;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.convexlab.modeling.model.Coordinate;

/**
 * Lexicographic Cartesian product of item lists; the first set varies slowest.
 */
public final class CartesianProduct {

    private CartesianProduct() {
    }

    /**
     * @param items ordered map set name -> items of that set
     * @return one coordinate per combination; a single empty coordinate when {@code items} is empty
     */
    public static List<Coordinate> of(Map<String, List<String>> items) {
        List<Map<String, String>> partial = new ArrayList<>();
        partial.add(new LinkedHashMap<>());
        for (Map.Entry<String, List<String>> entry : items.entrySet()) {
            List<Map<String, String>> next = new ArrayList<>(partial.size() * entry.getValue().size());
            for (Map<String, String> prefix : partial) {
                for (String item : entry.getValue()) {
                    Map<String, String> extended = new LinkedHashMap<>(prefix);
                    extended.put(entry.getKey(), item);
                    next.add(extended);
                }
            }
            partial = next;
        }
        return partial.stream().map(Coordinate::of).toList();
    }
}
