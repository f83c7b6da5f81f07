package com.convexlab.modeling.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import lombok.EqualsAndHashCode;

/**
 * Immutable assignment of one item per set (set name -> item).
 *
 * Equality ignores the order of the sets; iteration follows insertion order.
 */
@EqualsAndHashCode
public final class Coordinate {

    private static final Coordinate EMPTY = new Coordinate(Map.of());

    private final Map<String, String> items;

    private Coordinate(Map<String, String> items) {
        this.items = items;
    }

    public static Coordinate empty() {
        return EMPTY;
    }

    public static Coordinate of(Map<String, String> items) {
        if (items.isEmpty()) {
            return EMPTY;
        }
        return new Coordinate(Collections.unmodifiableMap(new LinkedHashMap<>(items)));
    }

    public static Coordinate of(String set, String item) {
        return of(Map.of(set, item));
    }

    public Coordinate with(String set, String item) {
        Map<String, String> copy = new LinkedHashMap<>(items);
        copy.put(set, item);
        return of(copy);
    }

    /**
     * Union of both coordinates; on a shared set the other coordinate wins.
     */
    public Coordinate merge(Coordinate other) {
        if (other.isEmpty()) {
            return this;
        }
        if (isEmpty()) {
            return other;
        }
        Map<String, String> copy = new LinkedHashMap<>(items);
        copy.putAll(other.items);
        return of(copy);
    }

    /**
     * Keeps only the given sets, in the order they are listed.
     */
    public Coordinate project(Collection<String> sets) {
        Map<String, String> projected = new LinkedHashMap<>();
        for (String set : sets) {
            String item = items.get(set);
            if (item != null) {
                projected.put(set, item);
            }
        }
        return of(projected);
    }

    public String get(String set) {
        return items.get(set);
    }

    public boolean contains(String set) {
        return items.containsKey(set);
    }

    public Set<String> sets() {
        return items.keySet();
    }

    public Map<String, String> asMap() {
        return items;
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    /**
     * True when every set of this coordinate has the same item in {@code other}.
     */
    public boolean isContainedIn(Coordinate other) {
        return items.entrySet().stream().allMatch(e -> e.getValue().equals(other.items.get(e.getKey())));
    }

    public List<String> values() {
        return List.copyOf(items.values());
    }

    @Override
    public String toString() {
        return items.entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(", ", "{", "}"));
    }
}
