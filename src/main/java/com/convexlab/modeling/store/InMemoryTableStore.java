package com.convexlab.modeling.store;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.convexlab.modeling.model.Coordinate;

import lombok.Getter;

/**
 * Thread-safe in-memory {@link TableStore}. Values of each table keep insertion order.
 */
public class InMemoryTableStore implements TableStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryTableStore.class);

    private final Map<String, Map<Coordinate, Double>> tables = new LinkedHashMap<>();

    @Override
    public synchronized Optional<Double> value(String table, Coordinate coordinate) {
        Map<Coordinate, Double> values = tables.get(table);
        return values == null ? Optional.empty() : Optional.ofNullable(values.get(coordinate));
    }

    @Override
    public synchronized Map<Coordinate, Double> read(String table, Coordinate filter) {
        return select(tables.getOrDefault(table, Map.of()), filter);
    }

    @Override
    public synchronized void write(String table, Map<Coordinate, Double> values) {
        tables.computeIfAbsent(table, t -> new LinkedHashMap<>()).putAll(values);
        log.debug("Wrote {} value(s) to table '{}'", values.size(), table);
    }

    @Override
    public StagingArea openStaging(String unitKey) {
        return new Staging(unitKey);
    }

    @Override
    public synchronized Set<String> tables() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(tables.keySet()));
    }

    private synchronized void promote(Staging staging) {
        staging.staged.forEach((table, values) -> tables.computeIfAbsent(table, t -> new LinkedHashMap<>()).putAll(values));
    }

    static Map<Coordinate, Double> select(Map<Coordinate, Double> values, Coordinate filter) {
        Map<Coordinate, Double> selected = new LinkedHashMap<>();
        values.forEach((coordinate, value) -> {
            if (filter.isContainedIn(coordinate)) {
                selected.put(coordinate, value);
            }
        });
        return selected;
    }

    private final class Staging implements StagingArea {

        @Getter
        private final String unitKey;
        private final Map<String, Map<Coordinate, Double>> staged = new HashMap<>();

        private Staging(String unitKey) {
            this.unitKey = unitKey;
        }

        @Override
        public synchronized Optional<Double> value(String table, Coordinate coordinate) {
            Map<Coordinate, Double> values = staged.get(table);
            if (values != null && values.containsKey(coordinate)) {
                return Optional.of(values.get(coordinate));
            }
            return InMemoryTableStore.this.value(table, coordinate);
        }

        @Override
        public synchronized Map<Coordinate, Double> read(String table, Coordinate filter) {
            Map<Coordinate, Double> merged = InMemoryTableStore.this.read(table, filter);
            merged.putAll(select(staged.getOrDefault(table, Map.of()), filter));
            return merged;
        }

        @Override
        public synchronized void write(String table, Map<Coordinate, Double> values) {
            staged.computeIfAbsent(table, t -> new LinkedHashMap<>()).putAll(values);
        }

        @Override
        public synchronized Map<Coordinate, Double> staged(String table) {
            return new LinkedHashMap<>(staged.getOrDefault(table, Map.of()));
        }

        @Override
        public synchronized void promote() {
            InMemoryTableStore.this.promote(this);
            int count = staged.values().stream().mapToInt(Map::size).sum();
            log.debug("Promoted {} staged value(s) of unit {}", count, unitKey);
            staged.clear();
        }

        @Override
        public synchronized void discard() {
            log.debug("Discarded staged values of unit {}", unitKey);
            staged.clear();
        }
    }
}
