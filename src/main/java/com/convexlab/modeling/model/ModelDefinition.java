package com.convexlab.modeling.model;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.convexlab.modeling.exception.ModelDefinitionException;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * In-memory model handed over by the configuration provider.
 * Lookups keep declaration order.
 */
@Value
@Builder(toBuilder = true)
public class ModelDefinition {

    @NonNull
    @Singular
    Map<String, IndexSet> sets;

    @NonNull
    @Singular
    Map<String, DataTable> tables;

    @NonNull
    @Singular
    Map<String, VariableDefinition> variables;

    @NonNull
    @Singular
    Map<String, ProblemDefinition> problems;

    public IndexSet set(String name) {
        return require(sets.get(name), "set", name);
    }

    public DataTable table(String name) {
        return require(tables.get(name), "table", name);
    }

    public VariableDefinition variable(String name) {
        return require(variables.get(name), "variable", name);
    }

    public ProblemDefinition problem(String name) {
        return require(problems.get(name), "problem", name);
    }

    public Optional<VariableDefinition> findVariable(String name) {
        return Optional.ofNullable(variables.get(name));
    }

    public Domain domainOf(DataTable table) {
        return new Domain(table.getCoordinates().stream().map(this::set).toList());
    }

    /**
     * Inter-problem sets in declaration order.
     */
    public List<IndexSet> interProblemSets() {
        return sets.values().stream().filter(IndexSet::isInterProblem).toList();
    }

    public List<VariableDefinition> variablesOf(String tableName) {
        return variables.values().stream().filter(v -> v.getTable().equals(tableName)).toList();
    }

    private static <T> T require(T value, String kind, String name) {
        if (value == null) {
            throw new ModelDefinitionException("Unknown " + kind + " '" + name + "'");
        }
        return value;
    }
}
