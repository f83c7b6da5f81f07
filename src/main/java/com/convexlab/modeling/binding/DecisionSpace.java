package com.convexlab.modeling.binding;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.convexlab.modeling.model.Coordinate;
import com.convexlab.modeling.model.DataTable;

/**
 * Registry of the decision variables of one solver model. Not thread-safe: a
 * model is built by a single thread.
 */
public class DecisionSpace {

    private final List<DecisionVariable> variables = new ArrayList<>();
    private final Map<String, DecisionVariableHandle> handles = new LinkedHashMap<>();

    /**
     * The single handle of {@code table} in this model.
     */
    public DecisionVariableHandle handle(DataTable table) {
        return handles.computeIfAbsent(table.getName(), name -> new DecisionVariableHandle(this, table));
    }

    int allocate(DataTable table, Coordinate coordinate) {
        int index = variables.size();
        variables.add(new DecisionVariable(index, table.getName(), coordinate, table.getValueType()));
        return index;
    }

    public List<DecisionVariable> getVariables() {
        return Collections.unmodifiableList(variables);
    }

    public int size() {
        return variables.size();
    }

    public Map<String, DecisionVariableHandle> getHandles() {
        return Collections.unmodifiableMap(handles);
    }

    /**
     * Solution values grouped by endogenous table.
     */
    public Map<String, Map<Coordinate, Double>> extract(double[] solution) {
        Map<String, Map<Coordinate, Double>> values = new LinkedHashMap<>();
        handles.forEach((table, handle) -> values.put(table, handle.valuesFrom(solution)));
        return values;
    }
}
