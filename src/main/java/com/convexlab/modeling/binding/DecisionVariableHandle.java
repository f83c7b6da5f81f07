package com.convexlab.modeling.binding;

import java.util.LinkedHashMap;
import java.util.Map;

import com.convexlab.modeling.algebra.AffineExpression;
import com.convexlab.modeling.model.Coordinate;
import com.convexlab.modeling.model.DataTable;

/**
 * Decision variables of one endogenous table within one solver model. Every
 * variable bound to the table slices this handle, so all of them share the
 * same decision variables. Entries are allocated on first access.
 */
public class DecisionVariableHandle {

    private final DecisionSpace space;
    private final DataTable table;
    private final Map<Coordinate, Integer> indices = new LinkedHashMap<>();

    DecisionVariableHandle(DecisionSpace space, DataTable table) {
        this.space = space;
        this.table = table;
    }

    public String getTableName() {
        return table.getName();
    }

    /**
     * @param coordinate full coordinate over the table domain
     */
    public AffineExpression at(Coordinate coordinate) {
        Integer index = indices.get(coordinate);
        if (index == null) {
            index = space.allocate(table, coordinate);
            indices.put(coordinate, index);
        }
        return AffineExpression.variable(index);
    }

    public Map<Coordinate, Integer> getIndices() {
        return indices;
    }

    /**
     * Values of this table's decision variables in a solution vector.
     */
    public Map<Coordinate, Double> valuesFrom(double[] solution) {
        Map<Coordinate, Double> values = new LinkedHashMap<>();
        indices.forEach((coordinate, index) -> values.put(coordinate, solution[index]));
        return values;
    }
}
