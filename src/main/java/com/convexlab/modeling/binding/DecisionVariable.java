package com.convexlab.modeling.binding;

import com.convexlab.modeling.model.Coordinate;
import com.convexlab.modeling.model.ValueType;

import lombok.Value;

/**
 * One scalar decision variable of a solver model: an entry of an endogenous table.
 */
@Value
public class DecisionVariable {
    int index;
    String table;
    Coordinate coordinate;
    ValueType valueType;

    public String label() {
        return table + coordinate;
    }
}
