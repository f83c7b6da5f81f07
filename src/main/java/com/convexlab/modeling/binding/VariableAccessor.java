package com.convexlab.modeling.binding;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

import com.convexlab.modeling.algebra.AffineExpression;
import com.convexlab.modeling.algebra.AffineMatrix;
import com.convexlab.modeling.model.Coordinate;
import com.convexlab.modeling.model.ResolvedRole;
import com.convexlab.modeling.scenario.Scenario;

import lombok.Getter;

/**
 * Value lookup of one variable within one problem and scenario.
 *
 * {@link #valueAt(Coordinate)} projects the requested coordinate onto the
 * variable's own intra-problem sets, so coordinates that only differ on other
 * sets get the same matrix instance (broadcasting).
 */
public class VariableAccessor {

    @Getter
    private final VariableLayout layout;
    @Getter
    private final Scenario scenario;
    private final Function<Coordinate, AffineExpression> entries;
    private final AffineMatrix constantValue;
    private final Map<Coordinate, AffineMatrix> cache = new ConcurrentHashMap<>();

    VariableAccessor(VariableLayout layout, Scenario scenario, Function<Coordinate, AffineExpression> entries) {
        this.layout = layout;
        this.scenario = scenario;
        this.entries = entries;
        this.constantValue = null;
    }

    VariableAccessor(VariableLayout layout, Scenario scenario, AffineMatrix constantValue) {
        this.layout = layout;
        this.scenario = scenario;
        this.entries = null;
        this.constantValue = constantValue;
    }

    public String getName() {
        return layout.getName();
    }

    public List<String> intraSetNames() {
        return layout.intraSetNames();
    }

    public boolean isEndogenous() {
        return layout.getRole() == ResolvedRole.ENDOGENOUS;
    }

    /**
     * Matrix of the variable at intra-problem coordinate {@code pi}.
     *
     * @param pi coordinate covering at least every intra-problem set of this variable
     */
    public AffineMatrix valueAt(Coordinate pi) {
        if (constantValue != null) {
            return constantValue;
        }
        Coordinate key = pi.project(intraSetNames());
        if (key.sets().size() != intraSetNames().size()) {
            throw new IllegalArgumentException("Coordinate " + pi + " does not cover intra-problem sets "
                    + intraSetNames() + " of variable '" + getName() + "'");
        }
        return cache.computeIfAbsent(key, this::load);
    }

    private AffineMatrix load(Coordinate key) {
        Coordinate inter = scenario.getCoordinate().project(layout.getPartition().interSetNames());
        List<String> rows = layout.getRowItems();
        List<String> cols = layout.getColItems();
        String rowSet = layout.getPartition().getRowSet() == null ? null : layout.getPartition().getRowSet().getName();
        String colSet = layout.getPartition().getColSet() == null ? null : layout.getPartition().getColSet().getName();

        AffineExpression[] values = new AffineExpression[rows.size() * cols.size()];
        for (int i = 0; i < rows.size(); i++) {
            for (int j = 0; j < cols.size(); j++) {
                Map<String, String> full = new LinkedHashMap<>();
                if (rowSet != null) {
                    full.put(rowSet, rows.get(i));
                }
                if (colSet != null) {
                    full.put(colSet, cols.get(j));
                }
                full.putAll(key.asMap());
                full.putAll(inter.asMap());
                values[i * cols.size() + j] = entries.apply(Coordinate.of(full));
            }
        }
        return AffineMatrix.of(rows.size(), cols.size(), values);
    }

    @Override
    public String toString() {
        return getName() + "[" + layout.getRole() + " " + layout.getShape().describe() + "]";
    }
}
