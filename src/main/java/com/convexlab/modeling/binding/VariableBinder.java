package com.convexlab.modeling.binding;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.convexlab.modeling.algebra.AffineExpression;
import com.convexlab.modeling.algebra.AffineMatrix;
import com.convexlab.modeling.algebra.Shape;
import com.convexlab.modeling.domain.DomainAlgebra;
import com.convexlab.modeling.domain.DomainPartition;
import com.convexlab.modeling.domain.SubDomain;
import com.convexlab.modeling.exception.DimensionMismatchException;
import com.convexlab.modeling.exception.MissingDataException;
import com.convexlab.modeling.model.Coordinate;
import com.convexlab.modeling.model.DataTable;
import com.convexlab.modeling.model.Domain;
import com.convexlab.modeling.model.IndexSet;
import com.convexlab.modeling.model.ModelDefinition;
import com.convexlab.modeling.model.ResolvedRole;
import com.convexlab.modeling.model.SetFilter;
import com.convexlab.modeling.model.TableRole;
import com.convexlab.modeling.model.VariableDefinition;
import com.convexlab.modeling.operator.ConstantGenerator;
import com.convexlab.modeling.operator.ConstantRegistry;
import com.convexlab.modeling.scenario.Scenario;
import com.convexlab.modeling.store.TableView;

/**
 * Binds symbolic variables to table data (exogenous), generated values
 * (constant) or decision variables (endogenous).
 */
public class VariableBinder {
    private static final Logger log = LoggerFactory.getLogger(VariableBinder.class);

    private static final List<String> SINGLETON = Collections.singletonList(null);

    private final ModelDefinition model;
    private final DomainAlgebra domainAlgebra;
    private final ConstantRegistry constants;
    private final MissingValuePolicy missingValuePolicy;

    public VariableBinder(ModelDefinition model, DomainAlgebra domainAlgebra, ConstantRegistry constants,
            MissingValuePolicy missingValuePolicy) {
        this.model = model;
        this.domainAlgebra = domainAlgebra;
        this.constants = constants;
        this.missingValuePolicy = missingValuePolicy;
    }

    /**
     * Structure of {@code variable} inside {@code problemName}, computed without reading data.
     *
     * @throws DimensionMismatchException on an invalid allocation or a filter selecting nothing
     */
    public VariableLayout layout(VariableDefinition variable, String problemName) {
        DataTable table = model.table(variable.getTable());
        Domain tableDomain = model.domainOf(table);
        DomainPartition partition = domainAlgebra.partition(tableDomain, variable);
        for (String filtered : variable.getFilters().keySet()) {
            if (partition.getInterSets().stream().anyMatch(s -> s.getName().equals(filtered))) {
                throw new DimensionMismatchException("Variable '" + variable.getName()
                        + "' filters inter-problem set '" + filtered + "'");
            }
        }
        SubDomain filtered = domainAlgebra.filter(tableDomain.dimensionPart(), variable.getFilters());

        List<String> rowItems = itemsOf(partition.getRowSet(), filtered, variable);
        List<String> colItems = itemsOf(partition.getColSet(), filtered, variable);

        Map<String, List<String>> intraItems = new LinkedHashMap<>();
        for (IndexSet set : partition.getIntraSets()) {
            intraItems.put(set.getName(), itemsOf(set, filtered, variable));
        }
        SubDomain intraDomain = new SubDomain(new Domain(partition.getIntraSets()), intraItems);

        ResolvedRole role = table.roleIn(problemName);
        Shape shape;
        if (role == ResolvedRole.CONSTANT) {
            shape = generatorOf(table, problemName).outputShape(rowItems.size(), colItems.size());
        } else {
            shape = Shape.of(rowItems.size(), colItems.size(), role != ResolvedRole.ENDOGENOUS);
        }

        return VariableLayout.builder()
                .variable(variable)
                .table(table)
                .role(role)
                .partition(partition)
                .rowItems(rowItems)
                .colItems(colItems)
                .intraDomain(intraDomain)
                .shape(shape)
                .build();
    }

    public VariableAccessor bind(VariableDefinition variable, Scenario scenario, BindingContext context) {
        VariableLayout layout = layout(variable, context.getProblemName());
        log.debug("Binding variable '{}' as {} {} for problem '{}', scenario {}", variable.getName(),
                layout.getRole(), layout.getShape().describe(), context.getProblemName(), scenario);

        switch (layout.getRole()) {
            case CONSTANT:
                ConstantGenerator generator = generatorOf(layout.getTable(), context.getProblemName());
                double[][] values = generator.generate(layout.getRowItems().size(), layout.getColItems().size());
                return new VariableAccessor(layout, scenario, AffineMatrix.constant(values));
            case ENDOGENOUS:
                DecisionVariableHandle handle = context.getDecisionSpace().handle(layout.getTable());
                return new VariableAccessor(layout, scenario, handle::at);
            default:
                return new VariableAccessor(layout, scenario, exogenousEntries(layout, context.getDataView()));
        }
    }

    private Function<Coordinate, AffineExpression> exogenousEntries(VariableLayout layout, TableView dataView) {
        String table = layout.getTable().getName();
        Double blankFill = layout.getVariable().getBlankFill();
        return coordinate -> {
            Optional<Double> stored = dataView.value(table, coordinate);
            if (stored.isPresent()) {
                return AffineExpression.constant(stored.get());
            }
            if (blankFill != null) {
                return AffineExpression.constant(blankFill);
            }
            if (missingValuePolicy == MissingValuePolicy.ZERO) {
                return AffineExpression.ZERO;
            }
            throw new MissingDataException("Table '" + table + "' has no value at " + coordinate
                    + " (variable '" + layout.getName() + "')");
        };
    }

    private ConstantGenerator generatorOf(DataTable table, String problemName) {
        TableRole role = table.getRole();
        if (role instanceof TableRole.PerSubproblem) {
            role = ((TableRole.PerSubproblem) role).getRoles().get(problemName);
        }
        if (!(role instanceof TableRole.Constant)) {
            throw new IllegalStateException("Table '" + table.getName() + "' is not constant in problem '"
                    + problemName + "'");
        }
        return constants.get(((TableRole.Constant) role).getGenerator());
    }

    private static List<String> itemsOf(IndexSet set, SubDomain filtered, VariableDefinition variable) {
        if (set == null) {
            return SINGLETON;
        }
        List<String> items = new ArrayList<>(filtered.itemsOf(set.getName()));
        if (items.isEmpty()) {
            throw new DimensionMismatchException("Filters of variable '" + variable.getName()
                    + "' select no item of set '" + set.getName() + "'");
        }
        return Collections.unmodifiableList(items);
    }
}
