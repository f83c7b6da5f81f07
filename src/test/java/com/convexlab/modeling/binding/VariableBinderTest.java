package com.convexlab.modeling.binding;

import com.convexlab.modeling.algebra.AffineExpression;
import com.convexlab.modeling.algebra.AffineMatrix;
import com.convexlab.modeling.algebra.Shape;
import com.convexlab.modeling.domain.DomainAlgebra;
import com.convexlab.modeling.exception.DimensionMismatchException;
import com.convexlab.modeling.exception.MissingDataException;
import com.convexlab.modeling.model.Coordinate;
import com.convexlab.modeling.model.DataTable;
import com.convexlab.modeling.model.IndexSet;
import com.convexlab.modeling.model.ModelDefinition;
import com.convexlab.modeling.model.SetFilter;
import com.convexlab.modeling.model.SetRole;
import com.convexlab.modeling.model.TableRole;
import com.convexlab.modeling.model.VariableDefinition;
import com.convexlab.modeling.operator.ConstantRegistry;
import com.convexlab.modeling.scenario.Scenario;
import com.convexlab.modeling.store.InMemoryTableStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class VariableBinderTest {

    private static final Scenario Y2030 = new Scenario(Coordinate.of("year", "2030"));

    private ModelDefinition model;
    private InMemoryTableStore store;

    @BeforeEach
    void setUp() {
        model = ModelDefinition.builder()
                .set("tech", IndexSet.builder().name("tech").items(List.of("coal", "gas", "solar"))
                        .filter("fossil", List.of("coal", "gas")).build())
                .set("hour", IndexSet.builder().name("hour").items(List.of("h1", "h2")).build())
                .set("year", IndexSet.builder().name("year").items(List.of("2030", "2040"))
                        .role(SetRole.INTER_PROBLEM).build())
                .table("cost", DataTable.builder().name("cost").coordinates(List.of("tech", "year")).build())
                .table("supply", DataTable.builder().name("supply").coordinates(List.of("tech", "hour", "year"))
                        .role(TableRole.endogenous()).build())
                .table("ones", DataTable.builder().name("ones").coordinates(List.of("tech"))
                        .role(TableRole.constant("sum_vector")).build())
                .table("price", DataTable.builder().name("price").coordinates(List.of("hour"))
                        .role(TableRole.perSubproblem(Map.of(
                                "market", TableRole.endogenous(),
                                "dispatch", TableRole.exogenous())))
                        .build())
                .variable("c", VariableDefinition.builder().name("c").table("cost").rows("tech").build())
                .variable("s", VariableDefinition.builder().name("s").table("supply").rows("tech").build())
                .variable("fossil_cost", VariableDefinition.builder().name("fossil_cost").table("cost").rows("tech")
                        .filter("tech", SetFilter.named("fossil")).build())
                .variable("ones", VariableDefinition.builder().name("ones").table("ones").rows("tech").build())
                .variable("p", VariableDefinition.builder().name("p").table("price").cols("hour").build())
                .build();

        store = new InMemoryTableStore();
        store.write("cost", Map.of(
                Coordinate.of(Map.of("tech", "coal", "year", "2030")), 30.0,
                Coordinate.of(Map.of("tech", "gas", "year", "2030")), 50.0,
                Coordinate.of(Map.of("tech", "solar", "year", "2030")), 5.0,
                Coordinate.of(Map.of("tech", "coal", "year", "2040")), 60.0));
    }

    private VariableBinder binder(MissingValuePolicy policy) {
        return new VariableBinder(model, new DomainAlgebra(), ConstantRegistry.withDefaults(), policy);
    }

    private BindingContext context(String problem, DecisionSpace space) {
        return BindingContext.builder().problemName(problem).dataView(store).decisionSpace(space).build();
    }

    @Test
    void testExogenousVectorReadsScenarioSlice() {
        VariableAccessor cost = binder(MissingValuePolicy.FAIL)
                .bind(model.variable("c"), Y2030, context("dispatch", new DecisionSpace()));

        AffineMatrix value = cost.valueAt(Coordinate.empty());

        assertThat(value.toArray()).isEqualTo(new double[][] { { 30 }, { 50 }, { 5 } });
        assertThat(cost.isEndogenous()).isFalse();
    }

    @Test
    void testMissingValueFailsOrFillsZero() {
        Scenario y2040 = new Scenario(Coordinate.of("year", "2040"));

        VariableAccessor strict = binder(MissingValuePolicy.FAIL)
                .bind(model.variable("c"), y2040, context("dispatch", new DecisionSpace()));
        assertThatThrownBy(() -> strict.valueAt(Coordinate.empty()))
                .isInstanceOf(MissingDataException.class)
                .hasMessageContaining("cost");

        VariableAccessor lenient = binder(MissingValuePolicy.ZERO)
                .bind(model.variable("c"), y2040, context("dispatch", new DecisionSpace()));
        assertThat(lenient.valueAt(Coordinate.empty()).toArray()).isEqualTo(new double[][] { { 60 }, { 0 }, { 0 } });
    }

    @Test
    void testBlankFillTakesPrecedenceOverPolicy() {
        model = model.toBuilder()
                .variable("c_filled", model.variable("c").toBuilder().name("c_filled").blankFill(-1.0).build())
                .build();
        Scenario y2040 = new Scenario(Coordinate.of("year", "2040"));

        VariableAccessor filled = binder(MissingValuePolicy.FAIL)
                .bind(model.variable("c_filled"), y2040, context("dispatch", new DecisionSpace()));

        assertThat(filled.valueAt(Coordinate.empty()).toArray()).isEqualTo(new double[][] { { 60 }, { -1 }, { -1 } });
    }

    @Test
    void testFilterRestrictsRows() {
        VariableLayout layout = binder(MissingValuePolicy.FAIL).layout(model.variable("fossil_cost"), "dispatch");

        assertThat(layout.getRowItems()).containsExactly("coal", "gas");
        assertThat(layout.getShape()).isEqualTo(Shape.of(2, 1, true));
    }

    @Test
    void testEndogenousVariableBroadcastsOverForeignSets() {
        DecisionSpace space = new DecisionSpace();
        VariableAccessor supply = binder(MissingValuePolicy.FAIL)
                .bind(model.variable("s"), Y2030, context("dispatch", space));

        AffineMatrix h1 = supply.valueAt(Coordinate.of(Map.of("hour", "h1", "region", "north")));
        AffineMatrix h1Again = supply.valueAt(Coordinate.of(Map.of("hour", "h1", "region", "south")));
        AffineMatrix h2 = supply.valueAt(Coordinate.of("hour", "h2"));

        assertThat(h1Again).isSameAs(h1);
        assertThat(h2).isNotEqualTo(h1);
        assertThat(space.size()).isEqualTo(6);
        assertThat(supply.intraSetNames()).containsExactly("hour");
        assertThat(space.getVariables().get(0).getCoordinate())
                .isEqualTo(Coordinate.of(Map.of("tech", "coal", "hour", "h1", "year", "2030")));
    }

    @Test
    void testSameTableSharesDecisionVariables() {
        DecisionSpace space = new DecisionSpace();
        VariableBinder binder = binder(MissingValuePolicy.FAIL);
        VariableAccessor first = binder.bind(model.variable("s"), Y2030, context("dispatch", space));
        VariableAccessor second = binder.bind(model.variable("s"), Y2030, context("dispatch", space));

        AffineExpression a = first.valueAt(Coordinate.of("hour", "h1")).get(0, 0);
        AffineExpression b = second.valueAt(Coordinate.of("hour", "h1")).get(0, 0);

        assertThat(a).isEqualTo(b);
        assertThat(space.size()).isEqualTo(3);
    }

    @Test
    void testDecisionVariablesAreAllocatedOnFirstAccess() {
        DecisionSpace space = new DecisionSpace();
        VariableAccessor supply = binder(MissingValuePolicy.FAIL)
                .bind(model.variable("s"), Y2030, context("dispatch", space));

        assertThat(space.size()).isZero();
        supply.valueAt(Coordinate.of("hour", "h2"));
        assertThat(space.size()).isEqualTo(3);
        assertThat(space.getVariables()).extracting(v -> v.getCoordinate().get("hour")).containsOnly("h2");
        supply.valueAt(Coordinate.of("hour", "h2"));
        assertThat(space.size()).isEqualTo(3);
    }

    @Test
    void testConstantTableUsesGenerator() {
        VariableAccessor ones = binder(MissingValuePolicy.FAIL)
                .bind(model.variable("ones"), Y2030, context("dispatch", new DecisionSpace()));

        assertThat(ones.valueAt(Coordinate.empty()).toArray()).isEqualTo(new double[][] { { 1 }, { 1 }, { 1 } });
    }

    @Test
    void testPerSubproblemRoleResolvesByProblem() {
        VariableBinder binder = binder(MissingValuePolicy.ZERO);

        assertThat(binder.layout(model.variable("p"), "market").getShape()).isEqualTo(Shape.of(1, 2, false));
        assertThat(binder.layout(model.variable("p"), "dispatch").getShape()).isEqualTo(Shape.of(1, 2, true));
    }

    @Test
    void testFilterSelectingNothingIsRejected() {
        VariableDefinition empty = model.variable("c").toBuilder()
                .name("none")
                .filter("tech", SetFilter.items())
                .build();

        assertThatThrownBy(() -> binder(MissingValuePolicy.FAIL).layout(empty, "dispatch"))
                .isInstanceOf(DimensionMismatchException.class)
                .hasMessageContaining("select no item");
    }

    @Test
    void testFilterOnInterProblemSetIsRejected() {
        VariableDefinition byYear = model.variable("c").toBuilder()
                .name("by_year")
                .filter("year", SetFilter.items("2030"))
                .build();

        assertThatThrownBy(() -> binder(MissingValuePolicy.FAIL).layout(byYear, "dispatch"))
                .isInstanceOf(DimensionMismatchException.class)
                .hasMessageContaining("inter-problem");
    }
}
