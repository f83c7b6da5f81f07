package com.convexlab.modeling.orchestration;

import com.convexlab.modeling.binding.MissingValuePolicy;
import com.convexlab.modeling.binding.VariableBinder;
import com.convexlab.modeling.build.CompiledProblem;
import com.convexlab.modeling.build.ModelValidator;
import com.convexlab.modeling.build.ProblemBuilder;
import com.convexlab.modeling.build.SolverModel;
import com.convexlab.modeling.convergence.ConvergenceNorm;
import com.convexlab.modeling.convergence.ConvergenceSettings;
import com.convexlab.modeling.domain.DomainAlgebra;
import com.convexlab.modeling.exception.CircularDependencyException;
import com.convexlab.modeling.exception.ModelDefinitionException;
import com.convexlab.modeling.instantiate.ExpressionInstantiator;
import com.convexlab.modeling.model.Coordinate;
import com.convexlab.modeling.model.DataTable;
import com.convexlab.modeling.model.IndexSet;
import com.convexlab.modeling.model.ModelDefinition;
import com.convexlab.modeling.model.ProblemDefinition;
import com.convexlab.modeling.model.SetRole;
import com.convexlab.modeling.model.TableRole;
import com.convexlab.modeling.model.VariableDefinition;
import com.convexlab.modeling.operator.ConstantRegistry;
import com.convexlab.modeling.operator.OperatorRegistry;
import com.convexlab.modeling.solver.OjAlgoSolverBackend;
import com.convexlab.modeling.solver.SolveStatus;
import com.convexlab.modeling.solver.SolverBackend;
import com.convexlab.modeling.solver.SolverOptions;
import com.convexlab.modeling.solver.SolverResult;
import com.convexlab.modeling.store.InMemoryTableStore;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

/**
 * End-to-end tests of the orchestrator against ojAlgo and a counting fake backend.
 */
class SolverOrchestratorTest {

    private static final Coordinate Y2030 = Coordinate.of("year", "2030");
    private static final Coordinate Y2040 = Coordinate.of("year", "2040");

    private final InMemoryTableStore store = new InMemoryTableStore();

    private SolverOrchestrator orchestrator(ModelDefinition model, SolverBackend backend, OrchestratorConfig config) {
        OperatorRegistry operators = OperatorRegistry.withDefaults();
        VariableBinder binder = new VariableBinder(model, new DomainAlgebra(), ConstantRegistry.withDefaults(),
                config.getMissingValues());
        Map<String, CompiledProblem> problems = new ModelValidator(model, binder, operators).validate();
        ProblemBuilder builder = new ProblemBuilder(model, binder, new ExpressionInstantiator(operators));
        return new SolverOrchestrator(model, problems, builder, backend, store, config);
    }

    private static Coordinate at(String tech, String year) {
        return Coordinate.of(Map.of("tech", tech, "year", year));
    }

    /**
     * Three technologies with costs 30/50/5 and capacities 100/100/40 meeting a per-year demand.
     */
    private ModelDefinition dispatchModel(List<String> expressions) {
        ModelDefinition model = ModelDefinition.builder()
                .set("tech", IndexSet.builder().name("tech").items(List.of("coal", "gas", "solar")).build())
                .set("year", IndexSet.builder().name("year").items(List.of("2030", "2040"))
                        .role(SetRole.INTER_PROBLEM).build())
                .table("cost", DataTable.builder().name("cost").coordinates(List.of("tech")).build())
                .table("capacity", DataTable.builder().name("capacity").coordinates(List.of("tech")).build())
                .table("demand", DataTable.builder().name("demand").coordinates(List.of("year")).build())
                .table("supply", DataTable.builder().name("supply").coordinates(List.of("tech", "year"))
                        .role(TableRole.endogenous()).build())
                .variable("c", VariableDefinition.builder().name("c").table("cost").rows("tech").build())
                .variable("cap", VariableDefinition.builder().name("cap").table("capacity").rows("tech").build())
                .variable("d", VariableDefinition.builder().name("d").table("demand").build())
                .variable("s", VariableDefinition.builder().name("s").table("supply").rows("tech").build())
                .problem("dispatch", ProblemDefinition.builder()
                        .name("dispatch")
                        .expressions(expressions)
                        .objective("Minimize(tran(c) @ s)")
                        .build())
                .build();

        store.write("cost", Map.of(Coordinate.of("tech", "coal"), 30.0, Coordinate.of("tech", "gas"), 50.0,
                Coordinate.of("tech", "solar"), 5.0));
        store.write("capacity", Map.of(Coordinate.of("tech", "coal"), 100.0, Coordinate.of("tech", "gas"), 100.0,
                Coordinate.of("tech", "solar"), 40.0));
        return model;
    }

    private static final List<String> DISPATCH = List.of("sum(s) >= d", "s <= cap", "s >= 0");

    @Test
    void testDispatchSolvesCheapestMix() {
        ModelDefinition model = dispatchModel(DISPATCH);
        store.write("demand", Map.of(Y2030, 120.0, Y2040, 150.0));

        RunReport report = orchestrator(model, new OjAlgoSolverBackend(), OrchestratorConfig.defaults())
                .run(SolveMode.INDEPENDENT);

        assertThat(report.isAllSolved()).isTrue();
        assertThat(report.getUnits()).hasSize(2);
        assertThat(report.find("{year=2030}", "dispatch").getObjectiveValue()).isCloseTo(2600.0, within(1e-6));
        assertThat(report.find("{year=2040}", "dispatch").getObjectiveValue()).isCloseTo(3700.0, within(1e-6));
        assertThat(store.value("supply", at("solar", "2030")).orElseThrow()).isCloseTo(40.0, within(1e-6));
        assertThat(store.value("supply", at("coal", "2030")).orElseThrow()).isCloseTo(80.0, within(1e-6));
        assertThat(store.value("supply", at("gas", "2030")).orElseThrow()).isCloseTo(0.0, within(1e-6));
        assertThat(store.value("supply", at("coal", "2040")).orElseThrow()).isCloseTo(100.0, within(1e-6));
        assertThat(store.value("supply", at("gas", "2040")).orElseThrow()).isCloseTo(10.0, within(1e-6));
    }

    @Test
    void testFailingScenarioDoesNotAffectOthers() {
        ModelDefinition model = dispatchModel(DISPATCH);
        store.write("demand", Map.of(Y2030, 120.0, Y2040, 300.0));
        OrchestratorConfig config = OrchestratorConfig.builder().parallelism(2).build();

        RunReport report = orchestrator(model, new OjAlgoSolverBackend(), config).run(SolveMode.INDEPENDENT);

        assertThat(report.find("{year=2030}", "dispatch").isSolved()).isTrue();
        assertThat(report.find("{year=2040}", "dispatch").isFailure()).isTrue();
        assertThat(report.isAllSolved()).isFalse();
        assertThat(store.value("supply", at("solar", "2030")).orElseThrow()).isCloseTo(40.0, within(1e-6));
        assertThat(store.read("supply", Y2040)).isEmpty();
    }

    @Test
    void testMissingExogenousValueFailsOnlyItsScenario() {
        ModelDefinition model = dispatchModel(DISPATCH);
        store.write("demand", Map.of(Y2030, 120.0));

        RunReport report = orchestrator(model, new OjAlgoSolverBackend(), OrchestratorConfig.defaults())
                .run(SolveMode.INDEPENDENT);

        UnitStatus failed = report.find("{year=2040}", "dispatch");
        assertThat(failed.getStatus()).isEqualTo(UnitStatus.Status.FAILED);
        assertThat(failed.getErrorMessage()).contains("demand");
        assertThat(report.find("{year=2030}", "dispatch").isSolved()).isTrue();
    }

    @Test
    void testViolatedConstantRowIsInfeasibleWithoutSolverCall() {
        ModelDefinition model = dispatchModel(List.of("sum(cap) >= d", "s >= 0", "s <= cap"));
        store.write("demand", Map.of(Y2030, 120.0, Y2040, 300.0));
        CountingBackend backend = new CountingBackend(SolveStatus.OPTIMAL);

        RunReport report = orchestrator(model, backend, OrchestratorConfig.defaults()).run(SolveMode.INDEPENDENT);

        assertThat(report.find("{year=2030}", "dispatch").isSolved()).isTrue();
        UnitStatus infeasible = report.find("{year=2040}", "dispatch");
        assertThat(infeasible.getStatus()).isEqualTo(UnitStatus.Status.INFEASIBLE);
        assertThat(infeasible.getErrorMessage()).contains("sum(cap) >= d");
        assertThat(backend.calls.get()).isEqualTo(1);
    }

    @Test
    void testSolverErrorLeavesStoreUntouched() {
        ModelDefinition model = dispatchModel(DISPATCH);
        store.write("demand", Map.of(Y2030, 120.0, Y2040, 150.0));
        CountingBackend backend = new CountingBackend(SolveStatus.SOLVER_ERROR);

        RunReport report = orchestrator(model, backend, OrchestratorConfig.defaults()).run(SolveMode.INDEPENDENT);

        assertThat(report.count(UnitStatus.Status.FAILED)).isEqualTo(2);
        assertThat(store.read("supply")).isEmpty();
        assertThat(backend.calls.get()).isEqualTo(2);
    }

    /**
     * Scalar tables {@code x} and {@code y}, each endogenous in one member and read by the other.
     */
    private static ModelDefinition coupledModel(String producer, String consumer) {
        return ModelDefinition.builder()
                .table("x", DataTable.builder().name("x")
                        .role(TableRole.perSubproblem(Map.of(
                                "producer", TableRole.endogenous(),
                                "consumer", TableRole.exogenous())))
                        .build())
                .table("y", DataTable.builder().name("y")
                        .role(TableRole.perSubproblem(Map.of(
                                "producer", TableRole.exogenous(),
                                "consumer", TableRole.endogenous())))
                        .build())
                .variable("x", VariableDefinition.builder().name("x").table("x").build())
                .variable("y", VariableDefinition.builder().name("y").table("y").build())
                .problem("consumer", ProblemDefinition.builder().name("consumer").expression(consumer)
                        .couplingGroup("loop").couplingOrder(2).build())
                .problem("producer", ProblemDefinition.builder().name("producer").expression(producer)
                        .couplingGroup("loop").couplingOrder(1).build())
                .build();
    }

    private static OrchestratorConfig coupledConfig(double tolerance, int maxIterations, boolean bestEffort) {
        return OrchestratorConfig.builder()
                .convergence(ConvergenceSettings.builder()
                        .norm(ConvergenceNorm.MAX_ABSOLUTE)
                        .tolerance(tolerance)
                        .maxIterations(maxIterations)
                        .build())
                .bestEffortExport(bestEffort)
                .build();
    }

    @Test
    void testFixedPointConvergesAtSecondIteration() {
        ModelDefinition model = coupledModel("x == 2", "y == x");
        SolverOrchestrator orchestrator = orchestrator(model, new OjAlgoSolverBackend(), coupledConfig(1e-6, 10, false));

        assertThat(orchestrator.getGroups()).singleElement().satisfies(group -> {
            assertThat(group.memberNames()).containsExactly("producer", "consumer");
            assertThat(group.getSharedTables()).containsExactly("x");
        });

        RunReport report = orchestrator.run(SolveMode.INTEGRATED);

        UnitStatus loop = report.find("base", "loop");
        assertThat(loop.getKind()).isEqualTo(UnitStatus.Kind.COUPLING_GROUP);
        assertThat(loop.getStatus()).isEqualTo(UnitStatus.Status.SOLVED);
        assertThat(loop.getCouplingState()).isEqualTo(CouplingState.CONVERGED);
        assertThat(loop.getIterations()).isEqualTo(2);
        assertThat(loop.getFinalNorm()).isCloseTo(0.0, within(1e-9));
        assertThat(store.value("x", Coordinate.empty()).orElseThrow()).isCloseTo(2.0, within(1e-9));
        assertThat(store.value("y", Coordinate.empty()).orElseThrow()).isCloseTo(2.0, within(1e-9));
    }

    @Test
    void testGaussSeidelReachesContractionFixedPoint() {
        ModelDefinition model = coupledModel("x == 0.5 * y + 1", "y == x");

        RunReport report = orchestrator(model, new OjAlgoSolverBackend(), coupledConfig(1e-4, 50, false))
                .run(SolveMode.INTEGRATED);

        UnitStatus loop = report.find("base", "loop");
        assertThat(loop.getStatus()).isEqualTo(UnitStatus.Status.SOLVED);
        assertThat(loop.getIterations()).isGreaterThan(2).isLessThan(50);
        assertThat(loop.getNormHistory()).hasSize(loop.getIterations());
        assertThat(store.value("x", Coordinate.empty()).orElseThrow()).isCloseTo(2.0, within(1e-3));
    }

    @Test
    void testDivergingLoopIsNotPromoted() {
        ModelDefinition model = coupledModel("x == y + 1", "y == x");

        RunReport report = orchestrator(model, new OjAlgoSolverBackend(), coupledConfig(1e-6, 5, false))
                .run(SolveMode.INTEGRATED);

        UnitStatus loop = report.find("base", "loop");
        assertThat(loop.getStatus()).isEqualTo(UnitStatus.Status.NOT_CONVERGED);
        assertThat(loop.getCouplingState()).isEqualTo(CouplingState.MAX_ITER_EXCEEDED);
        assertThat(loop.getIterations()).isEqualTo(5);
        assertThat(store.value("x", Coordinate.empty())).isEmpty();
    }

    @Test
    void testBestEffortPromotesLastIterate() {
        ModelDefinition model = coupledModel("x == y + 1", "y == x");

        RunReport report = orchestrator(model, new OjAlgoSolverBackend(), coupledConfig(1e-6, 3, true))
                .run(SolveMode.INTEGRATED);

        assertThat(report.find("base", "loop").getStatus()).isEqualTo(UnitStatus.Status.NOT_CONVERGED);
        assertThat(store.value("x", Coordinate.empty()).orElseThrow()).isCloseTo(3.0, within(1e-9));
    }

    /**
     * The market sets {@code price = 0.5 * supply + base}, the producer sets
     * {@code supply = price}, so every scenario has the fixed point {@code price = 2 * base}.
     */
    private ModelDefinition priceSupplyModel() {
        ModelDefinition model = ModelDefinition.builder()
                .set("tech", IndexSet.builder().name("tech").items(List.of("wind", "hydro")).build())
                .set("year", IndexSet.builder().name("year").items(List.of("y1", "y2"))
                        .role(SetRole.INTER_PROBLEM).build())
                .table("base", DataTable.builder().name("base").coordinates(List.of("tech", "year")).build())
                .table("price", DataTable.builder().name("price").coordinates(List.of("tech", "year"))
                        .role(TableRole.perSubproblem(Map.of(
                                "market", TableRole.endogenous(),
                                "producer", TableRole.exogenous())))
                        .build())
                .table("supply", DataTable.builder().name("supply").coordinates(List.of("tech", "year"))
                        .role(TableRole.perSubproblem(Map.of(
                                "market", TableRole.exogenous(),
                                "producer", TableRole.endogenous())))
                        .build())
                .variable("base", VariableDefinition.builder().name("base").table("base").rows("tech").build())
                .variable("p", VariableDefinition.builder().name("p").table("price").rows("tech").build())
                .variable("q", VariableDefinition.builder().name("q").table("supply").rows("tech").build())
                .problem("market", ProblemDefinition.builder().name("market").expression("p == 0.5 * q + base")
                        .couplingGroup("clearing").couplingOrder(1).build())
                .problem("producer", ProblemDefinition.builder().name("producer").expression("q == p")
                        .couplingGroup("clearing").couplingOrder(2).build())
                .build();

        store.write("base", Map.of(at("wind", "y1"), 1.0, at("hydro", "y1"), 2.0,
                at("wind", "y2"), 3.0, at("hydro", "y2"), 4.0));
        return model;
    }

    @Test
    void testPriceSupplyCouplingAcrossScenarios() {
        ModelDefinition model = priceSupplyModel();
        OrchestratorConfig config = coupledConfig(1e-6, 60, false).toBuilder().parallelism(2).build();
        SolverOrchestrator orchestrator = orchestrator(model, new OjAlgoSolverBackend(), config);

        assertThat(orchestrator.getGroups()).singleElement()
                .satisfies(group -> assertThat(group.getSharedTables()).containsExactlyInAnyOrder("price", "supply"));

        RunReport report = orchestrator.run(SolveMode.INTEGRATED);

        assertThat(report.getUnits()).hasSize(2);
        for (String scenario : List.of("{year=y1}", "{year=y2}")) {
            UnitStatus clearing = report.find(scenario, "clearing");
            assertThat(clearing.getStatus()).isEqualTo(UnitStatus.Status.SOLVED);
            assertThat(clearing.getCouplingState()).isEqualTo(CouplingState.CONVERGED);
            assertThat(clearing.getFinalNorm()).isLessThanOrEqualTo(1e-6);
        }
        assertThat(store.value("price", at("wind", "y1")).orElseThrow()).isCloseTo(2.0, within(1e-4));
        assertThat(store.value("price", at("hydro", "y1")).orElseThrow()).isCloseTo(4.0, within(1e-4));
        assertThat(store.value("price", at("wind", "y2")).orElseThrow()).isCloseTo(6.0, within(1e-4));
        assertThat(store.value("price", at("hydro", "y2")).orElseThrow()).isCloseTo(8.0, within(1e-4));
        assertThat(store.value("supply", at("hydro", "y2")).orElseThrow()).isCloseTo(8.0, within(1e-4));
        assertThat(store.read("price")).hasSize(4);
        assertThat(store.read("supply", Coordinate.of("year", "y1"))).hasSize(2);
    }

    @Test
    void testCoupledProblemsAreSkippedInIndependentMode() {
        ModelDefinition model = coupledModel("x == 2", "y == x");
        CountingBackend backend = new CountingBackend(SolveStatus.OPTIMAL);

        RunReport report = orchestrator(model, backend, coupledConfig(1e-6, 10, false)).run(SolveMode.INDEPENDENT);

        assertThat(report.getUnits()).extracting(UnitStatus::getStatus)
                .containsOnly(UnitStatus.Status.SKIPPED);
        assertThat(report.isAllSolved()).isTrue();
        assertThat(backend.calls.get()).isZero();
    }

    @Test
    void testTableEndogenousInTwoMembersIsCircular() {
        ModelDefinition model = ModelDefinition.builder()
                .table("x", DataTable.builder().name("x").role(TableRole.endogenous()).build())
                .variable("x", VariableDefinition.builder().name("x").table("x").build())
                .problem("a", ProblemDefinition.builder().name("a").expression("x == 1").couplingGroup("g").build())
                .problem("b", ProblemDefinition.builder().name("b").expression("x == 2").couplingGroup("g").build())
                .build();

        assertThatThrownBy(() -> orchestrator(model, new CountingBackend(SolveStatus.OPTIMAL),
                OrchestratorConfig.defaults()))
                .isInstanceOf(CircularDependencyException.class)
                .hasMessageContaining("x");
    }

    @Test
    void testVariableRegisteredUnderAnotherNameIsRejected() {
        ModelDefinition model = ModelDefinition.builder()
                .table("x", DataTable.builder().name("x").role(TableRole.endogenous()).build())
                .table("y", DataTable.builder().name("y").build())
                .variable("x", VariableDefinition.builder().name("x").table("x").build())
                .variable("alias", VariableDefinition.builder().name("x").table("y").build())
                .problem("a", ProblemDefinition.builder().name("a").expression("x == 1").build())
                .build();

        assertThatThrownBy(() -> orchestrator(model, new CountingBackend(SolveStatus.OPTIMAL),
                OrchestratorConfig.defaults()))
                .isInstanceOf(ModelDefinitionException.class)
                .hasMessage("Variable 'x' is registered under name 'alias'");
    }

    @Test
    void testMissingValueZeroPolicy() {
        ModelDefinition model = dispatchModel(DISPATCH);
        store.write("demand", Map.of(Y2030, 120.0));
        OrchestratorConfig config = OrchestratorConfig.builder().missingValues(MissingValuePolicy.ZERO).build();

        RunReport report = orchestrator(model, new OjAlgoSolverBackend(), config).run(SolveMode.INDEPENDENT);

        assertThat(report.isAllSolved()).isTrue();
        assertThat(report.find("{year=2040}", "dispatch").getObjectiveValue()).isCloseTo(0.0, within(1e-6));
    }

    /**
     * Returns a fixed status and all-zero values, counting solver calls.
     */
    private static final class CountingBackend implements SolverBackend {
        private final AtomicInteger calls = new AtomicInteger();
        private final SolveStatus status;

        private CountingBackend(SolveStatus status) {
            this.status = status;
        }

        @Override
        public ModelHandle buildModel(SolverModel model) {
            return () -> model;
        }

        @Override
        public SolverResult solve(ModelHandle handle, SolverOptions options) {
            calls.incrementAndGet();
            if (status != SolveStatus.OPTIMAL) {
                return SolverResult.failure(status, "fake " + status);
            }
            return SolverResult.builder()
                    .status(SolveStatus.OPTIMAL)
                    .objectiveValue(0.0)
                    .values(new double[handle.getModel().getVariables().size()])
                    .build();
        }
    }
}
