package com.convexlab.modeling.orchestration;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.convexlab.modeling.build.CompiledProblem;
import com.convexlab.modeling.build.ProblemBuilder;
import com.convexlab.modeling.build.SolverModel;
import com.convexlab.modeling.convergence.ConvergenceCheck;
import com.convexlab.modeling.convergence.ConvergenceMonitor;
import com.convexlab.modeling.domain.DomainAlgebra;
import com.convexlab.modeling.exception.ConvergenceFailureException;
import com.convexlab.modeling.exception.ModelException;
import com.convexlab.modeling.exception.SolverException;
import com.convexlab.modeling.model.Coordinate;
import com.convexlab.modeling.model.DataTable;
import com.convexlab.modeling.model.ModelDefinition;
import com.convexlab.modeling.scenario.Scenario;
import com.convexlab.modeling.scenario.ScenarioEnumerator;
import com.convexlab.modeling.solver.SolveStatus;
import com.convexlab.modeling.solver.SolverBackend;
import com.convexlab.modeling.solver.SolverResult;
import com.convexlab.modeling.store.StagingArea;
import com.convexlab.modeling.store.TableStore;

/**
 * Runs every (scenario, problem) and (scenario, coupling group) unit of a
 * validated model and records one {@link UnitStatus} per unit.
 *
 * Each unit writes to its own staging area. Values reach the store only when
 * the unit succeeds, so a failed or interrupted unit leaves it untouched.
 */
public class SolverOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(SolverOrchestrator.class);

    private final ModelDefinition model;
    private final Map<String, CompiledProblem> problems;
    private final ProblemBuilder builder;
    private final SolverBackend backend;
    private final TableStore store;
    private final OrchestratorConfig config;
    private final ConvergenceMonitor monitor;
    private final List<CouplingGroup> groups;
    private final DomainAlgebra domainAlgebra = new DomainAlgebra();

    /**
     * @throws com.convexlab.modeling.exception.CircularDependencyException on a coupling-group role conflict
     */
    public SolverOrchestrator(ModelDefinition model, Map<String, CompiledProblem> problems, ProblemBuilder builder,
            SolverBackend backend, TableStore store, OrchestratorConfig config) {
        this.model = model;
        this.problems = problems;
        this.builder = builder;
        this.backend = backend;
        this.store = store;
        this.config = config;
        this.monitor = new ConvergenceMonitor(config.getConvergence());
        this.groups = new RoleResolver(model, config.getTieBreak()).resolveGroups(problems);
    }

    public List<CouplingGroup> getGroups() {
        return groups;
    }

    public RunReport run(SolveMode mode) {
        RunReport report = new RunReport(mode, Instant.now());
        long start = System.currentTimeMillis();
        List<Scenario> scenarios = new ScenarioEnumerator().enumerate(model.interProblemSets());

        List<Callable<UnitStatus>> units = new ArrayList<>();
        for (Scenario scenario : scenarios) {
            for (CompiledProblem problem : problems.values()) {
                if (!problem.getDefinition().isCoupled()) {
                    units.add(() -> solveIndependent(problem, scenario));
                } else if (mode == SolveMode.INDEPENDENT) {
                    String reason = "Problem belongs to coupling group '" + problem.getDefinition().getCouplingGroup()
                            + "', solved in integrated mode only";
                    log.warn("Skipping problem '{}' in scenario {}: {}", problem.getName(), scenario, reason);
                    units.add(() -> UnitStatus.skipped(scenario.key(), problem.getName(), reason));
                }
            }
            if (mode == SolveMode.INTEGRATED) {
                for (CouplingGroup group : groups) {
                    units.add(() -> solveCoupled(group, scenario));
                }
            }
        }

        log.info("Solving {} unit(s) over {} scenario(s) in {} mode with parallelism {}", units.size(),
                scenarios.size(), mode, config.getParallelism());
        report.getUnits().addAll(execute(units));
        report.setDurationMillis(System.currentTimeMillis() - start);
        log.info("Run finished in {} ms: {} solved, {} failed, {} skipped", report.getDurationMillis(),
                report.count(UnitStatus.Status.SOLVED), report.failures().size(),
                report.count(UnitStatus.Status.SKIPPED));
        return report;
    }

    private List<UnitStatus> execute(List<Callable<UnitStatus>> units) {
        List<UnitStatus> results = new ArrayList<>(units.size());
        if (config.getParallelism() <= 1) {
            for (Callable<UnitStatus> unit : units) {
                results.add(call(unit));
            }
            return results;
        }
        ExecutorService executor = Executors.newFixedThreadPool(config.getParallelism());
        try {
            List<Future<UnitStatus>> futures = new ArrayList<>();
            for (Callable<UnitStatus> unit : units) {
                futures.add(executor.submit(() -> call(unit)));
            }
            for (Future<UnitStatus> future : futures) {
                results.add(future.get());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ModelException("Interrupted while solving", e);
        } catch (ExecutionException e) {
            throw new ModelException("Unit execution failed", e.getCause());
        } finally {
            executor.shutdownNow();
        }
        return results;
    }

    private static UnitStatus call(Callable<UnitStatus> unit) {
        try {
            return unit.call();
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new ModelException("Unit execution failed", e);
        }
    }

    UnitStatus solveIndependent(CompiledProblem problem, Scenario scenario) {
        long start = System.currentTimeMillis();
        StagingArea staging = store.openStaging(scenario.key() + "/" + problem.getName());
        UnitStatus.UnitStatusBuilder status = UnitStatus.builder()
                .scenario(scenario.key())
                .unit(problem.getName())
                .kind(UnitStatus.Kind.PROBLEM);
        try {
            SolverResult result = solveMember(problem, scenario, staging);
            status.status(UnitStatus.Status.SOLVED).objectiveValue(objectiveOf(problem, result));
            staging.promote();
            log.info("Problem '{}' scenario {}: solved{}", problem.getName(), scenario,
                    problem.isOptimized() ? ", objective " + result.getObjectiveValue() : "");
        } catch (SolverException e) {
            staging.discard();
            status.status(UnitStatus.Status.of(e.getStatus())).errorMessage(e.getMessage());
            log.warn("Problem '{}' scenario {}: {}", problem.getName(), scenario, e.getMessage());
        } catch (ModelException e) {
            staging.discard();
            status.status(UnitStatus.Status.FAILED).errorMessage(e.getMessage());
            log.error("Problem '{}' scenario {} failed: {}", problem.getName(), scenario, e.getMessage());
        }
        return status.durationMillis(System.currentTimeMillis() - start).build();
    }

    UnitStatus solveCoupled(CouplingGroup group, Scenario scenario) {
        long start = System.currentTimeMillis();
        StagingArea staging = store.openStaging(scenario.key() + "/" + group.getName());
        UnitStatus.UnitStatusBuilder status = UnitStatus.builder()
                .scenario(scenario.key())
                .unit(group.getName())
                .kind(UnitStatus.Kind.COUPLING_GROUP);
        CouplingState state = CouplingState.INIT;
        Map<String, Double> objectives = new LinkedHashMap<>();
        int iteration = 0;
        double norm = Double.POSITIVE_INFINITY;

        try {
            initialiseSharedTables(group, scenario, staging);
            Map<String, Map<Coordinate, Double>> previous = snapshot(group, scenario, staging);
            state = transition(state, CouplingState.ITERATING, group, scenario);

            int maxIterations = config.getConvergence().getMaxIterations();
            while (!state.isTerminal()) {
                if (iteration >= maxIterations || isTimedOut(start)) {
                    state = transition(state, CouplingState.MAX_ITER_EXCEEDED, group, scenario);
                    break;
                }
                iteration++;
                log.info("Coupling group '{}' scenario {}: iteration {}", group.getName(), scenario, iteration);
                for (CompiledProblem member : group.getMembers()) {
                    SolverResult result = solveMember(member, scenario, staging);
                    objectives.put(member.getName(), objectiveOf(member, result));
                }
                Map<String, Map<Coordinate, Double>> current = snapshot(group, scenario, staging);
                ConvergenceCheck check = monitor.check(iteration, previous, current);
                norm = check.getNorm();
                status.norm(norm);
                if (check.isConverged()) {
                    state = transition(state, CouplingState.CONVERGED, group, scenario);
                }
                previous = current;
            }
        } catch (SolverException e) {
            state = transition(state, CouplingState.SOLVER_FAILED, group, scenario);
            status.status(UnitStatus.Status.of(e.getStatus())).errorMessage(e.getMessage());
            log.warn("Coupling group '{}' scenario {} failed at iteration {}: {}", group.getName(), scenario,
                    iteration, e.getMessage());
        } catch (ModelException e) {
            state = transition(state, CouplingState.SOLVER_FAILED, group, scenario);
            status.status(UnitStatus.Status.FAILED).errorMessage(e.getMessage());
            log.error("Coupling group '{}' scenario {} failed at iteration {}: {}", group.getName(), scenario,
                    iteration, e.getMessage());
        }

        if (state == CouplingState.CONVERGED) {
            status.status(UnitStatus.Status.SOLVED);
            staging.promote();
        } else if (state == CouplingState.MAX_ITER_EXCEEDED) {
            ConvergenceFailureException failure = new ConvergenceFailureException(iteration, norm,
                    "Coupling group '" + group.getName() + "' did not converge after " + iteration
                            + " iteration(s), last norm " + norm + (isTimedOut(start) ? " (run timeout)" : ""));
            log.warn(failure.getMessage());
            status.status(UnitStatus.Status.NOT_CONVERGED).errorMessage(failure.getMessage());
            if (config.isBestEffortExport()) {
                log.info("Promoting best-effort values of coupling group '{}' scenario {}", group.getName(), scenario);
                staging.promote();
            } else {
                staging.discard();
            }
        } else {
            staging.discard();
        }

        return status.couplingState(state)
                .iterations(iteration)
                .finalNorm(norm)
                .memberObjectives(objectives)
                .objectiveValue(objectives.values().stream().filter(v -> v != null).mapToDouble(Double::doubleValue).sum())
                .durationMillis(System.currentTimeMillis() - start)
                .build();
    }

    /**
     * Builds and solves one problem against {@code staging} and writes its endogenous values there.
     *
     * @throws SolverException if the solver does not return an optimal solution
     */
    private SolverResult solveMember(CompiledProblem problem, Scenario scenario, StagingArea staging) {
        SolverModel solverModel = builder.build(problem, scenario, staging);
        if (solverModel.isTriviallyInfeasible()) {
            throw new SolverException(SolveStatus.INFEASIBLE, "Problem '" + problem.getName()
                    + "' has violated constant constraints: " + solverModel.getViolatedConstantRows());
        }
        SolverResult result = backend.solve(solverModel, config.solverOptions());
        if (!result.isSuccess()) {
            throw new SolverException(result.getStatus(), "Problem '" + problem.getName() + "' in scenario "
                    + scenario + ": " + result.getStatus() + (result.getMessage() == null ? "" : " (" + result.getMessage() + ")"));
        }
        solverModel.getDecisionSpace().extract(result.getValues()).forEach(staging::write);
        return result;
    }

    private void initialiseSharedTables(CouplingGroup group, Scenario scenario, StagingArea staging) {
        for (String tableName : group.getSharedTables()) {
            DataTable table = model.table(tableName);
            Coordinate inter = scenario.getCoordinate().project(table.getCoordinates());
            Map<Coordinate, Double> defaults = new LinkedHashMap<>();
            for (Coordinate dimension : domainAlgebra.filter(model.domainOf(table).dimensionPart(), Map.of()).coordinates()) {
                Coordinate full = dimension.merge(inter);
                if (staging.value(tableName, full).isEmpty()) {
                    defaults.put(full, config.getCouplingDefaultValue());
                }
            }
            if (!defaults.isEmpty()) {
                log.debug("Initialising {} value(s) of shared table '{}' to {}", defaults.size(), tableName,
                        config.getCouplingDefaultValue());
                staging.write(tableName, defaults);
            }
        }
    }

    private Map<String, Map<Coordinate, Double>> snapshot(CouplingGroup group, Scenario scenario, StagingArea staging) {
        Map<String, Map<Coordinate, Double>> values = new LinkedHashMap<>();
        for (String tableName : group.getSharedTables()) {
            Coordinate inter = scenario.getCoordinate().project(model.table(tableName).getCoordinates());
            values.put(tableName, staging.read(tableName, inter));
        }
        return values;
    }

    private boolean isTimedOut(long start) {
        return config.hasRunTimeout() && System.currentTimeMillis() - start > config.getRunTimeoutMillis();
    }

    private static Double objectiveOf(CompiledProblem problem, SolverResult result) {
        return problem.isOptimized() ? result.getObjectiveValue() : null;
    }

    private static CouplingState transition(CouplingState from, CouplingState to, CouplingGroup group, Scenario scenario) {
        if (!from.canTransitionTo(to)) {
            throw new IllegalStateException("Coupling group '" + group.getName() + "' cannot go from " + from
                    + " to " + to);
        }
        log.debug("Coupling group '{}' scenario {}: {} -> {}", group.getName(), scenario, from, to);
        return to;
    }
}
