package com.convexlab.modeling.runner;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.convexlab.modeling.binding.VariableBinder;
import com.convexlab.modeling.build.CompiledProblem;
import com.convexlab.modeling.build.ModelValidator;
import com.convexlab.modeling.build.ProblemBuilder;
import com.convexlab.modeling.config.ModelDefinitionLoader;
import com.convexlab.modeling.convergence.ConvergenceMonitor;
import com.convexlab.modeling.domain.DomainAlgebra;
import com.convexlab.modeling.exception.ModelException;
import com.convexlab.modeling.exception.ModelValidationException;
import com.convexlab.modeling.instantiate.ExpressionInstantiator;
import com.convexlab.modeling.model.Coordinate;
import com.convexlab.modeling.model.ModelDefinition;
import com.convexlab.modeling.model.ResolvedRole;
import com.convexlab.modeling.operator.ConstantRegistry;
import com.convexlab.modeling.operator.OperatorRegistry;
import com.convexlab.modeling.orchestration.RoleResolver;
import com.convexlab.modeling.orchestration.RunReport;
import com.convexlab.modeling.orchestration.SolveMode;
import com.convexlab.modeling.orchestration.SolverOrchestrator;
import com.convexlab.modeling.orchestration.UnitStatus;
import com.convexlab.modeling.report.RunReportRenderer;
import com.convexlab.modeling.scenario.Scenario;
import com.convexlab.modeling.scenario.ScenarioEnumerator;
import com.convexlab.modeling.solver.OjAlgoSolverBackend;
import com.convexlab.modeling.solver.SolverBackend;
import com.convexlab.modeling.store.CsvTableIO;
import com.convexlab.modeling.store.InMemoryTableStore;
import com.convexlab.modeling.store.TableStore;

import freemarker.template.TemplateException;

/**
 * Runs a model end to end: load the definition, validate every problem, load
 * exogenous data, solve and export the endogenous tables. A run can end by
 * checking the results against a reference dataset.
 *
 * The steps are also exposed individually for embedding.
 */
public class ModelRunner {
    private static final Logger log = LoggerFactory.getLogger(ModelRunner.class);

    private final RunnerConfig config;
    private final SolverBackend backend;
    private final OperatorRegistry operators;
    private final ConstantRegistry constants;
    private final TableStore store;

    private ModelDefinition model;
    private Map<String, CompiledProblem> problems;
    private ProblemBuilder problemBuilder;

    public ModelRunner(RunnerConfig config) {
        this(config, new OjAlgoSolverBackend(), OperatorRegistry.withDefaults(), ConstantRegistry.withDefaults(),
                new InMemoryTableStore());
    }

    public ModelRunner(RunnerConfig config, SolverBackend backend, OperatorRegistry operators,
            ConstantRegistry constants, TableStore store) {
        this.config = config;
        this.backend = backend;
        this.operators = operators;
        this.constants = constants;
        this.store = store;
    }

    /**
     * Runs every step and reports failures through the result instead of throwing.
     */
    public RunResult run() {
        try {
            log.info("Starting model run...");

            log.info("Step 1: Loading model definition...");
            initialize(new ModelDefinitionLoader().load(config.getModelFile()));

            log.info("Step 2: Validating problems...");
            generateProblems();

            int loaded = 0;
            if (config.getDataDir() != null) {
                log.info("Step 3: Loading exogenous data...");
                loaded = loadExogenousData(config.getDataDir());
            } else {
                log.info("Step 3: No data directory, skipping exogenous data");
            }

            log.info("Step 4: Solving in {} mode...", config.getMode());
            SolverOrchestrator orchestrator = new SolverOrchestrator(model, problems, problemBuilder, backend, store,
                    config.getOrchestrator());
            RunReport report = orchestrator.run(config.getMode());

            int exported = 0;
            if (config.getOutputDir() != null) {
                log.info("Step 5: Exporting results...");
                exported = exportResults(config.getOutputDir(), report);
                if (config.getReportFileName() != null) {
                    renderReport(report, config.getOutputDir().resolve(config.getReportFileName()));
                }
            }

            ResultCheck check = null;
            if (config.getReferenceDir() != null) {
                log.info("Step 6: Checking results against {}...", config.getReferenceDir());
                check = checkResults(config.getReferenceDir(), config.getCheckTolerance());
            }

            String errorMessage = null;
            if (!report.isAllSolved()) {
                errorMessage = report.failures().size() + " unit(s) did not solve";
            } else if (check != null && !check.isPassed()) {
                errorMessage = check.getMismatches().size() + " value(s) differ from the reference results";
            }

            return RunResult.builder()
                    .success(errorMessage == null)
                    .errorMessage(errorMessage)
                    .report(report)
                    .resultCheck(check)
                    .outputPath(config.getOutputDir())
                    .problemsCompiled(problems.size())
                    .couplingGroups(orchestrator.getGroups().size())
                    .scenarios(new ScenarioEnumerator().enumerate(model.interProblemSets()).size())
                    .valuesLoaded(loaded)
                    .tablesExported(exported)
                    .build();

        } catch (ModelValidationException e) {
            log.error("Model definition is invalid:");
            e.getErrors().forEach(error -> log.error("  - {}", error));
            return RunResult.failure(e.getMessage());
        } catch (ModelException e) {
            log.error("Model run failed: {}", e.getMessage());
            return RunResult.failure(e.getMessage());
        } catch (IOException | TemplateException e) {
            log.error("Model run failed with I/O error", e);
            return RunResult.failure(e.getMessage());
        }
    }

    public void initialize(ModelDefinition model) {
        this.model = model;
        this.problems = null;
        this.problemBuilder = null;
    }

    /**
     * Validates every problem against the structure of the model.
     *
     * @throws ModelException on the first invalid problem
     */
    public Map<String, CompiledProblem> generateProblems() {
        requireModel();
        VariableBinder binder = new VariableBinder(model, new DomainAlgebra(), constants,
                config.getOrchestrator().getMissingValues());
        problems = new ModelValidator(model, binder, operators).validate();
        problemBuilder = new ProblemBuilder(model, binder, new ExpressionInstantiator(operators));
        log.info("Validated {} problem(s)", problems.size());
        return problems;
    }

    public int loadExogenousData(Path directory) throws IOException {
        requireModel();
        if (!Files.isDirectory(directory)) {
            throw new IOException("Data directory does not exist: " + directory);
        }
        return new CsvTableIO(model).loadAll(directory, store);
    }

    public RunReport solve(SolveMode mode) {
        if (problems == null) {
            generateProblems();
        }
        return new SolverOrchestrator(model, problems, problemBuilder, backend, store, config.getOrchestrator())
                .run(mode);
    }

    /**
     * Writes every table that is endogenous in at least one problem. Only the
     * scenario slices of units that solved are written, plus those of
     * non-converged coupling groups when best-effort export is enabled.
     *
     * @return number of tables written
     */
    public int exportResults(Path directory, RunReport report) throws IOException {
        if (problems == null) {
            generateProblems();
        }
        RoleResolver roles = new RoleResolver(model, config.getOrchestrator().getTieBreak());
        Map<String, Map<Coordinate, Double>> values = new LinkedHashMap<>();
        for (CompiledProblem problem : problems.values()) {
            endogenousTables(roles, problem).forEach(table -> values.putIfAbsent(table, new LinkedHashMap<>()));
        }

        Map<String, Scenario> scenarios = new LinkedHashMap<>();
        new ScenarioEnumerator().enumerate(model.interProblemSets()).forEach(s -> scenarios.put(s.key(), s));
        for (UnitStatus unit : report.getUnits()) {
            if (!isExportable(unit)) {
                log.debug("Not exporting unit '{}' of scenario {} ({})", unit.getUnit(), unit.getScenario(),
                        unit.getStatus());
                continue;
            }
            Scenario scenario = scenarios.get(unit.getScenario());
            for (String table : unitTables(roles, unit)) {
                Coordinate slice = scenario.getCoordinate().project(model.table(table).getCoordinates());
                values.get(table).putAll(store.read(table, slice));
            }
        }

        CsvTableIO io = new CsvTableIO(model);
        for (Map.Entry<String, Map<Coordinate, Double>> entry : values.entrySet()) {
            io.export(model.table(entry.getKey()), entry.getValue(), directory.resolve(entry.getKey() + ".csv"));
        }
        log.info("Exported {} table(s) to {}", values.size(), directory);
        return values.size();
    }

    private boolean isExportable(UnitStatus unit) {
        return unit.getStatus() == UnitStatus.Status.SOLVED
                || (unit.getStatus() == UnitStatus.Status.NOT_CONVERGED
                        && config.getOrchestrator().isBestEffortExport());
    }

    private Set<String> unitTables(RoleResolver roles, UnitStatus unit) {
        Set<String> tables = new LinkedHashSet<>();
        if (unit.getKind() == UnitStatus.Kind.PROBLEM) {
            CompiledProblem problem = problems.get(unit.getUnit());
            if (problem != null) {
                tables.addAll(endogenousTables(roles, problem));
            }
        } else {
            for (CompiledProblem problem : problems.values()) {
                if (unit.getUnit().equals(problem.getDefinition().getCouplingGroup())) {
                    tables.addAll(endogenousTables(roles, problem));
                }
            }
        }
        return tables;
    }

    private static Set<String> endogenousTables(RoleResolver roles, CompiledProblem problem) {
        Set<String> tables = new LinkedHashSet<>();
        roles.rolesIn(problem).forEach((table, role) -> {
            if (role == ResolvedRole.ENDOGENOUS) {
                tables.add(table);
            }
        });
        return tables;
    }

    /**
     * Compares every endogenous table with {@code <table>.csv} in the reference
     * directory. A value mismatches when its relative difference exceeds the
     * tolerance or when it exists on one side only.
     *
     * @throws IOException if a reference file is missing or unreadable
     */
    public ResultCheck checkResults(Path referenceDir, double tolerance) throws IOException {
        if (problems == null) {
            generateProblems();
        }
        RoleResolver roles = new RoleResolver(model, config.getOrchestrator().getTieBreak());
        Set<String> tables = new LinkedHashSet<>();
        problems.values().forEach(problem -> tables.addAll(endogenousTables(roles, problem)));

        CsvTableIO io = new CsvTableIO(model);
        TableStore reference = new InMemoryTableStore();
        ResultCheck.ResultCheckBuilder check = ResultCheck.builder()
                .tolerance(tolerance)
                .tablesChecked(tables.size());
        int compared = 0;
        for (String table : tables) {
            Path file = referenceDir.resolve(table + ".csv");
            if (!Files.isRegularFile(file)) {
                throw new IOException("Reference file does not exist: " + file);
            }
            io.load(model.table(table), file, reference);

            Map<Coordinate, Double> expected = reference.read(table);
            Map<Coordinate, Double> actual = store.read(table);
            Set<Coordinate> coordinates = new LinkedHashSet<>(expected.keySet());
            coordinates.addAll(actual.keySet());
            for (Coordinate coordinate : coordinates) {
                Double want = expected.get(coordinate);
                Double got = actual.get(coordinate);
                double difference = want == null || got == null
                        ? Double.POSITIVE_INFINITY
                        : ConvergenceMonitor.relativeDifference(want, got);
                if (difference > tolerance) {
                    check.mismatch(new ResultCheck.Mismatch(table, coordinate, want, got, difference));
                }
                compared++;
            }
        }

        ResultCheck result = check.valuesChecked(compared).build();
        if (result.isPassed()) {
            log.info("Results match {} within tolerance {} ({} value(s) in {} table(s))", referenceDir, tolerance,
                    compared, tables.size());
        } else {
            log.warn("{} value(s) differ from {} beyond tolerance {}", result.getMismatches().size(), referenceDir,
                    tolerance);
            result.getMismatches().forEach(mismatch -> log.warn("  - {}", mismatch));
        }
        return result;
    }

    public void renderReport(RunReport report, Path file) throws IOException, TemplateException {
        new RunReportRenderer().write(report, file);
    }

    public ModelDefinition getModel() {
        return model;
    }

    public TableStore getStore() {
        return store;
    }

    private void requireModel() {
        if (model == null) {
            throw new IllegalStateException("No model loaded, call initialize first");
        }
    }
}
