package com.convexlab.modeling.runner;

import com.convexlab.modeling.config.ModelDefinitionLoader;
import com.convexlab.modeling.model.Coordinate;
import com.convexlab.modeling.orchestration.SolveMode;
import com.convexlab.modeling.orchestration.UnitStatus;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Integration tests for a complete run: YAML model, CSV data, solve and export.
 */
class ModelRunnerTest {

    private static final String DISPATCH_MODEL = """
            sets:
              tech:
                items: [coal, gas, solar]
              year:
                items: [2030, 2040]
                split_problem: true
            tables:
              cost:
                coordinates: [tech]
                variables:
                  c:
                    rows: tech
              capacity:
                coordinates: [tech]
                variables:
                  cap:
                    rows: tech
              demand:
                coordinates: [year]
                variables:
                  d: {}
              supply:
                coordinates: [tech, year]
                type: endogenous
                variables:
                  s:
                    rows: tech
            problems:
              dispatch:
                expressions:
                  - "sum(s) >= d"
                  - "s <= cap"
                  - "s >= 0"
                objective: "Minimize(tran(c) @ s)"
            """;

    @TempDir
    Path tempDir;

    private Path writeInputs(String model, String demand) throws IOException {
        Path dataDir = tempDir.resolve("data");
        Files.createDirectories(dataDir);
        Files.writeString(dataDir.resolve("cost.csv"), "tech,value\ncoal,30\ngas,50\nsolar,5\n");
        Files.writeString(dataDir.resolve("capacity.csv"), "tech,value\ncoal,100\ngas,100\nsolar,40\n");
        Files.writeString(dataDir.resolve("demand.csv"), demand);
        Path modelFile = tempDir.resolve("model.yaml");
        Files.writeString(modelFile, model);
        return modelFile;
    }

    private RunnerConfig config(Path modelFile) {
        return RunnerConfig.builder()
                .modelFile(modelFile)
                .dataDir(tempDir.resolve("data"))
                .outputDir(tempDir.resolve("out"))
                .build();
    }

    @Test
    void testRunSolvesAndExports() throws IOException {
        Path modelFile = writeInputs(DISPATCH_MODEL, "year,value\n2030,120\n2040,150\n");

        RunResult result = new ModelRunner(config(modelFile)).run();

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getProblemsCompiled()).isEqualTo(1);
        assertThat(result.getCouplingGroups()).isZero();
        assertThat(result.getScenarios()).isEqualTo(2);
        assertThat(result.getValuesLoaded()).isEqualTo(8);
        assertThat(result.getTablesExported()).isEqualTo(1);
        assertThat(result.getReport().count(UnitStatus.Status.SOLVED)).isEqualTo(2);

        Path out = tempDir.resolve("out");
        assertThat(out.resolve("supply.csv")).exists();
        assertThat(Files.readAllLines(out.resolve("supply.csv")))
                .first().isEqualTo("tech,year,value");
        assertThat(Files.readAllLines(out.resolve("supply.csv"))).hasSize(7);
        assertThat(Files.readString(out.resolve("run-report.txt")))
                .contains("Run Report (INDEPENDENT)")
                .contains("ALL UNITS SOLVED");
    }

    @Test
    void testInfeasibleScenarioFailsRun() throws IOException {
        Path modelFile = writeInputs(DISPATCH_MODEL, "year,value\n2030,120\n2040,300\n");

        RunResult result = new ModelRunner(config(modelFile)).run();

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrorMessage()).isEqualTo("1 unit(s) did not solve");
        assertThat(result.getReport().find("{year=2040}", "dispatch").isFailure()).isTrue();
        assertThat(Files.readString(tempDir.resolve("out").resolve("run-report.txt")))
                .contains("FAILURES PRESENT");
    }

    @Test
    void testFailedScenarioIsNotExported() throws IOException {
        Path modelFile = writeInputs(DISPATCH_MODEL, "year,value\n2030,120\n2040,999\n");
        Files.writeString(tempDir.resolve("data").resolve("supply.csv"),
                "tech,year,value\ncoal,2040,7\ngas,2040,7\nsolar,2040,7\n");

        RunResult result = new ModelRunner(config(modelFile)).run();

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getReport().find("{year=2040}", "dispatch").isFailure()).isTrue();
        assertThat(result.getTablesExported()).isEqualTo(1);
        assertThat(Files.readAllLines(tempDir.resolve("out").resolve("supply.csv")))
                .hasSize(4)
                .noneMatch(line -> line.contains(",2040,"))
                .anyMatch(line -> line.startsWith("solar,2030,"));
    }

    private Path writeReference(String rows) throws IOException {
        Path reference = Files.createDirectories(tempDir.resolve("expected"));
        Files.writeString(reference.resolve("supply.csv"), "tech,year,value\n" + rows);
        return reference;
    }

    @Test
    void testResultCheckPassesWithinTolerance() throws IOException {
        Path modelFile = writeInputs(DISPATCH_MODEL, "year,value\n2030,120\n2040,150\n");
        Path reference = writeReference("""
                coal,2030,81
                gas,2030,0
                solar,2030,40
                coal,2040,100
                gas,2040,10
                solar,2040,40
                """);
        RunnerConfig config = config(modelFile);
        config.setReferenceDir(reference);

        RunResult result = new ModelRunner(config).run();

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getResultCheck().isPassed()).isTrue();
        assertThat(result.getResultCheck().getTablesChecked()).isEqualTo(1);
        assertThat(result.getResultCheck().getValuesChecked()).isEqualTo(6);
        assertThat(result.getResultCheck().getTolerance()).isEqualTo(ResultCheck.DEFAULT_TOLERANCE);
    }

    @Test
    void testResultCheckReportsMismatches() throws IOException {
        Path modelFile = writeInputs(DISPATCH_MODEL, "year,value\n2030,120\n2040,150\n");
        ModelRunner runner = new ModelRunner(config(modelFile));
        runner.initialize(new ModelDefinitionLoader().load(modelFile));
        runner.loadExogenousData(tempDir.resolve("data"));
        assertThat(runner.solve(SolveMode.INDEPENDENT).isAllSolved()).isTrue();

        Path reference = writeReference("""
                coal,2030,80
                gas,2030,0
                solar,2030,40
                coal,2040,100
                gas,2040,20
                """);
        ResultCheck check = runner.checkResults(reference, 0.02);

        assertThat(check.isPassed()).isFalse();
        assertThat(check.getMismatches()).hasSize(2);
        assertThat(check.getMismatches().get(0).getCoordinate())
                .isEqualTo(Coordinate.of(Map.of("tech", "gas", "year", "2040")));
        assertThat(check.getMismatches().get(0).getDifference()).isCloseTo(0.5, within(1e-6));
        assertThat(check.getMismatches().get(1).getExpected()).isNull();
        assertThat(check.getMismatches().get(1).getDifference()).isInfinite();

        assertThat(runner.checkResults(reference, 1.0).getMismatches()).hasSize(1);
        assertThatThrownBy(() -> runner.checkResults(tempDir.resolve("data"), 0.02))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("supply.csv");
    }

    @Test
    void testDimensionMismatchFailsBeforeSolving() throws IOException {
        Path modelFile = writeInputs(DISPATCH_MODEL.replace("\"s <= cap\"", "\"s <= tran(cap)\""),
                "year,value\n2030,120\n2040,150\n");

        RunResult result = new ModelRunner(config(modelFile)).run();

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrorMessage()).contains("s <= tran(cap)");
        assertThat(result.getReport()).isNull();
        assertThat(tempDir.resolve("out")).doesNotExist();
    }

    @Test
    void testInvalidModelReportsAllErrors() throws IOException {
        Path modelFile = tempDir.resolve("broken.yaml");
        Files.writeString(modelFile, """
                sets:
                  empty:
                    items: []
                problems:
                  p: {}
                """);

        RunResult result = new ModelRunner(RunnerConfig.builder().modelFile(modelFile).build()).run();

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrorMessage())
                .contains("set 'empty' has no items")
                .contains("problem 'p' declares no expressions");
    }

    @Test
    void testStepByStep() throws IOException {
        Path modelFile = writeInputs(DISPATCH_MODEL, "year,value\n2030,120\n2040,150\n");
        ModelRunner runner = new ModelRunner(config(modelFile));

        assertThatThrownBy(runner::generateProblems).isInstanceOf(IllegalStateException.class);

        runner.initialize(new ModelDefinitionLoader().load(modelFile));
        assertThat(runner.generateProblems()).containsOnlyKeys("dispatch");
        assertThat(runner.loadExogenousData(tempDir.resolve("data"))).isEqualTo(8);
        assertThat(runner.solve(SolveMode.INDEPENDENT).isAllSolved()).isTrue();
        assertThat(runner.getStore().value("supply", Coordinate.of(Map.of("tech", "solar", "year", "2040"))))
                .hasValueSatisfying(v -> assertThat(v).isCloseTo(40.0, within(1e-6)));

        assertThatThrownBy(() -> runner.loadExogenousData(tempDir.resolve("missing")))
                .isInstanceOf(IOException.class);
    }
}
