package com.convexlab.cli.output;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.convexlab.cli.model.ValidatedRunOptions;
import com.convexlab.modeling.convergence.ConvergenceSettings;
import com.convexlab.modeling.orchestration.RunReport;
import com.convexlab.modeling.orchestration.SolveMode;
import com.convexlab.modeling.orchestration.UnitStatus;
import com.convexlab.modeling.runner.ResultCheck;
import com.convexlab.modeling.runner.RunResult;

/**
 * Responsible only for printing CLI output for the "run" command.
 * No validation, no execution.
 */
public class RunResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(RunResultsPrinter.class);

    public void printBanner(ValidatedRunOptions v) {
        ConvergenceSettings convergence = v.getOrchestratorConfig().getConvergence();
        log.info("=================================================");
        log.info("ConvexLab Model Runner");
        log.info("=================================================");
        log.info("Model: {}", v.getModelFile());
        log.info("Data Directory: {}", v.getDataDir() != null ? v.getDataDir() : "None");
        log.info("Output Directory: {}", v.getOutputDir() != null ? v.getOutputDir() : "None (results not exported)");
        log.info("Mode: {}", v.getMode());
        log.info("Missing Values: {}", v.getOrchestratorConfig().getMissingValues());
        log.info("Parallelism: {}", v.getOrchestratorConfig().getParallelism());
        if (v.getReferenceDir() != null) {
            log.info("Reference Results: {} (tolerance {})", v.getReferenceDir(), v.getCheckTolerance());
        }
        if (v.getMode() == SolveMode.INTEGRATED) {
            log.info("-------------------------------------------------");
            log.info("Convergence:");
            log.info("  Norm: {} ({})", convergence.getNorm(), convergence.getAggregation());
            log.info("  Tolerance: {}", convergence.getTolerance());
            log.info("  Max Iterations: {}", convergence.getMaxIterations());
            log.info("  Best Effort Export: {}", v.getOrchestratorConfig().isBestEffortExport());
        }
        log.info("=================================================");
    }

    public void printSuccess(RunResult result) {
        log.info("");
        log.info("=================================================");
        log.info("RUN SUCCESSFUL");
        log.info("=================================================");
        printSummary(result);
        log.info("=================================================");
    }

    public void printFailure(RunResult result) {
        log.error("Run failed: {}", result.getErrorMessage());
        if (result.getReport() == null) {
            return;
        }
        printSummary(result);
        for (UnitStatus unit : result.getReport().failures()) {
            log.error("  {} / {}: {}{}", unit.getScenario(), unit.getUnit(), unit.getStatus(),
                    unit.getErrorMessage() != null ? " - " + unit.getErrorMessage() : "");
        }
        if (result.getResultCheck() != null) {
            result.getResultCheck().getMismatches().forEach(mismatch -> log.error("  {}", mismatch));
        }
    }

    private void printSummary(RunResult result) {
        RunReport report = result.getReport();
        log.info("Problems Compiled: {}", result.getProblemsCompiled());
        log.info("Coupling Groups: {}", result.getCouplingGroups());
        log.info("Scenarios: {}", result.getScenarios());
        log.info("Values Loaded: {}", result.getValuesLoaded());
        log.info("");
        log.info("Units:");
        for (UnitStatus.Status status : UnitStatus.Status.values()) {
            long count = report.count(status);
            if (count > 0) {
                log.info("  {}: {}", status, count);
            }
        }
        log.info("Duration: {} ms", report.getDurationMillis());
        if (result.getOutputPath() != null) {
            log.info("");
            log.info("Output Path: {}", result.getOutputPath());
            log.info("Tables Exported: {}", result.getTablesExported());
        }
        ResultCheck check = result.getResultCheck();
        if (check != null) {
            log.info("Result Check: {} ({} value(s), {} mismatch(es))", check.isPassed() ? "PASSED" : "FAILED",
                    check.getValuesChecked(), check.getMismatches().size());
        }
    }
}
