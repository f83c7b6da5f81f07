package com.convexlab.cli.model;

import java.nio.file.Path;

import com.convexlab.modeling.binding.MissingValuePolicy;
import com.convexlab.modeling.convergence.ConvergenceNorm;
import com.convexlab.modeling.convergence.ConvergenceSettings;
import com.convexlab.modeling.convergence.NormAggregation;
import com.convexlab.modeling.orchestration.CouplingTieBreak;
import com.convexlab.modeling.runner.ResultCheck;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Holds all CLI options for the "run" command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class RunOptions {

    @Option(names = { "--model", "-m" }, required = true, description = "Path to the YAML model definition")
    private Path modelFile;

    @Option(names = { "--data-dir", "-d" }, description = "Directory with one CSV file per exogenous table")
    private Path dataDir;

    @Option(names = { "--output-dir", "-o" }, description = "Directory for result tables and the run report")
    private Path outputDir;

    @Option(names = { "--integrated" }, description = "Solve coupling groups with block Gauss-Seidel iteration")
    private boolean integrated;

    @Option(names = { "--tolerance" }, defaultValue = "" + ConvergenceSettings.DEFAULT_TOLERANCE,
            description = "Convergence tolerance (default: ${DEFAULT-VALUE})")
    private double tolerance;

    @Option(names = { "--max-iterations" }, defaultValue = "" + ConvergenceSettings.DEFAULT_MAX_ITERATIONS,
            description = "Maximum coupling iterations (default: ${DEFAULT-VALUE})")
    private int maxIterations;

    @Option(names = { "--norm" }, defaultValue = "MAX_RELATIVE",
            description = "Convergence norm: ${COMPLETION-CANDIDATES}")
    private ConvergenceNorm norm;

    @Option(names = { "--aggregation" }, defaultValue = "PER_TABLE",
            description = "Norm aggregation: ${COMPLETION-CANDIDATES}")
    private NormAggregation aggregation;

    @Option(names = { "--missing-values" }, defaultValue = "FAIL",
            description = "Missing exogenous values: ${COMPLETION-CANDIDATES}")
    private MissingValuePolicy missingValues;

    @Option(names = { "--coupling-default" }, defaultValue = "0",
            description = "Initial value of shared tables without data")
    private double couplingDefault;

    @Option(names = { "--tie-break" }, defaultValue = "DECLARATION",
            description = "Order of coupling members with equal order: ${COMPLETION-CANDIDATES}")
    private CouplingTieBreak tieBreak;

    @Option(names = { "--best-effort" }, description = "Export values of coupling groups that did not converge")
    private boolean bestEffort;

    @Option(names = { "--parallelism", "-j" }, defaultValue = "1", description = "Number of units solved concurrently")
    private int parallelism;

    @Option(names = { "--solver-timeout-ms" }, description = "Time limit per solver call in milliseconds")
    private Long solverTimeoutMillis;

    @Option(names = { "--run-timeout-ms" }, description = "Time limit per coupling group in milliseconds")
    private Long runTimeoutMillis;

    @Option(names = { "--check-against" }, description = "Directory with reference result tables to compare with")
    private Path referenceDir;

    @Option(names = { "--check-tolerance" }, defaultValue = "" + ResultCheck.DEFAULT_TOLERANCE,
            description = "Relative tolerance of the result check (default: ${DEFAULT-VALUE})")
    private double checkTolerance;

    @Option(names = { "--force", "-f" }, description = "Overwrite result files in an existing output directory")
    private boolean force;
}
