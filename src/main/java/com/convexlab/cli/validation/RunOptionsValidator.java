package com.convexlab.cli.validation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

import com.convexlab.cli.exception.OptionsValidationException;
import com.convexlab.cli.model.RunOptions;
import com.convexlab.cli.model.ValidatedRunOptions;
import com.convexlab.modeling.convergence.ConvergenceSettings;
import com.convexlab.modeling.orchestration.OrchestratorConfig;
import com.convexlab.modeling.orchestration.SolveMode;

public class RunOptionsValidator {

    public ValidatedRunOptions validate(RunOptions o) {
        List<String> errors = new ArrayList<>();

        if (o.getModelFile() == null) {
            errors.add("Model definition is required (--model / -m).");
        } else if (!Files.isRegularFile(o.getModelFile())) {
            errors.add("Model definition does not exist: " + o.getModelFile());
        }

        if (o.getDataDir() != null && !existsDirectory(o.getDataDir())) {
            errors.add("Data directory does not exist or is not a directory: " + o.getDataDir());
        }

        if (!(o.getTolerance() > 0) || Double.isInfinite(o.getTolerance())) {
            errors.add("Tolerance must be a positive number. Got: " + o.getTolerance());
        }
        if (o.getMaxIterations() < 1) {
            errors.add("Max iterations must be >= 1. Got: " + o.getMaxIterations());
        }
        if (o.getParallelism() < 1) {
            errors.add("Parallelism must be >= 1. Got: " + o.getParallelism());
        }
        if (o.getSolverTimeoutMillis() != null && o.getSolverTimeoutMillis() <= 0) {
            errors.add("Solver timeout must be > 0. Got: " + o.getSolverTimeoutMillis());
        }
        if (o.getRunTimeoutMillis() != null && o.getRunTimeoutMillis() <= 0) {
            errors.add("Run timeout must be > 0. Got: " + o.getRunTimeoutMillis());
        }
        if (o.getReferenceDir() != null && !existsDirectory(o.getReferenceDir())) {
            errors.add("Reference directory does not exist or is not a directory: " + o.getReferenceDir());
        }
        if (!(o.getCheckTolerance() >= 0) || Double.isInfinite(o.getCheckTolerance())) {
            errors.add("Check tolerance must be a non-negative number. Got: " + o.getCheckTolerance());
        }
        if (o.isBestEffort() && !o.isIntegrated()) {
            errors.add("--best-effort only applies to integrated runs (--integrated).");
        }

        Path outputDir = o.getOutputDir() == null ? null : o.getOutputDir().toAbsolutePath().normalize();
        if (outputDir != null && Files.exists(outputDir)) {
            if (!Files.isDirectory(outputDir)) {
                errors.add("Output path is not a directory: " + outputDir);
            } else if (!o.isForce() && !isEmptyDirectory(outputDir)) {
                errors.add("Output directory is not empty: " + outputDir + ". Use --force to overwrite.");
            }
        }

        if (!errors.isEmpty()) {
            throw new OptionsValidationException(errors);
        }

        OrchestratorConfig config = OrchestratorConfig.builder()
                .convergence(ConvergenceSettings.builder()
                        .norm(o.getNorm())
                        .aggregation(o.getAggregation())
                        .tolerance(o.getTolerance())
                        .maxIterations(o.getMaxIterations())
                        .build())
                .missingValues(o.getMissingValues())
                .couplingDefaultValue(o.getCouplingDefault())
                .bestEffortExport(o.isBestEffort())
                .parallelism(o.getParallelism())
                .solverTimeoutMillis(o.getSolverTimeoutMillis())
                .runTimeoutMillis(o.getRunTimeoutMillis())
                .tieBreak(o.getTieBreak())
                .build();

        return new ValidatedRunOptions(o.getModelFile().toAbsolutePath().normalize(),
                o.getDataDir() == null ? null : o.getDataDir().toAbsolutePath().normalize(), outputDir,
                o.isIntegrated() ? SolveMode.INTEGRATED : SolveMode.INDEPENDENT, config,
                o.getReferenceDir() == null ? null : o.getReferenceDir().toAbsolutePath().normalize(),
                o.getCheckTolerance());
    }

    private static boolean existsDirectory(Path p) {
        return p != null && Files.exists(p) && Files.isDirectory(p);
    }

    private static boolean isEmptyDirectory(Path p) {
        try (Stream<Path> entries = Files.list(p)) {
            return entries.findAny().isEmpty();
        } catch (IOException e) {
            return false;
        }
    }
}
