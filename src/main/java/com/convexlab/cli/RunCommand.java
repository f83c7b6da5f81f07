package com.convexlab.cli;

import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.convexlab.cli.exception.OptionsValidationException;
import com.convexlab.cli.model.RunOptions;
import com.convexlab.cli.model.ValidatedRunOptions;
import com.convexlab.cli.output.RunResultsPrinter;
import com.convexlab.cli.validation.RunOptionsValidator;
import com.convexlab.modeling.runner.ModelRunner;
import com.convexlab.modeling.runner.RunResult;
import com.convexlab.modeling.runner.RunnerConfig;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * CLI command for loading, solving and exporting a model.
 */
@Command(
        name = "run",
        mixinStandardHelpOptions = true,
        version = "convexlab-engine 1.0.0",
        description = "Expands a set-indexed model into solver problems, solves every scenario and exports the endogenous tables."
)
public class RunCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RunCommand.class);

    @Mixin
    private RunOptions options = new RunOptions();

    private final RunOptionsValidator validator = new RunOptionsValidator();
    private final RunResultsPrinter printer = new RunResultsPrinter();

    @Override
    public Integer call() {
        try {
            ValidatedRunOptions validated = validator.validate(options);
            printer.printBanner(validated);

            RunnerConfig config = RunnerConfig.builder()
                    .modelFile(validated.getModelFile())
                    .dataDir(validated.getDataDir())
                    .outputDir(validated.getOutputDir())
                    .mode(validated.getMode())
                    .orchestrator(validated.getOrchestratorConfig())
                    .referenceDir(validated.getReferenceDir())
                    .checkTolerance(validated.getCheckTolerance())
                    .build();

            RunResult result = new ModelRunner(config).run();
            if (!result.isSuccess()) {
                printer.printFailure(result);
                return 1;
            }

            printer.printSuccess(result);
            return 0;

        } catch (OptionsValidationException e) {
            log.error("Invalid options:");
            e.getErrors().forEach(error -> log.error("  - {}", error));
            return 1;
        } catch (Exception e) {
            log.error("Run failed with exception", e);
            return 1;
        }
    }
}
