package com.convexlab.modeling.runner;

import java.nio.file.Path;

import com.convexlab.modeling.orchestration.OrchestratorConfig;
import com.convexlab.modeling.orchestration.SolveMode;

import lombok.Builder;
import lombok.Data;

/**
 * Configuration for one end-to-end model run.
 */
@Data
@Builder
public class RunnerConfig {
    private Path modelFile;
    private Path dataDir;
    private Path outputDir;

    @Builder.Default
    private SolveMode mode = SolveMode.INDEPENDENT;

    @Builder.Default
    private OrchestratorConfig orchestrator = OrchestratorConfig.defaults();

    /**
     * Name of the rendered run report inside {@link #outputDir}; {@code null} disables it.
     */
    @Builder.Default
    private String reportFileName = "run-report.txt";

    /**
     * Directory with reference result tables; {@code null} skips the result check.
     */
    private Path referenceDir;

    @Builder.Default
    private double checkTolerance = ResultCheck.DEFAULT_TOLERANCE;
}
