package com.convexlab.cli.model;

import java.nio.file.Path;

import com.convexlab.modeling.orchestration.OrchestratorConfig;
import com.convexlab.modeling.orchestration.SolveMode;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the runner. Keeps RunCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedRunOptions {
    Path modelFile;
    Path dataDir;
    Path outputDir;
    SolveMode mode;
    OrchestratorConfig orchestratorConfig;
    Path referenceDir;
    double checkTolerance;
}
