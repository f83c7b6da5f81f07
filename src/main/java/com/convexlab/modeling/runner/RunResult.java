package com.convexlab.modeling.runner;

import java.nio.file.Path;

import com.convexlab.modeling.orchestration.RunReport;

import lombok.Builder;
import lombok.Data;

/**
 * Result of an end-to-end model run.
 */
@Data
@Builder
public class RunResult {
    private boolean success;
    private String errorMessage;
    private RunReport report;
    private ResultCheck resultCheck;
    private Path outputPath;

    private int problemsCompiled;
    private int couplingGroups;
    private int scenarios;
    private int valuesLoaded;
    private int tablesExported;

    public static RunResult failure(String errorMessage) {
        return RunResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .build();
    }
}
