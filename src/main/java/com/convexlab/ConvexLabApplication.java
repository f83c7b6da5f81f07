package com.convexlab;

import com.convexlab.cli.RunCommand;
import picocli.CommandLine;

/**
 * Main entry point for the ConvexLab modeling engine.
 * Expands set-indexed model definitions into concrete solver problems and
 * solves them per scenario, independently or as coupled groups.
 */
public class ConvexLabApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new RunCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }
}
