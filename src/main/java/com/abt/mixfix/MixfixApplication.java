package com.abt.mixfix;

import com.abt.mixfix.cli.NotationCommand;
import picocli.CommandLine;

/**
 * Main entry point for the mixfix notation tool.
 * Parses expressions of the example languages and prints them in any output
 * mode, optionally reducing lambda terms step by step.
 */
public class MixfixApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new NotationCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }
}
